package org.lokray.fixcheck;

import org.lokray.fixcheck.analysis.AnalysisResult;
import org.lokray.fixcheck.analysis.Analyzer;
import org.lokray.fixcheck.error.FixedPointException;
import org.lokray.fixcheck.semantic.BuiltInTypeLoader;
import org.lokray.fixcheck.semantic.IdentifierTable;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point: reads one Verilog file, analyzes it and prints the report.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	static final int EXIT_OK = 0;
	static final int EXIT_USAGE = 1;
	static final int EXIT_IO = 2;

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	static int run(String[] args)
	{
		CheckerArguments arguments = CheckerArguments.parse(args);

		if (arguments.isHelpFlag())
		{
			CheckerArguments.printUsage();
			return arguments.isInvalid() ? EXIT_USAGE : EXIT_OK;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("fixcheck (fixed-point checker) version " + VERSION);
			return EXIT_OK;
		}

		Debug.ENABLE_DEBUG = arguments.isVerboseFlag();
		Debug.ENABLE_COLOR = !arguments.isNoColorFlag();

		Path input = arguments.getInputFile();
		if (!Files.exists(input))
		{
			Debug.logError("Input file not found: " + input);
			return EXIT_IO;
		}

		try
		{
			SourceLoader loader = new SourceLoader(input);
			loader.load();
			List<String> lines = loader.getLines();

			Analyzer analyzer = new Analyzer(arguments.getMode(), loadBuiltIns(arguments));
			IdentifierTable table = analyzer.buildTable(lines);
			Debug.logDebug("Analyzing " + lines.size() + " line(s) in " + arguments.getMode().name().toLowerCase() + " mode");
			List<AnalysisResult> results = analyzer.analyze(lines, table);

			ReportPrinter.print(input.toString(), results);

			if (arguments.getJsonOutput() != null)
			{
				JsonReportWriter.write(JsonReportWriter.toDTO(input.toString(), arguments.getMode(), table.getWarnings(), results),
						arguments.getJsonOutput());
			}
			return EXIT_OK;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
			return EXIT_IO;
		}
	}

	/**
	 * Bundled constants, extended by the --builtins file when one is given.
	 */
	private static Map<String, FixedPointType> loadBuiltIns(CheckerArguments arguments)
	{
		Map<String, FixedPointType> builtIns = new LinkedHashMap<>(BuiltInTypeLoader.loadDefaults());
		Path extra = arguments.getBuiltInsFile();
		if (extra != null)
		{
			try
			{
				builtIns.putAll(BuiltInTypeLoader.loadFile(extra));
			}
			catch (IOException | IllegalArgumentException | FixedPointException e)
			{
				Debug.logWarning("Failed to load built-ins: " + extra.getFileName() + " | Reason: " + e.getMessage());
			}
		}
		return builtIns;
	}
}
