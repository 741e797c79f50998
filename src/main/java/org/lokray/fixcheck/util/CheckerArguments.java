package org.lokray.fixcheck.util;

import org.lokray.fixcheck.semantic.EvaluationMode;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the checker.
 */
public class CheckerArguments
{
	private Path inputFile = null;
	private Path jsonOutput = null;
	private Path builtInsFile = null;
	private EvaluationMode mode = EvaluationMode.STRICT;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean noColorFlag = false;
	private boolean invalid = false;

	// Private constructor, use parse()
	private CheckerArguments()
	{
	}

	public static CheckerArguments parse(String[] args)
	{
		CheckerArguments parsedArgs = new CheckerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			parsedArgs.invalid = true;
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					continue;
				}
				if (arg.equals("--no-color"))
				{
					parsedArgs.noColorFlag = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-m") || arg.equals("--mode"))
				{
					parsedArgs.mode = EvaluationMode.fromName(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-j") || arg.equals("--json"))
				{
					parsedArgs.jsonOutput = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-b") || arg.equals("--builtins"))
				{
					parsedArgs.builtInsFile = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one input file is supported, got " + parsedArgs.inputFile + " and " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}

			if (parsedArgs.inputFile == null)
			{
				throw new IllegalArgumentException("No input file provided.");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.invalid = true;
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Fixed-point arithmetic checker for annotated Verilog.");
		System.out.println("\nUSAGE: fixcheck [options] <verilog_file>");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -m, --mode <mode>         Operator semantics: strict (default) or truncating.");
		System.out.println("  -j, --json <file>         Also write the results as JSON.");
		System.out.println("  -b, --builtins <file>     Load extra built-in constants from a JSON file.");
		System.out.println("  --no-color                Disable ANSI colours in the report.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getJsonOutput()
	{
		return jsonOutput;
	}

	public Path getBuiltInsFile()
	{
		return builtInsFile;
	}

	public EvaluationMode getMode()
	{
		return mode;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isNoColorFlag()
	{
		return noColorFlag;
	}

	/**
	 * True when the arguments could not be parsed; help is shown and the process exits with an error.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}
}
