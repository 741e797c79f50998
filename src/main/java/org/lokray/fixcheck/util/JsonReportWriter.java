package org.lokray.fixcheck.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.fixcheck.analysis.AnalysisResult;
import org.lokray.fixcheck.analysis.StatementResult;
import org.lokray.fixcheck.analysis.Status;
import org.lokray.fixcheck.dto.ReportDTO;
import org.lokray.fixcheck.dto.ResultDTO;
import org.lokray.fixcheck.dto.StatementDTO;
import org.lokray.fixcheck.semantic.EvaluationMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * Writes the analysis results as a pretty-printed JSON document.
 */
public class JsonReportWriter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static ReportDTO toDTO(String fileName, EvaluationMode mode, List<String> warnings, List<AnalysisResult> results)
	{
		ReportDTO report = new ReportDTO();
		report.file = fileName;
		report.mode = mode.name().toLowerCase();
		report.warnings.addAll(warnings);
		for (AnalysisResult result : results)
		{
			report.results.add(resultToDTO(result));
		}
		for (Map.Entry<Status, Integer> entry : ReportPrinter.countByStatus(results).entrySet())
		{
			report.summary.put(entry.getKey().name(), entry.getValue());
		}
		report.summary.put("TOTAL", results.size());
		return report;
	}

	public static String toJson(ReportDTO report)
	{
		return GSON.toJson(report);
	}

	public static void write(ReportDTO report, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(report), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote JSON report to: " + outPath);
	}

	private static ResultDTO resultToDTO(AnalysisResult result)
	{
		ResultDTO dto = new ResultDTO();
		dto.line = result.getLineNumber();
		dto.status = result.getStatus().name();
		dto.expression = result.getExpression();
		dto.computedText = result.getComputedText().orElse(null);
		dto.declared = result.getDeclaredType().map(Object::toString).orElse(null);
		dto.computed = result.getComputedType().map(Object::toString).orElse(null);
		dto.issues.addAll(result.getIssues());
		dto.statement = result.getStatement().map(JsonReportWriter::statementToDTO).orElse(null);
		return dto;
	}

	private static StatementDTO statementToDTO(StatementResult statement)
	{
		StatementDTO dto = new StatementDTO();
		dto.line = statement.getLineNumber();
		dto.status = statement.getStatus().name();
		dto.expression = statement.getExpression();
		dto.computed = statement.getComputedType().map(Object::toString).orElse(null);
		dto.issues.addAll(statement.getIssues());
		return dto;
	}
}
