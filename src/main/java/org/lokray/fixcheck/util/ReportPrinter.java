package org.lokray.fixcheck.util;

import org.lokray.fixcheck.analysis.AnalysisResult;
import org.lokray.fixcheck.analysis.StatementResult;
import org.lokray.fixcheck.analysis.Status;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders analysis results as the plain-text console report.
 */
public class ReportPrinter
{
	private static final String RULE = "=".repeat(60);

	public static void print(String fileName, List<AnalysisResult> results)
	{
		Debug.log(render(fileName, results));
	}

	public static String render(String fileName, List<AnalysisResult> results)
	{
		StringBuilder out = new StringBuilder();
		out.append("Fixed-Point Arithmetic Analysis for ").append(fileName).append('\n');
		out.append(RULE).append('\n');

		for (AnalysisResult result : results)
		{
			out.append("Line ").append(result.getLineNumber()).append(": ").append(colorStatus(result.getStatus())).append('\n');
			if (result.getExpression() != null && !result.getExpression().isEmpty())
			{
				out.append("  Expression: ").append(result.getExpression()).append('\n');
			}
			result.getDeclaredType().ifPresent(t -> out.append("  Declared: ").append(t).append('\n'));
			result.getComputedType().ifPresent(t -> out.append("  Computed: ").append(t).append('\n'));
			for (String issue : result.getIssues())
			{
				out.append("  ").append(issue).append('\n');
			}

			if (result.getStatement().isPresent())
			{
				StatementResult statement = result.getStatement().get();
				out.append("  Verilog Line ").append(statement.getLineNumber()).append(": ")
						.append(colorStatus(statement.getStatus())).append('\n');
				out.append("    Expression: ").append(statement.getExpression()).append('\n');
				statement.getComputedType().ifPresent(t -> out.append("    Verilog Computed: ").append(t).append('\n'));
				for (String issue : statement.getIssues())
				{
					out.append("    ").append(issue).append('\n');
				}
			}
			out.append('\n');
		}

		Map<Status, Integer> counts = countByStatus(results);
		out.append(RULE).append('\n');
		out.append(String.format("Summary: %d OK, %d Errors, %d Parse Errors, %d Missing Types, %d Missing Comments%n",
				counts.get(Status.OK), counts.get(Status.ERROR), counts.get(Status.PARSE_ERROR),
				counts.get(Status.MISSING_TYPE), counts.get(Status.MISSING_COMMENT)));
		out.append("Total fixed-point expressions checked: ").append(results.size());
		return out.toString();
	}

	/**
	 * Results per status, counting the primary line only. Every status is present, possibly with 0.
	 */
	public static Map<Status, Integer> countByStatus(List<AnalysisResult> results)
	{
		Map<Status, Integer> counts = new EnumMap<>(Status.class);
		for (Status status : Status.values())
		{
			counts.put(status, 0);
		}
		for (AnalysisResult result : results)
		{
			counts.merge(result.getStatus(), 1, Integer::sum);
		}
		return counts;
	}

	private static String colorStatus(Status status)
	{
		return switch (status)
		{
			case OK -> Debug.colorize(Debug.ANSI_GREEN, status.name());
			case ERROR, PARSE_ERROR -> Debug.colorize(Debug.ANSI_RED, status.name());
			case MISSING_TYPE, MISSING_COMMENT -> Debug.colorize(Debug.ANSI_YELLOW, status.name());
		};
	}
}
