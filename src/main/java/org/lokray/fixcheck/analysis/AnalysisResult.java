package org.lokray.fixcheck.analysis;

import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.List;
import java.util.Optional;

/**
 * One finding per processed line: either an annotation comment (optionally with its paired statement),
 * or an undocumented fixed-point statement.
 */
public final class AnalysisResult
{
	private final int lineNumber;
	private final String expression;
	private final String computedText;
	private final FixedPointType declaredType;
	private final FixedPointType computedType;
	private final List<String> issues;
	private final Status status;
	private final StatementResult statement;

	AnalysisResult(int lineNumber, String expression, String computedText, FixedPointType declaredType,
				   FixedPointType computedType, List<String> issues, Status status, StatementResult statement)
	{
		this.lineNumber = lineNumber;
		this.expression = expression;
		this.computedText = computedText;
		this.declaredType = declaredType;
		this.computedType = computedType;
		this.issues = List.copyOf(issues);
		this.status = status;
		this.statement = statement;
	}

	/**
	 * A comment or statement that could not be typed at all.
	 */
	static AnalysisResult failure(int lineNumber, String expression, FixedPointType declaredType, String issue, Status status)
	{
		return new AnalysisResult(lineNumber, expression, null, declaredType, null, List.of(issue), status, null);
	}

	/**
	 * 1-based line number in the analyzed file.
	 */
	public int getLineNumber()
	{
		return lineNumber;
	}

	public String getExpression()
	{
		return expression;
	}

	public Optional<String> getComputedText()
	{
		return Optional.ofNullable(computedText);
	}

	public Optional<FixedPointType> getDeclaredType()
	{
		return Optional.ofNullable(declaredType);
	}

	public Optional<FixedPointType> getComputedType()
	{
		return Optional.ofNullable(computedType);
	}

	public List<String> getIssues()
	{
		return issues;
	}

	public Status getStatus()
	{
		return status;
	}

	public Optional<StatementResult> getStatement()
	{
		return Optional.ofNullable(statement);
	}

	@Override
	public String toString()
	{
		return "Line " + lineNumber + ": " + status + " " + expression + (issues.isEmpty() ? "" : " " + issues);
	}
}
