package org.lokray.fixcheck.analysis;

import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.List;
import java.util.Optional;

/**
 * The Verilog statement paired with an annotation comment, as evaluated against the comment's declared type.
 */
public final class StatementResult
{
	private final int lineNumber;
	private final String expression;
	private final FixedPointType computedType;
	private final List<String> issues;
	private final Status status;

	StatementResult(int lineNumber, String expression, FixedPointType computedType, List<String> issues, Status status)
	{
		this.lineNumber = lineNumber;
		this.expression = expression;
		this.computedType = computedType;
		this.issues = List.copyOf(issues);
		this.status = status;
	}

	public int getLineNumber()
	{
		return lineNumber;
	}

	public String getExpression()
	{
		return expression;
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
}
