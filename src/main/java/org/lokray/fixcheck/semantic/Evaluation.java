package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.List;

/**
 * Result of typing one expression: the computed type, the canonical text and the advisories raised on the way.
 */
public final class Evaluation
{
	private final FixedPointType type;
	private final String canonicalText;
	private final List<String> issues;

	public Evaluation(FixedPointType type, String canonicalText, List<String> issues)
	{
		this.type = type;
		this.canonicalText = canonicalText;
		this.issues = List.copyOf(issues);
	}

	public FixedPointType getType()
	{
		return type;
	}

	public String getCanonicalText()
	{
		return canonicalText;
	}

	public List<String> getIssues()
	{
		return issues;
	}

	@Override
	public String toString()
	{
		return canonicalText + " : " + type + (issues.isEmpty() ? "" : " " + issues);
	}
}
