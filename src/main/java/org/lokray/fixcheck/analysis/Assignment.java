package org.lokray.fixcheck.analysis;

import java.util.Optional;

/**
 * {@code lhs <= rhs;} or {@code lhs = rhs;} with any trailing comment removed.
 */
public final class Assignment
{
	private final String target;
	private final String value;

	private Assignment(String target, String value)
	{
		this.target = target;
		this.value = value;
	}

	public static Optional<Assignment> parse(String line)
	{
		int comment = line.indexOf("//");
		String code = (comment >= 0 ? line.substring(0, comment) : line).strip();
		while (code.endsWith(";"))
		{
			code = code.substring(0, code.length() - 1);
		}

		// Non-blocking first, so "a <= b" is not read as "a <" = " b".
		int split = code.indexOf("<=");
		int width = 2;
		if (split < 0)
		{
			split = code.indexOf('=');
			width = 1;
		}
		if (split < 0)
		{
			return Optional.empty();
		}
		return Optional.of(new Assignment(code.substring(0, split).strip(), code.substring(split + width).strip()));
	}

	public String getTarget()
	{
		return target;
	}

	/**
	 * The right-hand side expression.
	 */
	public String getValue()
	{
		return value;
	}

	public boolean hasArithmetic()
	{
		return value.contains("+") || value.contains("-") || value.contains("*") || value.contains("/");
	}
}
