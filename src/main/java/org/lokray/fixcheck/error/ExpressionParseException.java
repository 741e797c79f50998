package org.lokray.fixcheck.error;

/**
 * The expression text does not fit the grammar, or an operator rule cannot produce a type
 * for it (non-literal shift amount, unsized decimal operand, ...).
 */
public class ExpressionParseException extends FixedPointException
{
	public ExpressionParseException(String message)
	{
		super(message);
	}

	public ExpressionParseException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
