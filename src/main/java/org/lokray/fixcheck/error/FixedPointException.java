package org.lokray.fixcheck.error;

/**
 * Base class for every failure raised while parsing or typing a single expression.
 * None of these are fatal to a whole file: the analyzer maps them to a result status.
 */
public class FixedPointException extends RuntimeException
{
	public FixedPointException(String message)
	{
		super(message);
	}

	public FixedPointException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
