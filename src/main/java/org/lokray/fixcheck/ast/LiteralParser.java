package org.lokray.fixcheck.ast;

import org.lokray.fixcheck.error.ExpressionParseException;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns literal text into a {@link NumberLiteral}.
 * <p>
 * {@code <size>'h<digits>}, {@code <size>'d<digits>} and {@code <size>'b<digits>} are unsigned with width {@code size};
 * {@code <size>'sd<digits>} is signed and wraps to its two's-complement value when the digits exceed the positive range.
 * A bare integer is an unsigned 32-bit value. Anything with a decimal point is a decimal literal without a width.
 */
public final class LiteralParser
{
	private static final Pattern SIZED = Pattern.compile("(\\d+)'(sd|d|h|b)([0-9a-zA-Z_]+)");
	private static final Pattern PLAIN = Pattern.compile("\\d+");
	private static final Pattern DECIMAL = Pattern.compile("\\d+\\.\\d+");

	private LiteralParser()
	{
	}

	public static NumberLiteral parse(String text)
	{
		if (DECIMAL.matcher(text).matches())
		{
			return NumberLiteral.decimal(text);
		}

		if (PLAIN.matcher(text).matches())
		{
			return NumberLiteral.integer(text, new BigInteger(text), false, NumberLiteral.DEFAULT_WIDTH);
		}

		Matcher m = SIZED.matcher(text);
		if (!m.matches())
		{
			throw new ExpressionParseException("Unsupported number format: " + text);
		}

		int size;
		try
		{
			size = Integer.parseInt(m.group(1));
		}
		catch (NumberFormatException e)
		{
			throw new ExpressionParseException("Literal size out of range: " + text, e);
		}
		if (size < 1)
		{
			throw new ExpressionParseException("Literal size must be positive: " + text);
		}

		String base = m.group(2);
		String digits = m.group(3).replace("_", "");
		BigInteger value;
		try
		{
			value = switch (base)
			{
				case "h" -> new BigInteger(digits, 16);
				case "b" -> new BigInteger(digits, 2);
				default -> new BigInteger(digits, 10);
			};
		}
		catch (NumberFormatException e)
		{
			throw new ExpressionParseException("Invalid digits in literal: " + text, e);
		}

		if (base.equals("sd"))
		{
			// Above 2^(size-1) - 1 exactly when the magnitude needs all size bits.
			if (value.bitLength() >= size)
			{
				value = value.subtract(BigInteger.ONE.shiftLeft(size));
			}
			return NumberLiteral.integer(text, value, true, size);
		}
		return NumberLiteral.integer(text, value, false, size);
	}
}
