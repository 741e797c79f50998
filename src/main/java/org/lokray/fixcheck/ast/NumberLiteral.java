package org.lokray.fixcheck.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A numeric literal. Sized literals ({@code 12'sd1024}) carry their size prefix as width,
 * plain integers are 32 bits wide, and decimal literals ({@code 0.5}) have no width at all.
 */
public final class NumberLiteral implements Expr
{
	public static final int DEFAULT_WIDTH = 32;

	private final String text;
	private final BigInteger value;
	private final boolean signed;
	private final int width;
	private final boolean decimal;

	private NumberLiteral(String text, BigInteger value, boolean signed, int width, boolean decimal)
	{
		this.text = text;
		this.value = value;
		this.signed = signed;
		this.width = width;
		this.decimal = decimal;
	}

	public static NumberLiteral integer(String text, BigInteger value, boolean signed, int width)
	{
		return new NumberLiteral(text, value, signed, width, false);
	}

	public static NumberLiteral decimal(String text)
	{
		return new NumberLiteral(text, null, false, 0, true);
	}

	public String getText()
	{
		return text;
	}

	/**
	 * The integer value, or null for a decimal literal.
	 */
	public BigInteger getValue()
	{
		return value;
	}

	public boolean isSigned()
	{
		return signed;
	}

	public int getWidth()
	{
		return width;
	}

	public boolean isDecimal()
	{
		return decimal;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitNumber(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof NumberLiteral other))
		{
			return false;
		}
		return text.equals(other.text) && Objects.equals(value, other.value) && signed == other.signed
				&& width == other.width && decimal == other.decimal;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(text, value, signed, width, decimal);
	}

	@Override
	public String toString()
	{
		return "Number(" + text + ")";
	}
}
