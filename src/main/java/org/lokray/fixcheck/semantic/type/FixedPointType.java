// File: src/main/java/org/lokray/fixcheck/semantic/type/FixedPointType.java
package org.lokray.fixcheck.semantic.type;

import java.util.Objects;

/**
 * A fixed-point representation: signedness, total bit width and fractional bit count.
 * Printed and parsed as {@code S12F11} / {@code U8F0}.
 */
public class FixedPointType
{
	private final boolean signed;
	private final int totalBits;
	private final int fracBits;

	public FixedPointType(boolean signed, int totalBits, int fracBits)
	{
		if (totalBits < 1)
		{
			throw new IllegalArgumentException("Total bits must be positive, got " + totalBits);
		}
		if (fracBits < 0)
		{
			throw new IllegalArgumentException("Fractional bits must not be negative, got " + fracBits);
		}
		this.signed = signed;
		this.totalBits = totalBits;
		this.fracBits = fracBits;
	}

	public static FixedPointType signed(int totalBits, int fracBits)
	{
		return new FixedPointType(true, totalBits, fracBits);
	}

	public static FixedPointType unsigned(int totalBits, int fracBits)
	{
		return new FixedPointType(false, totalBits, fracBits);
	}

	public boolean isSigned()
	{
		return signed;
	}

	public int getTotalBits()
	{
		return totalBits;
	}

	public int getFracBits()
	{
		return fracBits;
	}

	/**
	 * Integer bits, including the sign bit for signed types.
	 */
	public int getIntBits()
	{
		return totalBits - fracBits;
	}

	public boolean isFractional()
	{
		return fracBits != 0;
	}

	/**
	 * Same width and fraction, with the given signedness.
	 */
	public FixedPointType withSigned(boolean signed)
	{
		return new FixedPointType(signed, totalBits, fracBits);
	}

	/**
	 * Strips any literal value carried by a subclass.
	 */
	public FixedPointType asPlainType()
	{
		return this;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof FixedPointType other))
		{
			return false;
		}
		return signed == other.signed && totalBits == other.totalBits && fracBits == other.fracBits;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(signed, totalBits, fracBits);
	}

	@Override
	public String toString()
	{
		return (signed ? "S" : "U") + totalBits + "F" + fracBits;
	}
}
