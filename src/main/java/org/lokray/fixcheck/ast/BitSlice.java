package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * {@code name[hi:lo]}.
 */
public final class BitSlice implements Expr
{
	private final String name;
	private final Expr high;
	private final Expr low;

	public BitSlice(String name, Expr high, Expr low)
	{
		this.name = name;
		this.high = high;
		this.low = low;
	}

	public String getName()
	{
		return name;
	}

	public Expr getHigh()
	{
		return high;
	}

	public Expr getLow()
	{
		return low;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitBitSlice(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof BitSlice other && name.equals(other.name) && high.equals(other.high) && low.equals(other.low);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("BitSlice", name, high, low);
	}

	@Override
	public String toString()
	{
		return "BitSlice(" + name + ", " + high + ", " + low + ")";
	}
}
