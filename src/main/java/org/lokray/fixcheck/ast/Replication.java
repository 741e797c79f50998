package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * {@code {count{value}}}.
 */
public final class Replication implements Expr
{
	private final Expr count;
	private final Expr value;

	public Replication(Expr count, Expr value)
	{
		this.count = count;
		this.value = value;
	}

	public Expr getCount()
	{
		return count;
	}

	public Expr getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitReplication(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Replication other && count.equals(other.count) && value.equals(other.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("Replication", count, value);
	}

	@Override
	public String toString()
	{
		return "Replication(" + count + ", " + value + ")";
	}
}
