package org.lokray.fixcheck.ast;

import java.util.Objects;

public final class ArrayAccess implements Expr
{
	private final String name;
	private final Expr index;

	public ArrayAccess(String name, Expr index)
	{
		this.name = name;
		this.index = index;
	}

	public String getName()
	{
		return name;
	}

	public Expr getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitArrayAccess(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ArrayAccess other && name.equals(other.name) && index.equals(other.index);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("ArrayAccess", name, index);
	}

	@Override
	public String toString()
	{
		return "ArrayAccess(" + name + ", " + index + ")";
	}
}
