package org.lokray.fixcheck.ast;

import java.util.Objects;

public final class Parenthesized implements Expr
{
	private final Expr inner;

	public Parenthesized(Expr inner)
	{
		this.inner = inner;
	}

	public Expr getInner()
	{
		return inner;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitParenthesized(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Parenthesized other && inner.equals(other.inner);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("Parenthesized", inner);
	}

	@Override
	public String toString()
	{
		return "Parenthesized(" + inner + ")";
	}
}
