package org.lokray.fixcheck.ast;

import java.util.List;

/**
 * {@code {e1, e2, ...}}. The last element is the least significant one.
 */
public final class Concatenation implements Expr
{
	private final List<Expr> elements;

	public Concatenation(List<Expr> elements)
	{
		if (elements.isEmpty())
		{
			throw new IllegalArgumentException("Concatenation needs at least one element");
		}
		this.elements = List.copyOf(elements);
	}

	public List<Expr> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitConcatenation(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Concatenation other && elements.equals(other.elements);
	}

	@Override
	public int hashCode()
	{
		return elements.hashCode();
	}

	@Override
	public String toString()
	{
		return "Concatenation" + elements;
	}
}
