package org.lokray.fixcheck.ast;

public final class Identifier implements Expr
{
	private final String name;

	public Identifier(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitIdentifier(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof Identifier other && name.equals(other.name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public String toString()
	{
		return "Identifier(" + name + ")";
	}
}
