package org.lokray.fixcheck.ast;

import java.util.Objects;

public final class AbsoluteValue implements Expr
{
	private final Expr operand;

	public AbsoluteValue(Expr operand)
	{
		this.operand = operand;
	}

	public Expr getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitAbsoluteValue(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof AbsoluteValue other && operand.equals(other.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("AbsoluteValue", operand);
	}

	@Override
	public String toString()
	{
		return "AbsoluteValue(" + operand + ")";
	}
}
