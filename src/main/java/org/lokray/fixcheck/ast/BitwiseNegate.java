package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * {@code ~e}. The operand extends to the end of the enclosing additive expression.
 */
public final class BitwiseNegate implements Expr
{
	private final Expr operand;

	public BitwiseNegate(Expr operand)
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
		return visitor.visitBitwiseNegate(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof BitwiseNegate other && operand.equals(other.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("BitwiseNegate", operand);
	}

	@Override
	public String toString()
	{
		return "BitwiseNegate(" + operand + ")";
	}
}
