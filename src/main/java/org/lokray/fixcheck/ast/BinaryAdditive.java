package org.lokray.fixcheck.ast;

public final class BinaryAdditive extends BinaryExpr
{
	public BinaryAdditive(Expr left, BinaryOperator operator, Expr right)
	{
		super(left, operator, right);
		if (!operator.isAdditive())
		{
			throw new IllegalArgumentException("Operator " + operator + " does not belong to BinaryAdditive");
		}
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitBinaryAdditive(this);
	}
}
