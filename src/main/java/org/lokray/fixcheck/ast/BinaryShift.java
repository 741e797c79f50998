package org.lokray.fixcheck.ast;

public final class BinaryShift extends BinaryExpr
{
	public BinaryShift(Expr left, BinaryOperator operator, Expr right)
	{
		super(left, operator, right);
		if (!operator.isShift())
		{
			throw new IllegalArgumentException("Operator " + operator + " does not belong to BinaryShift");
		}
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitBinaryShift(this);
	}
}
