package org.lokray.fixcheck.ast;

public final class BinaryMultiplicative extends BinaryExpr
{
	public BinaryMultiplicative(Expr left, BinaryOperator operator, Expr right)
	{
		super(left, operator, right);
		if (!operator.isMultiplicative())
		{
			throw new IllegalArgumentException("Operator " + operator + " does not belong to BinaryMultiplicative");
		}
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitBinaryMultiplicative(this);
	}
}
