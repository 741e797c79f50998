package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * Shared shape of the three binary node kinds. Each subclass accepts only the operators of its precedence level.
 */
public abstract class BinaryExpr implements Expr
{
	private final Expr left;
	private final BinaryOperator operator;
	private final Expr right;

	protected BinaryExpr(Expr left, BinaryOperator operator, Expr right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expr getLeft()
	{
		return left;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expr getRight()
	{
		return right;
	}

	@Override
	public boolean equals(Object o)
	{
		if (o == null || o.getClass() != getClass())
		{
			return false;
		}
		BinaryExpr other = (BinaryExpr) o;
		return operator == other.operator && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(left, operator, right);
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(" + left + " " + operator + " " + right + ")";
	}
}
