package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * {@code S12F8 name}, {@code U24F24 table[i]} or {@code S12F11 12'sd1024}: an operand with an inline declared type.
 */
public final class TypeAnnotation implements Expr
{
	private final String typeToken;
	private final Expr operand;

	public TypeAnnotation(String typeToken, Expr operand)
	{
		this.typeToken = typeToken;
		this.operand = operand;
	}

	public String getTypeToken()
	{
		return typeToken;
	}

	public Expr getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitTypeAnnotation(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof TypeAnnotation other && typeToken.equals(other.typeToken) && operand.equals(other.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(typeToken, operand);
	}

	@Override
	public String toString()
	{
		return "TypeAnnotation(" + typeToken + ", " + operand + ")";
	}
}
