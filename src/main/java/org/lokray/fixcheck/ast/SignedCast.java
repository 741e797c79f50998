package org.lokray.fixcheck.ast;

import java.util.Objects;

/**
 * {@code $signed(e)}, or the non-standard bare {@code signed(e)} when {@link #hasSigil()} is false.
 */
public final class SignedCast implements Expr
{
	private final Expr operand;
	private final boolean sigil;

	public SignedCast(Expr operand, boolean sigil)
	{
		this.operand = operand;
		this.sigil = sigil;
	}

	public Expr getOperand()
	{
		return operand;
	}

	public boolean hasSigil()
	{
		return sigil;
	}

	@Override
	public <R> R accept(ExprVisitor<R> visitor)
	{
		return visitor.visitSignedCast(this);
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof SignedCast other && sigil == other.sigil && operand.equals(other.operand);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("SignedCast", operand, sigil);
	}

	@Override
	public String toString()
	{
		return (sigil ? "SignedCast($, " : "SignedCast(") + operand + ")";
	}
}
