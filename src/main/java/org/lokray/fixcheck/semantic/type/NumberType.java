package org.lokray.fixcheck.semantic.type;

import java.math.BigInteger;

/**
 * The type of a sized or plain integer literal. Keeps the literal value so that shift amounts,
 * replication counts and slice bounds can be recognised as compile-time constants.
 * Equality ignores the value, like any other {@link FixedPointType}.
 */
public class NumberType extends FixedPointType
{
	private final BigInteger value;

	public NumberType(BigInteger value, boolean signed, int totalBits)
	{
		super(signed, totalBits, 0);
		this.value = value;
	}

	public BigInteger getValue()
	{
		return value;
	}

	@Override
	public FixedPointType asPlainType()
	{
		return new FixedPointType(isSigned(), getTotalBits(), getFracBits());
	}
}
