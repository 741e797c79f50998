package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares a computed type against the type an engineer declared for it.
 */
public final class OverflowChecker
{
	private OverflowChecker()
	{
	}

	public static List<String> check(FixedPointType computed, FixedPointType declared)
	{
		List<String> issues = new ArrayList<>();

		// Verilog truncates on assignment, so only gross over-width is reported.
		if (computed.getTotalBits() > 2L * declared.getTotalBits())
		{
			issues.add(String.format("Result width %d much larger than declared %d", computed.getTotalBits(), declared.getTotalBits()));
		}

		if (computed.getFracBits() != declared.getFracBits())
		{
			issues.add(String.format("Fractional bits %d != declared %d", computed.getFracBits(), declared.getFracBits()));
		}

		if (computed.isSigned() != declared.isSigned() && !isImplicitWidening(computed, declared))
		{
			issues.add(String.format("Signedness mismatch: computed %s, declared %s", computed.isSigned(), declared.isSigned()));
		}

		return issues;
	}

	/**
	 * A one-bit difference in the direction that holds the sign bit: S(n+1) to Un, or Un to S(n+1).
	 */
	private static boolean isImplicitWidening(FixedPointType computed, FixedPointType declared)
	{
		if (computed.isSigned() && !declared.isSigned())
		{
			return computed.getTotalBits() == declared.getTotalBits() + 1;
		}
		return !computed.isSigned() && declared.isSigned() && declared.getTotalBits() == computed.getTotalBits() + 1;
	}
}
