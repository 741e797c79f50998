package org.lokray.fixcheck.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.TypeParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OverflowCheckerTest
{

	private static List<String> check(String computed, String declared)
	{
		return OverflowChecker.check(TypeParser.parseType(computed), TypeParser.parseType(declared));
	}

	@Test
	void identicalTypesAreClean()
	{
		assertTrue(check("U8F0", "U8F0").isEmpty());
		assertTrue(check("S24F22", "S24F22").isEmpty());
	}

	@Test
	void onlyGrossOverWidthIsReported()
	{
		assertTrue(check("U16F0", "U8F0").isEmpty());
		assertEquals(List.of("Result width 17 much larger than declared 8"), check("U17F0", "U8F0"));
	}

	@Test
	void fractionalBitsMustMatch()
	{
		assertEquals(List.of("Fractional bits 4 != declared 0"), check("U8F4", "U8F0"));
	}

	@Test
	void oneBitSignWideningIsAllowed()
	{
		assertTrue(check("S9F0", "U8F0").isEmpty());
		assertTrue(check("U8F0", "S9F0").isEmpty());
	}

	@Test
	void otherSignednessChangesAreReported()
	{
		assertEquals(List.of("Signedness mismatch: computed true, declared false"), check("S8F0", "U8F0"));
		assertEquals(List.of("Signedness mismatch: computed false, declared true"), check("U8F0", "S8F0"));
	}

	@Test
	void issuesAccumulate()
	{
		FixedPointType computed = TypeParser.parseType("S24F22");
		FixedPointType declared = TypeParser.parseType("U8F0");
		assertEquals(3, OverflowChecker.check(computed, declared).size());
	}

	@Test
	void hugeDeclaredWidthDoesNotWrap()
	{
		assertTrue(check("U2000000000F0", "U2000000000F0").isEmpty());
		assertTrue(check("U2147483647F0", "U1500000000F0").isEmpty());
	}
}
