package org.lokray.fixcheck.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.fixcheck.error.ExpressionParseException;
import org.lokray.fixcheck.error.InvalidBitSliceException;
import org.lokray.fixcheck.error.InvalidTypeAnnotationException;
import org.lokray.fixcheck.error.UnknownIdentifierException;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.NumberType;
import org.lokray.fixcheck.semantic.type.TypeParser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest
{

	private static final IdentifierTable TABLE = table();

	private static IdentifierTable table()
	{
		Map<String, FixedPointType> types = new LinkedHashMap<>();
		types.put("vol", TypeParser.parseType("U8F0"));
		types.put("a", TypeParser.parseType("S12F11"));
		types.put("b", TypeParser.parseType("S12F11"));
		types.put("x", TypeParser.parseType("U16F8"));
		types.put("arr", TypeParser.parseType("U24F24"));
		return IdentifierTable.of(types);
	}

	private static FixedPointType t(String token)
	{
		return TypeParser.parseType(token);
	}

	private static Evaluation eval(String text)
	{
		return ExpressionEvaluator.evaluate(text, TABLE);
	}

	@Test
	void productOfTwoS12F11()
	{
		Evaluation result = eval("a * b");
		assertEquals(t("S24F22"), result.getType());
		assertEquals("(a * b)", result.getCanonicalText());
		assertTrue(result.getIssues().isEmpty());
	}

	@Test
	void truncatingProductKeepsWidth()
	{
		assertEquals("S12F22", ExpressionEvaluator.evaluate("a * b", TABLE, EvaluationMode.TRUNCATING).getType().toString());
	}

	@Test
	void integerSum()
	{
		assertEquals(t("U8F0"), eval("vol + vol").getType());
	}

	@Test
	void resultIsNeverALiteralType()
	{
		Evaluation result = eval("8'sd200");
		assertEquals(t("S8F0"), result.getType());
		assertFalse(result.getType() instanceof NumberType);
		assertEquals("8'sd200", result.getCanonicalText());
	}

	@Test
	void shiftingLeftThenRightRestoresType()
	{
		assertEquals(t("U16F8"), eval("(x << 3) >> 3").getType());
	}

	@Test
	void unknownIdentifierNamesTheCulprit()
	{
		UnknownIdentifierException e = assertThrows(UnknownIdentifierException.class, () -> eval("foo + 1"));
		assertEquals("foo", e.getName());
		assertThrows(UnknownIdentifierException.class, () -> eval("missing[vol]"));
		assertThrows(UnknownIdentifierException.class, () -> eval("arr[idx]"));
	}

	@Test
	void arrayElementHasArrayType()
	{
		Evaluation result = eval("arr[vol]");
		assertEquals(t("U24F24"), result.getType());
		assertEquals("arr[vol]", result.getCanonicalText());
	}

	@Test
	void constantSlice()
	{
		assertEquals(t("U8F8"), eval("x[7:0]").getType());
	}

	@Test
	void nonConstantSliceIsAnAdvisory()
	{
		Evaluation result = eval("arr[vol:0]");
		assertEquals(t("U24F24"), result.getType());
		assertEquals(List.of("Bit slice with non-constant indices: arr[vol:0]"), result.getIssues());
	}

	@Test
	void emptySliceIsRejected()
	{
		assertThrows(InvalidBitSliceException.class, () -> eval("x[0:7]"));
	}

	@Test
	void annotatedLiteralTakesDeclaredType()
	{
		Evaluation result = eval("S12F11 12'sd1024");
		assertEquals(t("S12F11"), result.getType());
		assertEquals("S12F11 12'sd1024", result.getCanonicalText());
		assertTrue(result.getIssues().isEmpty());

		assertEquals(t("U8F4"), eval("U8F4 0.5").getType());
	}

	@Test
	void annotationMismatchKeepsComputedType()
	{
		Evaluation result = eval("U8F4 vol");
		assertEquals(t("U8F0"), result.getType());
		assertEquals(List.of("Type annotation mismatch for 'vol': declared U8F4, computed U8F0"), result.getIssues());
	}

	@Test
	void matchingAnnotationIsSilent()
	{
		Evaluation result = eval("S12F11 a * U16F8 x");
		assertTrue(result.getIssues().isEmpty());
		assertEquals("(S12F11 a * U16F8 x)", result.getCanonicalText());
	}

	@Test
	void bareDecimalIsRejected()
	{
		assertThrows(ExpressionParseException.class, () -> eval("x * 0.5"));
	}

	@Test
	void invalidInlineAnnotation()
	{
		assertThrows(InvalidTypeAnnotationException.class, () -> eval("S8F8 vol"));
	}

	@Test
	void shiftAmountMustBeLiteral()
	{
		assertThrows(ExpressionParseException.class, () -> eval("x << vol"));
	}

	@Test
	void redundantShift()
	{
		Evaluation result = eval("x << 0");
		assertEquals(t("U16F8"), result.getType());
		assertEquals(List.of("Shift by 0 is redundant"), result.getIssues());
	}

	@Test
	void absAdvisoryOnlyWhenTruncating()
	{
		assertTrue(eval("abs(a)").getIssues().isEmpty());
		Evaluation truncated = ExpressionEvaluator.evaluate("abs(a)", TABLE, EvaluationMode.TRUNCATING);
		assertEquals(t("U12F11"), truncated.getType());
		assertEquals(List.of("'abs' is not standard Verilog."), truncated.getIssues());
	}

	@Test
	void signedCasts()
	{
		Evaluation sigil = eval("$signed(vol)");
		assertEquals(t("S8F0"), sigil.getType());
		assertEquals("$signed(vol)", sigil.getCanonicalText());
		assertTrue(sigil.getIssues().isEmpty());

		assertEquals(List.of("Use of 'signed' without $ is not standard Verilog."), eval("signed(vol)").getIssues());
	}

	@Test
	void concatenationAndReplication()
	{
		Evaluation concat = eval("{vol, 8'd0}");
		assertEquals(t("U16F0"), concat.getType());
		assertEquals("{vol, 8'd0}", concat.getCanonicalText());
		assertEquals(t("S16F11"), eval("{4'd0, a}").getType());

		Evaluation replicated = eval("{2{vol}}");
		assertEquals(t("U16F0"), replicated.getType());
		assertEquals("{2{vol}}", replicated.getCanonicalText());
		assertEquals(t("U32F0"), eval("{vol{a}}").getType());
	}

	@Test
	void bitwiseNegateKeepsType()
	{
		Evaluation result = eval("~vol");
		assertEquals(t("U8F0"), result.getType());
		assertEquals("~vol", result.getCanonicalText());
	}

	@Test
	void evaluationDoesNotDependOnHistory()
	{
		Evaluation first = eval("a * b + x");
		eval("x << 0");
		eval("abs(a)");
		Evaluation second = eval("a * b + x");

		assertEquals(first.getType(), second.getType());
		assertEquals(first.getCanonicalText(), second.getCanonicalText());
		assertEquals(first.getIssues(), second.getIssues());
		assertEquals(List.of("Fractional bits do not match for +: 22 vs 8"), second.getIssues());
	}
}
