package org.lokray.fixcheck.analysis;

import org.junit.jupiter.api.Test;
import org.lokray.fixcheck.semantic.BuiltInTypeLoader;
import org.lokray.fixcheck.semantic.EvaluationMode;
import org.lokray.fixcheck.semantic.type.TypeParser;
import org.lokray.fixcheck.util.SourceLoader;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerTest
{

	private static final String DECLARATIONS = String.join("\n",
			"reg [7:0] vol; // U8F0",
			"reg [7:0] result; // U8F0",
			"reg signed [11:0] a; // S12F11",
			"reg signed [11:0] b; // S12F11",
			"reg [W-1:0] acc;",
			"");

	private final Analyzer analyzer = new Analyzer();

	private List<AnalysisResult> analyze(String... body)
	{
		return analyzer.analyze(DECLARATIONS + String.join("\n", body));
	}

	@Test
	void matchingAnnotationAndStatement()
	{
		List<AnalysisResult> results = analyze(
				"// U8F0 result = vol + 8'd1",
				"result <= vol + 8'd1;");

		assertEquals(1, results.size());
		AnalysisResult result = results.get(0);
		assertEquals(6, result.getLineNumber());
		assertEquals(Status.OK, result.getStatus());
		assertEquals("vol + 8'd1", result.getExpression());
		assertEquals("(vol + 8'd1)", result.getComputedText().orElseThrow());
		assertEquals(TypeParser.parseType("U8F0"), result.getComputedType().orElseThrow());

		StatementResult statement = result.getStatement().orElseThrow();
		assertEquals(7, statement.getLineNumber());
		assertEquals(Status.OK, statement.getStatus());
		assertTrue(statement.getIssues().isEmpty());
	}

	@Test
	void bothSidesAgreeOnUnsizedLiteral()
	{
		AnalysisResult result = analyze(
				"// U8F0 result = vol + 1",
				"result <= vol + 1;").get(0);

		StatementResult statement = result.getStatement().orElseThrow();
		assertEquals(result.getComputedType(), statement.getComputedType());
		assertTrue(statement.getIssues().stream().noneMatch(issue -> issue.contains("type mismatch")));
	}

	@Test
	void statementDiffersFromComment()
	{
		AnalysisResult result = analyze(
				"// U8F0 result = vol + 8'd1",
				"result <= vol + a;").get(0);

		assertEquals(Status.OK, result.getStatus());
		StatementResult statement = result.getStatement().orElseThrow();
		assertEquals(Status.ERROR, statement.getStatus());
		assertTrue(statement.getIssues().contains("Verilog type mismatch: comment computed U8F0, Verilog computed S12F0"));
	}

	@Test
	void declaredTypeDisagreesWithComputation()
	{
		AnalysisResult result = analyze("// S12F11 out = a * b").get(0);
		assertEquals(Status.ERROR, result.getStatus());
		assertTrue(result.getIssues().contains("Fractional bits 22 != declared 11"));
		assertTrue(result.getStatement().isEmpty());
	}

	@Test
	void undocumentedFractionalArithmetic()
	{
		List<AnalysisResult> results = analyze(
				"y <= a * b;",
				"z <= a;",
				"w <= vol + 8'd1;");

		assertEquals(1, results.size());
		AnalysisResult result = results.get(0);
		assertEquals(Status.MISSING_COMMENT, result.getStatus());
		assertEquals(6, result.getLineNumber());
		assertTrue(result.getDeclaredType().isEmpty());
		assertEquals(List.of(Analyzer.MISSING_COMMENT_ISSUE), result.getIssues());
	}

	@Test
	void annotatedStatementIsNotReportedTwice()
	{
		List<AnalysisResult> results = analyze(
				"// S24F22 y = a * b",
				"",
				"y <= a * b;");

		assertEquals(1, results.size());
		assertEquals(Status.OK, results.get(0).getStatus());
		assertEquals(8, results.get(0).getStatement().orElseThrow().getLineNumber());
	}

	@Test
	void untypedRegister()
	{
		List<AnalysisResult> results = analyze(
				"// S24F16 out = acc * 2",
				"out <= acc * 2;");

		assertEquals(1, results.size());
		assertEquals(Status.MISSING_TYPE, results.get(0).getStatus());
		assertEquals(List.of("Register 'acc' is missing type annotation"), results.get(0).getIssues());
	}

	@Test
	void unknownIdentifierInComment()
	{
		AnalysisResult result = analyze("// U8F0 out = foo + 1").get(0);
		assertEquals(Status.PARSE_ERROR, result.getStatus());
		assertEquals(List.of("Parse error: Unknown identifier: foo"), result.getIssues());
	}

	@Test
	void invalidDeclaredType()
	{
		AnalysisResult result = analyze("// S8F8 out = vol").get(0);
		assertEquals(Status.PARSE_ERROR, result.getStatus());
		assertEquals(List.of("Invalid type annotation: S8F8"), result.getIssues());
		assertTrue(result.getDeclaredType().isEmpty());
	}

	@Test
	void unparsableStatement()
	{
		AnalysisResult result = analyze(
				"// U8F0 out = vol",
				"out <= vol ? 1 : 0;").get(0);
		assertEquals(Status.OK, result.getStatus());
		assertEquals(Status.PARSE_ERROR, result.getStatement().orElseThrow().getStatus());
	}

	@Test
	void annotationWithoutFollowingAssignment()
	{
		AnalysisResult result = analyze(
				"// U8F0 out = vol",
				"end").get(0);
		assertTrue(result.getStatement().isEmpty());
	}

	@Test
	void unparsableUnannotatedLinesAreSkipped()
	{
		assertTrue(analyze("if (a <= b) begin", "x <= unknown_thing * 2;").isEmpty());
	}

	@Test
	void oversizedWidthsAreParseErrorsNotCrashes()
	{
		List<AnalysisResult> results = assertDoesNotThrow(() -> analyze(
				"// U8F0 out = vol << 2147483647",
				"out <= vol << 2147483647;",
				"// U8F0 out = {1431655766{3'd1}}",
				"// U8F0 out = 99999999999'd1 + vol"));

		assertEquals(3, results.size());
		assertTrue(results.stream().allMatch(result -> result.getStatus() == Status.PARSE_ERROR));
		assertTrue(results.get(0).getIssues().get(0).startsWith("Parse error: Left shift width exceeds"));
		assertEquals(Status.PARSE_ERROR, results.get(0).getStatement().orElseThrow().getStatus());
		assertEquals(List.of("Parse error: Literal size out of range: 99999999999'd1"), results.get(2).getIssues());
	}

	@Test
	void oversizedUnannotatedAssignmentsAreSkipped()
	{
		List<AnalysisResult> results = assertDoesNotThrow(() -> analyze(
				"out <= vol << 2147483647;",
				"out <= {1431655766{3'd1}};",
				"out <= 2147483647'sd5 + vol;",
				"out <= {a, 2147483647'd1};"));
		assertTrue(results.isEmpty());
	}

	@Test
	void unusableDeclarationAnnotationKeepsRangeType()
	{
		List<AnalysisResult> results = assertDoesNotThrow(() -> analyzer.analyze(String.join("\n",
				"reg [7:0] vol; // U8F0",
				"reg [7:0] big; // U99999999999F0",
				"reg signed [7:0] s; // S8F8",
				"// U8F0 out = big + vol",
				"// S8F0 out = s")));

		assertEquals(2, results.size());
		assertEquals(Status.OK, results.get(0).getStatus());
		assertEquals(TypeParser.parseType("U8F0"), results.get(0).getComputedType().orElseThrow());
		assertEquals(Status.OK, results.get(1).getStatus());
		assertEquals(TypeParser.parseType("S8F0"), results.get(1).getComputedType().orElseThrow());
	}

	@Test
	void builtInConstantsResolve()
	{
		AnalysisResult result = analyze(
				"// U7F0 n = PITCH_REF_C2",
				"n <= PITCH_REF_C2;").get(0);
		assertEquals(Status.OK, result.getStatus());
		assertEquals(Status.OK, result.getStatement().orElseThrow().getStatus());
	}

	@Test
	void truncatingModeAppliesToBothSides()
	{
		Analyzer truncating = new Analyzer(EvaluationMode.TRUNCATING, BuiltInTypeLoader.loadDefaults());
		AnalysisResult result = truncating.analyze(DECLARATIONS + String.join("\n",
				"// S12F11 out = a + b",
				"out <= abs(a) + b;")).get(0);

		assertEquals(Status.OK, result.getStatus());
		StatementResult statement = result.getStatement().orElseThrow();
		assertTrue(statement.getIssues().contains("'abs' is not standard Verilog."));
	}

	@Test
	void pairedStatementSkipsBlankAndCommentLines()
	{
		List<String> lines = List.of("// U8F0 a = b", "", "   // more", "a <= b;");
		assertEquals(3, Analyzer.findPairedStatement(lines, 0));
		assertEquals(-1, Analyzer.findPairedStatement(List.of("// U8F0 a = b", ""), 0));
	}

	@Test
	void fixtureFile() throws Exception
	{
		SourceLoader loader = new SourceLoader(fixture("voice.v"));
		loader.load();
		List<AnalysisResult> results = analyzer.analyze(loader.getLines());

		assertEquals(List.of(16, 18, 20, 22, 24, 26), results.stream().map(AnalysisResult::getLineNumber).toList());
		assertEquals(List.of(Status.OK, Status.OK, Status.OK, Status.ERROR, Status.MISSING_TYPE, Status.MISSING_COMMENT),
				results.stream().map(AnalysisResult::getStatus).toList());

		AnalysisResult scaling = results.get(0);
		assertEquals("s8_sample * gain", scaling.getExpression());
		assertEquals(TypeParser.parseType("S20F18"), scaling.getComputedType().orElseThrow());
		assertEquals(Status.OK, scaling.getStatement().orElseThrow().getStatus());
	}

	static Path fixture(String name) throws URISyntaxException
	{
		return Paths.get(Objects.requireNonNull(AnalyzerTest.class.getResource("/fixtures/" + name)).toURI());
	}
}
