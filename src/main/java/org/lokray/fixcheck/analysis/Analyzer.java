// File: src/main/java/org/lokray/fixcheck/analysis/Analyzer.java
package org.lokray.fixcheck.analysis;

import org.lokray.fixcheck.error.FixedPointException;
import org.lokray.fixcheck.error.InvalidTypeAnnotationException;
import org.lokray.fixcheck.error.UnknownIdentifierException;
import org.lokray.fixcheck.semantic.BuiltInTypeLoader;
import org.lokray.fixcheck.semantic.EvaluationMode;
import org.lokray.fixcheck.semantic.Evaluation;
import org.lokray.fixcheck.semantic.ExpressionEvaluator;
import org.lokray.fixcheck.semantic.IdentifierTable;
import org.lokray.fixcheck.semantic.OverflowChecker;
import org.lokray.fixcheck.semantic.TypeDatabaseBuilder;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.TypeParser;
import org.lokray.fixcheck.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scans a Verilog file line by line, pairing each annotation comment with the statement that follows it.
 * <p>
 * Both sides of a pair are typed independently. The comment side is checked against its declared type;
 * the statement side is checked against the same declared type and against the comment's computed type.
 * Assignments that do fractional arithmetic without a preceding annotation are reported as undocumented.
 */
public class Analyzer
{
	static final String MISSING_COMMENT_ISSUE = "Missing comment for fixed point arithmetic";

	private final EvaluationMode mode;
	private final Map<String, FixedPointType> builtIns;

	public Analyzer()
	{
		this(EvaluationMode.STRICT, BuiltInTypeLoader.loadDefaults());
	}

	/**
	 * @param mode     operator semantics used for both the comment and the statement of every pair
	 * @param builtIns constants merged into each file's identifier table
	 */
	public Analyzer(EvaluationMode mode, Map<String, FixedPointType> builtIns)
	{
		this.mode = mode;
		this.builtIns = Map.copyOf(builtIns);
	}

	public List<AnalysisResult> analyze(String text)
	{
		return analyze(text.lines().toList());
	}

	public List<AnalysisResult> analyze(List<String> lines)
	{
		return analyze(lines, buildTable(lines));
	}

	/**
	 * The identifier table for {@code lines}, seeded with this analyzer's built-in constants.
	 */
	public IdentifierTable buildTable(List<String> lines)
	{
		return TypeDatabaseBuilder.buildTypeDatabase(lines, builtIns);
	}

	/**
	 * Analyzes {@code lines} against a table that was already built for them.
	 */
	public List<AnalysisResult> analyze(List<String> lines, IdentifierTable table)
	{
		List<AnalysisResult> results = new ArrayList<>();
		int pairedIndex = -1;

		for (int i = 0; i < lines.size(); i++)
		{
			String line = lines.get(i);
			int lineNumber = i + 1;

			if (line.strip().startsWith("//"))
			{
				Optional<AnnotationComment> annotation = AnnotationComment.parse(line);
				if (annotation.isEmpty())
				{
					continue;
				}
				int statementIndex = findPairedStatement(lines, i);
				results.add(analyzeAnnotation(lineNumber, annotation.get(), lines, statementIndex, table));
				if (statementIndex >= 0)
				{
					pairedIndex = statementIndex;
				}
			}
			else if (i == pairedIndex)
			{
				Debug.logDebug("Line " + lineNumber + " already checked against its annotation");
			}
			else
			{
				analyzeUnannotated(lineNumber, line, table).ifPresent(results::add);
			}
		}
		return results;
	}

	private AnalysisResult analyzeAnnotation(int lineNumber, AnnotationComment annotation, List<String> lines,
											 int statementIndex, IdentifierTable table)
	{
		String expression = annotation.getExpression();

		FixedPointType declared;
		try
		{
			declared = TypeParser.parseType(annotation.getTypeToken());
		}
		catch (InvalidTypeAnnotationException e)
		{
			return AnalysisResult.failure(lineNumber, expression, null,
					"Invalid type annotation: " + e.getToken(), Status.PARSE_ERROR);
		}

		Evaluation comment;
		try
		{
			comment = ExpressionEvaluator.evaluate(expression, table, mode);
		}
		catch (UnknownIdentifierException e)
		{
			if (table.isKnownRegister(e.getName()))
			{
				return AnalysisResult.failure(lineNumber, expression, declared,
						"Register '" + e.getName() + "' is missing type annotation", Status.MISSING_TYPE);
			}
			return AnalysisResult.failure(lineNumber, expression, declared, "Parse error: " + e.getMessage(), Status.PARSE_ERROR);
		}
		catch (FixedPointException e)
		{
			return AnalysisResult.failure(lineNumber, expression, declared, "Parse error: " + e.getMessage(), Status.PARSE_ERROR);
		}

		List<String> issues = new ArrayList<>(OverflowChecker.check(comment.getType(), declared));
		issues.addAll(comment.getIssues());

		StatementResult statement = null;
		if (statementIndex >= 0)
		{
			statement = Assignment.parse(lines.get(statementIndex))
					.map(assignment -> analyzeStatement(statementIndex + 1, assignment, declared, comment.getType(), table))
					.orElse(null);
		}

		return new AnalysisResult(lineNumber, expression, comment.getCanonicalText(), declared, comment.getType(),
				issues, Status.fromIssues(issues), statement);
	}

	private StatementResult analyzeStatement(int lineNumber, Assignment assignment, FixedPointType declared,
											 FixedPointType commentType, IdentifierTable table)
	{
		String expression = assignment.getValue();
		Evaluation evaluation;
		try
		{
			evaluation = ExpressionEvaluator.evaluate(expression, table, mode);
		}
		catch (FixedPointException e)
		{
			return new StatementResult(lineNumber, expression, null, List.of("Parse error: " + e.getMessage()), Status.PARSE_ERROR);
		}

		List<String> issues = new ArrayList<>(OverflowChecker.check(evaluation.getType(), declared));
		issues.addAll(evaluation.getIssues());
		if (!evaluation.getType().equals(commentType))
		{
			issues.add(String.format("Verilog type mismatch: comment computed %s, Verilog computed %s", commentType, evaluation.getType()));
		}
		return new StatementResult(lineNumber, expression, evaluation.getType(), issues, Status.fromIssues(issues));
	}

	private Optional<AnalysisResult> analyzeUnannotated(int lineNumber, String line, IdentifierTable table)
	{
		Optional<Assignment> assignment = Assignment.parse(line);
		if (assignment.isEmpty())
		{
			return Optional.empty();
		}

		String expression = assignment.get().getValue();
		Evaluation evaluation;
		try
		{
			evaluation = ExpressionEvaluator.evaluate(expression, table, mode);
		}
		catch (FixedPointException e)
		{
			// Most assignments are not fixed-point arithmetic at all; only annotated lines report failures.
			Debug.logDebug("Line " + lineNumber + " skipped: " + e.getMessage());
			return Optional.empty();
		}

		if (!evaluation.getType().isFractional() || !assignment.get().hasArithmetic())
		{
			return Optional.empty();
		}

		List<String> issues = new ArrayList<>(evaluation.getIssues());
		issues.add(MISSING_COMMENT_ISSUE);
		return Optional.of(new AnalysisResult(lineNumber, expression, evaluation.getCanonicalText(), null,
				evaluation.getType(), issues, Status.MISSING_COMMENT, null));
	}

	/**
	 * Index of the nearest following line that is neither blank nor a comment, or -1.
	 */
	static int findPairedStatement(List<String> lines, int commentIndex)
	{
		for (int j = commentIndex + 1; j < lines.size(); j++)
		{
			String next = lines.get(j).strip();
			if (!next.isEmpty() && !next.startsWith("//"))
			{
				return j;
			}
		}
		return -1;
	}
}
