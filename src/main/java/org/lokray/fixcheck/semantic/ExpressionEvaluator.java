package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.ast.Expr;
import org.lokray.fixcheck.ast.ExpressionParser;
import org.lokray.fixcheck.semantic.type.FixedPointType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and types a single expression. Stateless: evaluating the same text against the same table
 * always gives the same result, regardless of what was evaluated before.
 */
public final class ExpressionEvaluator
{
	private ExpressionEvaluator()
	{
	}

	public static Evaluation evaluate(String text, IdentifierTable table)
	{
		return evaluate(text, table, EvaluationMode.STRICT);
	}

	/**
	 * @throws org.lokray.fixcheck.error.ExpressionParseException    if the text does not parse or cannot be typed
	 * @throws org.lokray.fixcheck.error.UnknownIdentifierException  if a name is missing from {@code table}
	 * @throws org.lokray.fixcheck.error.InvalidTypeAnnotationException if an inline type token is invalid
	 * @throws org.lokray.fixcheck.error.InvalidBitSliceException    if a constant slice has no bits
	 */
	public static Evaluation evaluate(String text, IdentifierTable table, EvaluationMode mode)
	{
		return evaluate(ExpressionParser.parse(text), table, mode);
	}

	public static Evaluation evaluate(Expr expr, IdentifierTable table, EvaluationMode mode)
	{
		List<String> issues = new ArrayList<>();
		TypeTransformer transformer = new TypeTransformer(table, FixedPointOps.forMode(mode), issues);
		ReducedExpr reduced = transformer.reduce(expr);
		FixedPointType type = reduced.getType().asPlainType();
		return new Evaluation(type, reduced.getText(), issues);
	}
}
