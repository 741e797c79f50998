package org.lokray.fixcheck.ast;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.fixcheck.error.ExpressionParseException;
import org.lokray.fixcheck.parser.FixedPointExpressionLexer;
import org.lokray.fixcheck.parser.FixedPointExpressionParser;
import org.lokray.fixcheck.util.SyntaxErrorListener;

/**
 * Entry point from expression text to {@link Expr}. Each call builds a fresh lexer and parser,
 * so the same text always yields an equal tree.
 */
public final class ExpressionParser
{
	private ExpressionParser()
	{
	}

	public static Expr parse(String text)
	{
		if (text == null || text.isBlank())
		{
			throw new ExpressionParseException("Empty expression");
		}

		FixedPointExpressionLexer lexer = new FixedPointExpressionLexer(CharStreams.fromString(text));
		lexer.removeErrorListeners();
		lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

		FixedPointExpressionParser parser = new FixedPointExpressionParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(SyntaxErrorListener.INSTANCE);

		FixedPointExpressionParser.ExpressionContext tree = parser.expression();
		return new AstBuilder().visit(tree);
	}
}
