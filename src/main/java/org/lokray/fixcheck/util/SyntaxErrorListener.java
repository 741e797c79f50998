package org.lokray.fixcheck.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.lokray.fixcheck.error.ExpressionParseException;

/**
 * A custom error listener for the ANTLR lexer and parser. The first syntax error aborts the expression
 * with an {@link ExpressionParseException}; the rest of the file keeps being analyzed.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	public static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] col %d - %s", charPositionInLine + 1, msg);
		Debug.logDebug(err);
		throw new ExpressionParseException(err, e);
	}
}
