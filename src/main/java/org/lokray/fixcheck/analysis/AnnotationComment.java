package org.lokray.fixcheck.analysis;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A comment documenting the fixed-point type of the statement below it, in one of two forms:
 * <pre>
 * // S12F11 result = expression
 * // expression = S12F11
 * </pre>
 * A leading description such as {@code // Volume scaling:} is ignored.
 */
public final class AnnotationComment
{
	private static final Pattern DESCRIPTIVE_PREFIX = Pattern.compile("^\\s*//\\s*[A-Za-z ]+:\\s*");
	private static final Pattern TYPE_FIRST = Pattern.compile("^\\s*//\\s*([SU]\\d+F\\d+)\\s+(\\w+)\\s*=\\s*(.+)$");
	private static final Pattern TYPE_LAST = Pattern.compile("^\\s*//\\s*(.+?)\\s*=\\s*([SU]\\d+F\\d+)$");

	private final String typeToken;
	private final String expression;

	private AnnotationComment(String typeToken, String expression)
	{
		this.typeToken = typeToken;
		this.expression = expression;
	}

	public static Optional<AnnotationComment> parse(String line)
	{
		String text = DESCRIPTIVE_PREFIX.matcher(line.strip()).replaceFirst("// ").strip();

		Matcher typeFirst = TYPE_FIRST.matcher(text);
		if (typeFirst.matches())
		{
			return Optional.of(new AnnotationComment(typeFirst.group(1), typeFirst.group(3).strip()));
		}

		Matcher typeLast = TYPE_LAST.matcher(text);
		if (typeLast.matches())
		{
			return Optional.of(new AnnotationComment(typeLast.group(2), typeLast.group(1).strip()));
		}
		return Optional.empty();
	}

	/**
	 * The declared type as written; not yet validated.
	 */
	public String getTypeToken()
	{
		return typeToken;
	}

	public String getExpression()
	{
		return expression;
	}
}
