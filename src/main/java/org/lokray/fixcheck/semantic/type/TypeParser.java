package org.lokray.fixcheck.semantic.type;

import org.lokray.fixcheck.error.InvalidTypeAnnotationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses declared type tokens of the form {@code [SU]<total>F<frac>}.
 */
public final class TypeParser
{
	public static final Pattern TYPE_TOKEN = Pattern.compile("([SU])(\\d+)F(\\d+)");

	private TypeParser()
	{
	}

	public static FixedPointType parseType(String token)
	{
		if (token == null)
		{
			throw new InvalidTypeAnnotationException("null", "Invalid type format");
		}
		Matcher m = TYPE_TOKEN.matcher(token);
		if (!m.matches())
		{
			throw new InvalidTypeAnnotationException(token, "Invalid type format");
		}

		boolean signed = m.group(1).equals("S");
		int total;
		int frac;
		try
		{
			total = Integer.parseInt(m.group(2));
			frac = Integer.parseInt(m.group(3));
		}
		catch (NumberFormatException e)
		{
			throw new InvalidTypeAnnotationException(token, "Type width out of range");
		}

		if (total < 1)
		{
			throw new InvalidTypeAnnotationException(token, "Type must have at least one bit");
		}
		// A signed value needs at least one bit above the binary point for the sign.
		if (signed && frac >= total)
		{
			throw new InvalidTypeAnnotationException(token, "Invalid signed type");
		}
		return new FixedPointType(signed, total, frac);
	}
}
