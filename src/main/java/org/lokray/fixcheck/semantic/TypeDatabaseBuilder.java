package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.error.InvalidTypeAnnotationException;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.TypeParser;
import org.lokray.fixcheck.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans declaration lines and builds the {@link IdentifierTable} for one file.
 * <p>
 * Two shapes are recognised:
 * <pre>
 * reg [signed] [msb:lsb] name [dims];   // comment, optionally with a type such as U24F24
 * localparam [signed] [msb:lsb] NAME = value;   // comment
 * </pre>
 * The declared range gives the width. A type token in the comment supplies signedness and fractional bits;
 * without one the identifier is an integer of the declared signedness.
 */
public final class TypeDatabaseBuilder
{
	private static final Pattern REG_DECLARATION = Pattern.compile(
			"^reg\\s+(signed\\s+)?\\[([^\\]:]+):([^\\]]+)\\]\\s+(\\w+)(\\s*\\[.*\\])?\\s*;(\\s*//(.*))?");

	private static final Pattern LOCALPARAM_DECLARATION = Pattern.compile(
			"^localparam\\s+(signed\\s+)?\\[(\\d+):(\\d+)\\]\\s+(\\w+)\\s*=\\s*(.+?)\\s*;(\\s*//(.*))?");

	// Registers documented as eight-way arrays are also referenced by their base name.
	private static final String ARRAY_OF_8_SUFFIX = "_8x";

	private final Map<String, FixedPointType> types = new LinkedHashMap<>();
	private final Set<String> knownRegisters = new LinkedHashSet<>();
	private final List<String> warnings = new ArrayList<>();

	private TypeDatabaseBuilder(Map<String, FixedPointType> builtIns)
	{
		types.putAll(builtIns);
	}

	public static IdentifierTable buildTypeDatabase(String text)
	{
		return buildTypeDatabase(text.lines().toList(), BuiltInTypeLoader.loadDefaults());
	}

	/**
	 * @param builtIns constants available before any declaration; declarations in the file override them
	 */
	public static IdentifierTable buildTypeDatabase(List<String> lines, Map<String, FixedPointType> builtIns)
	{
		TypeDatabaseBuilder builder = new TypeDatabaseBuilder(builtIns);
		for (String line : lines)
		{
			String trimmed = line.strip();
			if (!builder.registerDeclaration(trimmed))
			{
				builder.localparamDeclaration(trimmed);
			}
		}
		Debug.logDebug("Type database: " + builder.types.size() + " typed identifier(s), "
				+ builder.knownRegisters.size() + " register(s)");
		return new IdentifierTable(builder.types, builder.knownRegisters, builder.warnings);
	}

	private boolean registerDeclaration(String line)
	{
		Matcher m = REG_DECLARATION.matcher(line);
		if (!m.find())
		{
			return false;
		}

		boolean signed = m.group(1) != null;
		String msb = m.group(2).strip();
		String lsb = m.group(3).strip();
		String name = m.group(4);
		String comment = m.group(7);

		FixedPointType type = declaredType("reg", name, signed, msb, lsb, comment);

		define(name, type, true);
		if (name.endsWith(ARRAY_OF_8_SUFFIX))
		{
			define(name.substring(0, name.length() - ARRAY_OF_8_SUFFIX.length()), type, true);
		}
		return true;
	}

	private void localparamDeclaration(String line)
	{
		Matcher m = LOCALPARAM_DECLARATION.matcher(line);
		if (!m.find())
		{
			return;
		}

		boolean signed = m.group(1) != null;
		String name = m.group(4);
		FixedPointType type = declaredType("localparam", name, signed, m.group(2), m.group(3), m.group(7));
		define(name, type, false);
	}

	private void define(String name, FixedPointType type, boolean register)
	{
		if (register)
		{
			knownRegisters.add(name);
		}
		if (type != null)
		{
			types.put(name, type);
		}
		else
		{
			Debug.logDebug("Register '" + name + "' has no usable type");
		}
	}

	/**
	 * The type of one declaration, or null when the range cannot be sized and the comment has no type.
	 */
	private FixedPointType declaredType(String keyword, String name, boolean signed, String msb, String lsb, String comment)
	{
		Integer rawWidth = rangeWidth(msb, lsb);
		Matcher typeMatch = comment != null ? TypeParser.TYPE_TOKEN.matcher(comment) : null;

		FixedPointType plain = rawWidth != null ? new FixedPointType(signed, rawWidth, 0) : null;

		if (typeMatch != null && typeMatch.find())
		{
			String token = typeMatch.group();
			FixedPointType annotated;
			try
			{
				annotated = TypeParser.parseType(token);
			}
			catch (InvalidTypeAnnotationException e)
			{
				warn(String.format("Warning: Invalid type annotation for %s: %s", name, e.getMessage()));
				return plain;
			}

			if (rawWidth == null)
			{
				return annotated;
			}
			if (annotated.getTotalBits() != rawWidth)
			{
				warn(String.format("Warning: Bit width mismatch for %s: %s [%s:%s] vs %s", name, keyword, msb, lsb, token));
			}
			if (annotated.isSigned() && annotated.getFracBits() >= rawWidth)
			{
				warn(String.format("Warning: Invalid type annotation for %s: %s leaves no integer bits in [%s:%s]", name, token, msb, lsb));
				return plain;
			}
			// The range is what the hardware actually stores.
			return new FixedPointType(annotated.isSigned(), rawWidth, annotated.getFracBits());
		}

		return plain;
	}

	/**
	 * Width of {@code [msb:lsb]} in either direction, or null if a bound is not an integer literal or the width does not fit an int.
	 */
	private static Integer rangeWidth(String msb, String lsb)
	{
		try
		{
			long width = Math.abs((long) Integer.parseInt(msb) - Integer.parseInt(lsb)) + 1;
			return width <= Integer.MAX_VALUE ? (int) width : null;
		}
		catch (NumberFormatException e)
		{
			return null;
		}
	}

	private void warn(String message)
	{
		Debug.logWarning(message);
		warnings.add(message);
	}
}
