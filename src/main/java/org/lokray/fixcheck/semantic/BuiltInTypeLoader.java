// File: src/main/java/org/lokray/fixcheck/semantic/BuiltInTypeLoader.java
package org.lokray.fixcheck.semantic;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.fixcheck.dto.BuiltInTypesDTO;
import org.lokray.fixcheck.dto.ConstantDTO;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.TypeParser;
import org.lokray.fixcheck.util.Debug;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the constants every analysis starts from: identifiers used in annotations
 * that are declared outside the file being checked.
 */
public class BuiltInTypeLoader
{
	public static final String DEFAULT_RESOURCE = "/builtin-types.json";

	private static final Gson GSON = new Gson();

	/**
	 * Reads the bundled {@value #DEFAULT_RESOURCE}.
	 */
	public static Map<String, FixedPointType> loadDefaults()
	{
		try (InputStream in = BuiltInTypeLoader.class.getResourceAsStream(DEFAULT_RESOURCE))
		{
			if (in == null)
			{
				throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
			}
			return read(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
		}
		catch (IOException e)
		{
			throw new IllegalStateException("Cannot read " + DEFAULT_RESOURCE, e);
		}
	}

	/**
	 * Reads a user-supplied constants file with the same layout as the bundled one.
	 */
	public static Map<String, FixedPointType> loadFile(Path file) throws IOException
	{
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
		{
			return read(reader, file.toString());
		}
	}

	static Map<String, FixedPointType> read(Reader reader, String source)
	{
		BuiltInTypesDTO dto;
		try
		{
			dto = GSON.fromJson(reader, BuiltInTypesDTO.class);
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed built-in types in " + source + ": " + e.getMessage(), e);
		}

		Map<String, FixedPointType> types = new LinkedHashMap<>();
		if (dto == null || dto.constants == null)
		{
			return types;
		}
		for (ConstantDTO constant : dto.constants)
		{
			if (constant.name == null || constant.type == null)
			{
				throw new IllegalArgumentException("Built-in constant in " + source + " needs both 'name' and 'type'");
			}
			types.put(constant.name, TypeParser.parseType(constant.type));
		}
		Debug.logDebug("Loaded " + types.size() + " built-in constant(s) from " + source);
		return types;
	}
}
