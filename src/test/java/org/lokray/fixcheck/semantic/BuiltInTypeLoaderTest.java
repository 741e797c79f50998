package org.lokray.fixcheck.semantic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fixcheck.error.InvalidTypeAnnotationException;
import org.lokray.fixcheck.semantic.type.FixedPointType;
import org.lokray.fixcheck.semantic.type.TypeParser;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltInTypeLoaderTest
{

	@Test
	void bundledDefaults()
	{
		assertEquals(TypeParser.parseType("U7F0"), BuiltInTypeLoader.loadDefaults().get("PITCH_REF_C2"));
	}

	@Test
	void readsConstants()
	{
		Map<String, FixedPointType> types = BuiltInTypeLoader.read(new StringReader(
				"{\"constants\":[{\"name\":\"GAIN_ONE\",\"type\":\"S12F11\"},{\"name\":\"SR\",\"type\":\"U16F0\"}]}"), "test");
		assertEquals(2, types.size());
		assertEquals(TypeParser.parseType("S12F11"), types.get("GAIN_ONE"));
	}

	@Test
	void emptyDocumentHasNoConstants()
	{
		assertTrue(BuiltInTypeLoader.read(new StringReader("{}"), "test").isEmpty());
	}

	@Test
	void rejectsBadInput()
	{
		assertThrows(IllegalArgumentException.class,
				() -> BuiltInTypeLoader.read(new StringReader("{\"constants\": ["), "test"));
		assertThrows(IllegalArgumentException.class,
				() -> BuiltInTypeLoader.read(new StringReader("{\"constants\":[{\"name\":\"X\"}]}"), "test"));
		assertThrows(InvalidTypeAnnotationException.class,
				() -> BuiltInTypeLoader.read(new StringReader("{\"constants\":[{\"name\":\"X\",\"type\":\"S4F4\"}]}"), "test"));
	}

	@Test
	void loadsFromFile(@TempDir Path dir) throws IOException
	{
		Path file = dir.resolve("consts.json");
		Files.writeString(file, "{\"constants\":[{\"name\":\"STEP\",\"type\":\"U4F0\"}]}");
		assertEquals(TypeParser.parseType("U4F0"), BuiltInTypeLoader.loadFile(file).get("STEP"));
	}
}
