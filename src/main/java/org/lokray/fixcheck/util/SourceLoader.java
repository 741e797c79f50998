package org.lokray.fixcheck.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a Verilog source fully before analysis.
 */
public class SourceLoader
{
	private final Path filePath;
	private List<String> lines;

	public SourceLoader(Path filePath)
	{
		this.filePath = filePath;
	}

	public void load() throws IOException
	{
		// Read all lines from the file into a List<String>
		this.lines = Files.readAllLines(this.filePath, StandardCharsets.UTF_8);
	}

	public List<String> getLines()
	{
		if (lines == null)
		{
			throw new IllegalStateException("Source not loaded: " + filePath);
		}
		return lines;
	}
}
