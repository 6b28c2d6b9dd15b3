package org.lokray.astkit.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileLoader
{
	private final Path filePath;
	private String text;

	public FileLoader(Path filePath)
	{
		this.filePath = filePath;
	}

	public void load() throws IOException
	{
		// Keep the text verbatim, error locations are offsets into it
		this.text = Files.readString(this.filePath, StandardCharsets.UTF_8);
	}

	public String getText()
	{
		return this.text;
	}

	public Path getFilePath()
	{
		return filePath;
	}
}
