package org.lokray.astkit.check;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts character offsets of a source text to line and column.
 */
public class SourceLocator
{
	private final int length;
	private final int[] lineStarts;

	public SourceLocator(String text)
	{
		String source = text == null ? "" : text;
		this.length = source.length();

		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < source.length(); i++)
		{
			if (source.charAt(i) == '\n')
			{
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	/**
	 * @param offset character offset, 0-based
	 * @return the location, or null if the offset lies outside the text
	 */
	public SourceLocation locate(int offset)
	{
		if (offset < 0 || offset > length)
		{
			return null;
		}
		int idx = Arrays.binarySearch(lineStarts, offset);
		// not a line start: the insertion point is one past the line holding the offset
		int line = idx >= 0 ? idx : -idx - 2;
		return new SourceLocation(line + 1, offset - lineStarts[line] + 1);
	}

	public int getLineCount()
	{
		return lineStarts.length;
	}
}
