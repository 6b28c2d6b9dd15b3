package org.lokray.astkit.check;

/**
 * 1-based line and column in a source text.
 */
public class SourceLocation
{
	private final int line;
	private final int column;

	public SourceLocation(int line, int column)
	{
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SourceLocation other))
		{
			return false;
		}
		return line == other.line && column == other.column;
	}

	@Override
	public int hashCode()
	{
		return 31 * line + column;
	}

	@Override
	public String toString()
	{
		return line + "." + column;
	}
}
