package org.lokray.scale.lexer;

/**
 * A location in the source: 1-based line, 0-based column.
 *
 * @param line   The line number, starting at 1.
 * @param column The column offset within the line, starting at 0.
 */
public record Position(int line, int column) implements Comparable<Position>
{
	public Position
	{
		if (line < 0 || column < 0)
		{
			throw new IllegalArgumentException("negative position: (" + line + ", " + column + ")");
		}
	}

	@Override
	public int compareTo(Position other)
	{
		int cmp = Integer.compare(line, other.line);
		return cmp != 0 ? cmp : Integer.compare(column, other.column);
	}

	@Override
	public String toString()
	{
		return "(" + line + ", " + column + ")";
	}
}
