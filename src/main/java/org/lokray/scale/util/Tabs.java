package org.lokray.scale.util;

/**
 * Tab expansion for indentation widths.
 */
public final class Tabs
{
	public static final int DEFAULT_TAB_SIZE = 8;

	private Tabs()
	{
	}

	/**
	 * Computes the display width of a run of leading whitespace, expanding each
	 * tab to the next multiple of {@code tabSize}. A form feed resets the width.
	 *
	 * @param prefix  Text at the start of a line (usually its indentation).
	 * @param tabSize Tab stop interval; must be positive.
	 * @return The expanded width.
	 */
	public static int width(CharSequence prefix, int tabSize)
	{
		int column = 0;
		for (int i = 0; i < prefix.length(); i++)
		{
			char c = prefix.charAt(i);
			if (c == '\t')
			{
				column = (column / tabSize + 1) * tabSize;
			}
			else if (c == '\f')
			{
				column = 0;
			}
			else
			{
				column++;
			}
		}
		return column;
	}

	/**
	 * Width of {@code line} up to (not including) {@code column}.
	 */
	public static int width(String line, int column, int tabSize)
	{
		return width(line.substring(0, Math.min(column, line.length())), tabSize);
	}
}
