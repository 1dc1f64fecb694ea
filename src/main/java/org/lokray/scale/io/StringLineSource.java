package org.lokray.scale.io;

/**
 * Splits an already decoded string into lines. Lines end after each
 * {@code '\n'}; the terminator (with any preceding {@code '\r'}) is kept.
 * No encoding detection is applied to string input.
 */
public class StringLineSource implements LineSource
{
	private final String text;
	private int offset = 0;

	public StringLineSource(String text)
	{
		this.text = text;
	}

	@Override
	public String readLine()
	{
		if (offset >= text.length())
		{
			return "";
		}
		int newline = text.indexOf('\n', offset);
		int end = newline < 0 ? text.length() : newline + 1;
		String line = text.substring(offset, end);
		offset = end;
		return line;
	}
}
