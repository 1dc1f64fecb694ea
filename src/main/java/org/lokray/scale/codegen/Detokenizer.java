package org.lokray.scale.codegen;

import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenType;
import org.lokray.scale.util.Tabs;

import java.util.ArrayList;
import java.util.List;

/**
 * Detokenizer turns tokens back into source text.
 * <p>
 * It works on any token sequence: a whole file, a flattened block or
 * statement, or an arbitrary fragment. Spacing inside a line is copied from
 * each token's recorded source line, so tabs and runs of spaces survive as
 * they were. Leading indentation is rebuilt relative to the first token that is
 * not layout (comments and line ends do not count), which lets an inner block be written out flush-left, and
 * every line can be shifted right by a fixed extra indent so the text can be
 * embedded somewhere else.
 * </p>
 * Lines the tokens skip over (for example when writing out a fragment) are
 * replaced by backslash continuation lines, so the output still scans to
 * tokens on the same line numbers.
 */
public class Detokenizer
{
	private final int indent;
	private final int tabSize;

	public Detokenizer()
	{
		this(0);
	}

	/**
	 * Constructs a Detokenizer.
	 *
	 * @param indent Extra spaces added in front of every output line.
	 */
	public Detokenizer(int indent)
	{
		this(indent, Tabs.DEFAULT_TAB_SIZE);
	}

	/**
	 * Constructs a Detokenizer.
	 *
	 * @param indent  Extra spaces added in front of every output line.
	 * @param tabSize Tab stop interval used to measure leading indentation.
	 */
	public Detokenizer(int indent, int tabSize)
	{
		if (indent < 0)
		{
			throw new IllegalArgumentException("indent: " + indent);
		}
		this.indent = indent;
		this.tabSize = tabSize;
	}

	/**
	 * Reconstructs the source text of {@code tokens}.
	 *
	 * @param tokens Tokens in source order.
	 * @return Text that scans back to the same tokens.
	 */
	public String detokenize(Iterable<? extends Token> tokens)
	{
		List<Token> sequence = new ArrayList<>();
		tokens.forEach(sequence::add);

		StringBuilder out = new StringBuilder();
		String pad = " ".repeat(indent);
		int baseIndent = baseIndent(sequence);

		int lastRow = 0;
		int lastCol = 0;
		String lastLine = "";

		for (Token token : sequence)
		{
			TokenType type = token.getType();
			int startRow = token.getStart().line();
			int startCol = token.getStart().column();
			String line = token.getLine();

			if (lastRow == 0)
			{
				// First line of input is the first line of output
				lastRow = startRow;
			}
			if (startRow > lastRow)
			{
				// Finish the previous physical line, then account for lines with no tokens
				if (!lastLine.isEmpty())
				{
					if (lastLine.length() > lastCol)
					{
						out.append(lastLine, lastCol, lastLine.length());
					}
					lastRow++;
				}
				for (; lastRow < startRow; lastRow++)
				{
					out.append(pad).append("\\\n");
				}
				lastCol = 0;
			}

			if (lastCol == 0)
			{
				if (type == TokenType.INDENT)
				{
					// Indentation is rebuilt from the next token's column
					continue;
				}
				int column = Tabs.width(line, startCol, tabSize);
				if (column > baseIndent)
				{
					out.append(" ".repeat(column - baseIndent));
				}
				if (indent > 0 && !isLineEnd(type))
				{
					out.append(pad);
				}
			}
			else if (startCol > lastCol)
			{
				// Keep intraline whitespace exactly as written
				out.append(line, lastCol, Math.min(startCol, line.length()));
			}

			out.append(token.getText());

			lastRow = token.getEnd().line();
			lastCol = token.getEnd().column();
			lastLine = lastPhysicalLine(line);
		}
		return out.toString();
	}

	/**
	 * Width of the line prefix in front of the first token that is not layout.
	 * Comments and blank lines before it are measured against it too, and
	 * shallower ones come out flush-left.
	 *
	 * @return The width, or 0 if there is no such token.
	 */
	private int baseIndent(List<Token> sequence)
	{
		for (Token token : sequence)
		{
			if (!token.getType().isLayout())
			{
				return Tabs.width(token.getLine(), token.getStart().column(), tabSize);
			}
		}
		return 0;
	}

	private static boolean isLineEnd(TokenType type)
	{
		return type == TokenType.DEDENT || type == TokenType.ENDMARKER
				|| type == TokenType.NL || type == TokenType.NEWLINE;
	}

	/**
	 * A multi-line string token records all the lines it spans; positions
	 * after it refer to the last of them.
	 */
	private static String lastPhysicalLine(String line)
	{
		int end = line.endsWith("\n") ? line.length() - 1 : line.length();
		int newline = line.lastIndexOf('\n', end - 1);
		return newline < 0 ? line : line.substring(newline + 1);
	}
}
