package org.lokray.scale.lexer;

import org.lokray.scale.ast.Fragment;

import java.util.List;
import java.util.Objects;

/**
 * Represents a single token produced by the Scale Lexer.
 * Besides its type and text, each token remembers where it starts and ends
 * and the physical source line it was read from, so that the original
 * spacing can be reproduced exactly when the token is written back out.
 */
public final class Token implements Fragment
{
	private final TokenType type;    // The classification of the token (e.g., NAME, OP, NEWLINE)
	private final String text;       // The exact source text of the token; empty for DEDENT and ENDMARKER
	private final Position start;
	private final Position end;
	private final String line;       // The physical line(s) the token came from

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type  The TokenType of this token.
	 * @param text  The raw text of the token as it appears in the source.
	 * @param start Where the token begins.
	 * @param end   Where the token ends (exclusive column); never before {@code start}.
	 * @param line  The verbatim source line the token was scanned from.
	 */
	public Token(TokenType type, String text, Position start, Position end, String line)
	{
		this.type = Objects.requireNonNull(type, "null type");
		this.text = Objects.requireNonNull(text, "null text");
		this.start = Objects.requireNonNull(start, "null start");
		this.end = Objects.requireNonNull(end, "null end");
		this.line = Objects.requireNonNull(line, "null line");
		if (end.compareTo(start) < 0)
		{
			throw new IllegalArgumentException("token ends " + end + " before it starts " + start);
		}
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public String getText()
	{
		return text;
	}

	public Position getStart()
	{
		return start;
	}

	public Position getEnd()
	{
		return end;
	}

	public String getLine()
	{
		return line;
	}

	/**
	 * Checks whether this is an operator token with exactly the given text.
	 */
	public boolean isOp(String op)
	{
		return type == TokenType.OP && text.equals(op);
	}

	@Override
	public void flattenInto(List<Token> out)
	{
		out.add(this);
	}

	@Override
	public Token firstToken()
	{
		return this;
	}

	/**
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TYPE 'text' (line, col)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + text.replace("\n", "\\n") + "' " + start;
	}

	/**
	 * Tokens are equal when type, text and both positions agree. The source
	 * line is not compared: it is context, not content.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type
				&& text.equals(token.text)
				&& start.equals(token.start)
				&& end.equals(token.end);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + text.hashCode();
		result = 31 * result + start.hashCode();
		return result;
	}
}
