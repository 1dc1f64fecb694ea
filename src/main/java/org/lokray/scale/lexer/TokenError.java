package org.lokray.scale.lexer;

/**
 * A structural or lexical error in the source being read: a malformed
 * literal, a bracket left open or closed with the wrong shape, an indentation
 * that matches no outer level, or a conflicting encoding declaration.
 * Always fatal to the parse that raised it.
 */
public class TokenError extends RuntimeException
{
	private final String rawMessage;
	private final Position position;

	public TokenError(String message, Position position)
	{
		super(message + " " + position);
		this.rawMessage = message;
		this.position = position;
	}

	/**
	 * The message without the position suffix.
	 */
	public String getRawMessage()
	{
		return rawMessage;
	}

	public Position getPosition()
	{
		return position;
	}
}
