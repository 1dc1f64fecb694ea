package org.lokray.scale.lexer;

/**
 * Defines the types of tokens produced by the Scale Lexer.
 * The set mirrors the standard Python tokenizer: a handful of lexical classes
 * plus the layout markers that carry line structure and indentation.
 */
public enum TokenType
{
	// --- Lexical classes ---
	NAME,
	NUMBER,
	STRING,
	OP,
	ERRORTOKEN,

	// --- Layout ---
	COMMENT(true),
	NL(true),           // physical line end that does not end a statement
	NEWLINE(true),      // end of a logical line
	INDENT(true),
	DEDENT(true),
	ENDMARKER(true);

	private final boolean layout;

	TokenType()
	{
		this(false);
	}

	TokenType(boolean layout)
	{
		this.layout = layout;
	}

	/**
	 * Layout-only kinds carry no content of their own and are dropped by
	 * {@link org.lokray.scale.util.Tokens#stripWhitespace(Iterable)}.
	 *
	 * @return True for NL, NEWLINE, ENDMARKER, INDENT, DEDENT and COMMENT.
	 */
	public boolean isLayout()
	{
		return layout;
	}
}
