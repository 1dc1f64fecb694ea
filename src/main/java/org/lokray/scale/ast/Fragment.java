package org.lokray.scale.ast;

import org.lokray.scale.lexer.Token;

import java.util.List;

/**
 * One element of a {@link Statement}: either a plain {@link Token} or a
 * {@link Subexpression} holding everything between a matched pair of brackets.
 */
public interface Fragment
{
	/**
	 * Appends the tokens of this fragment to {@code out}, expanding nested
	 * subexpressions in place.
	 */
	void flattenInto(List<Token> out);

	/**
	 * The first token of this fragment, used to position error messages.
	 */
	Token firstToken();
}
