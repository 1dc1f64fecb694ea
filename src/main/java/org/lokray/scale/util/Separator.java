package org.lokray.scale.util;

import org.lokray.scale.ast.Fragment;
import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenType;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * What {@link Tokens#partition} splits on: a token with a given text, or a
 * token of a given type. Subexpressions never match, so a separator inside
 * brackets is never split on.
 *
 * @param mode Whether to compare {@link #text} or {@link #type}.
 * @param text The exact token text to match in {@link MatchMode#TEXT} mode.
 * @param type The token type to match in {@link MatchMode#KIND} mode.
 */
public record Separator(MatchMode mode, String text, TokenType type) implements Predicate<Fragment>
{
	public enum MatchMode
	{
		TEXT,
		KIND
	}

	public Separator
	{
		Objects.requireNonNull(mode, "null mode");
		if (mode == MatchMode.TEXT ? text == null : type == null)
		{
			throw new IllegalArgumentException("nothing to match in " + mode + " mode");
		}
	}

	/**
	 * Matches tokens whose text is exactly {@code text}.
	 */
	public static Separator byText(String text)
	{
		return new Separator(MatchMode.TEXT, text, null);
	}

	/**
	 * Matches tokens of the given type.
	 */
	public static Separator byKind(TokenType type)
	{
		return new Separator(MatchMode.KIND, null, type);
	}

	@Override
	public boolean test(Fragment fragment)
	{
		if (!(fragment instanceof Token token))
		{
			return false;
		}
		return mode == MatchMode.TEXT ? token.getText().equals(text) : token.getType() == type;
	}
}
