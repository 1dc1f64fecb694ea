package org.lokray.scale.ast;

import org.lokray.scale.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fragments of one logical source line, including its trailing NEWLINE
 * and any comment or blank-line tokens that preceded it.
 * Bracketed parts appear as {@link Subexpression} fragments.
 */
public final class Statement
{
	private final List<Fragment> fragments;

	public Statement(List<? extends Fragment> fragments)
	{
		this.fragments = new ArrayList<>(fragments);
	}

	public List<Fragment> getFragments()
	{
		return Collections.unmodifiableList(fragments);
	}

	public boolean isEmpty()
	{
		return fragments.isEmpty();
	}

	/**
	 * Returns the tokens of this statement with all subexpressions expanded.
	 */
	public List<Token> tokens()
	{
		List<Token> out = new ArrayList<>();
		for (Fragment fragment : fragments)
		{
			fragment.flattenInto(out);
		}
		return out;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens())
		{
			if (token.getType().isLayout() || token.getText().isEmpty())
			{
				continue;
			}
			if (sb.length() > 0)
			{
				sb.append(' ');
			}
			sb.append(token.getText());
		}
		return sb.toString();
	}
}
