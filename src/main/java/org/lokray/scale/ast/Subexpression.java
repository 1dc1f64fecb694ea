package org.lokray.scale.ast;

import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The contents of one matched bracket pair, brackets included.
 * The first fragment is always the opening bracket token; once the
 * bracket has been closed, the last fragment is the closing bracket token.
 */
public final class Subexpression implements Fragment
{
	private final List<Fragment> fragments;

	/**
	 * Wraps the given fragment list. The list is not copied: the block parser
	 * keeps filling it until the closing bracket is seen.
	 *
	 * @param fragments The bracketed fragments, starting with the opening bracket.
	 */
	public Subexpression(List<Fragment> fragments)
	{
		if (fragments.isEmpty() || !(fragments.get(0) instanceof Token))
		{
			throw new IllegalArgumentException("subexpression must start with its opening bracket");
		}
		this.fragments = fragments;
	}

	public List<Fragment> getFragments()
	{
		return Collections.unmodifiableList(fragments);
	}

	public Token getOpen()
	{
		return (Token) fragments.get(0);
	}

	/**
	 * The fragments between the brackets.
	 */
	public List<Fragment> getInterior()
	{
		int end = fragments.size();
		if (end > 1 && fragments.get(end - 1) instanceof Token last && last.getType() == TokenType.OP
				&& isClose(last.getText()))
		{
			end--;
		}
		return Collections.unmodifiableList(fragments.subList(1, end));
	}

	private static boolean isClose(String text)
	{
		return text.equals(")") || text.equals("]") || text.equals("}");
	}

	@Override
	public void flattenInto(List<Token> out)
	{
		// Iterative so that deeply nested brackets cannot exhaust the call stack.
		Deque<Iterator<Fragment>> pending = new ArrayDeque<>();
		pending.push(fragments.iterator());
		while (!pending.isEmpty())
		{
			Iterator<Fragment> it = pending.peek();
			if (!it.hasNext())
			{
				pending.pop();
				continue;
			}
			Fragment next = it.next();
			if (next instanceof Subexpression sub)
			{
				pending.push(sub.fragments.iterator());
			}
			else
			{
				out.add((Token) next);
			}
		}
	}

	@Override
	public Token firstToken()
	{
		return getOpen();
	}

	@Override
	public String toString()
	{
		return "Subexpression" + fragments;
	}
}
