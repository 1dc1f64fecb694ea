package org.lokray.scale.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A lazily scanned token sequence that can be iterated exactly once.
 * Tokens are produced as the consumer pulls them, so a parse error in a late
 * line surfaces only when the consumer gets there. Callers that need several
 * passes over the same tokens must {@link #toList() materialize} them first.
 */
public class TokenStream implements Iterable<Token>
{
	private final Iterator<Token> tokens;
	private boolean consumed = false;

	public TokenStream(Iterator<Token> tokens)
	{
		this.tokens = Objects.requireNonNull(tokens, "null tokens");
	}

	/**
	 * Hands out the underlying iterator.
	 *
	 * @throws IllegalStateException if the stream was already iterated.
	 */
	@Override
	public Iterator<Token> iterator()
	{
		if (consumed)
		{
			throw new IllegalStateException("token stream already consumed");
		}
		consumed = true;
		return tokens;
	}

	/**
	 * Drains the stream into a list that can be traversed any number of times.
	 */
	public List<Token> toList()
	{
		Iterator<Token> it = iterator();
		List<Token> list = new ArrayList<>();
		while (it.hasNext())
		{
			list.add(it.next());
		}
		return list;
	}
}
