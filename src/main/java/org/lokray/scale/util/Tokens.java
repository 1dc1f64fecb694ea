package org.lokray.scale.util;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.ast.Statement;
import org.lokray.scale.lexer.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Utilities over block trees and token sequences: flattening a tree back into
 * tokens, dropping layout tokens, and splitting at a separator.
 */
public final class Tokens
{
	private Tokens()
	{
	}

	/**
	 * Returns the tokens of a block depth-first: each statement's tokens, with
	 * subexpressions expanded in place, followed by the tokens of its body.
	 */
	public static List<Token> flatten(Block block)
	{
		List<Token> out = new ArrayList<>();
		Deque<Iterator<Block.Entry>> pending = new ArrayDeque<>();
		pending.push(block.getEntries().iterator());
		while (!pending.isEmpty())
		{
			Iterator<Block.Entry> it = pending.peek();
			if (!it.hasNext())
			{
				pending.pop();
				continue;
			}
			Block.Entry entry = it.next();
			flattenInto(entry.statement().getFragments(), out);
			if (!entry.isLeaf())
			{
				pending.push(entry.body().getEntries().iterator());
			}
		}
		return out;
	}

	/**
	 * Returns the tokens of one statement with subexpressions expanded in place.
	 */
	public static List<Token> flattenStatement(Statement statement)
	{
		return statement.tokens();
	}

	/**
	 * Returns the tokens of a fragment list with subexpressions expanded in place.
	 */
	public static List<Token> flatten(List<? extends Fragment> fragments)
	{
		List<Token> out = new ArrayList<>();
		flattenInto(fragments, out);
		return out;
	}

	private static void flattenInto(List<? extends Fragment> fragments, List<Token> out)
	{
		for (Fragment fragment : fragments)
		{
			fragment.flattenInto(out);
		}
	}

	/**
	 * Drops layout-only tokens (NL, NEWLINE, ENDMARKER, INDENT, DEDENT and
	 * COMMENT). Subexpressions are kept as they are.
	 */
	public static <T extends Fragment> List<T> stripWhitespace(Iterable<T> items)
	{
		List<T> out = new ArrayList<>();
		for (T item : items)
		{
			if (!isLayout(item))
			{
				out.add(item);
			}
		}
		return out;
	}

	/**
	 * Whether the fragment is a layout-only token.
	 */
	public static boolean isLayout(Fragment fragment)
	{
		return fragment instanceof Token token && token.getType().isLayout();
	}

	/**
	 * Splits at the first item matching {@code separator}.
	 *
	 * @param items     The items to split.
	 * @param separator What to split on.
	 * @return The items before the match, the match, and the untouched rest of
	 * {@code items}; with no match, every item is in {@code before}.
	 */
	public static <T extends Fragment> Partition<T> partition(Iterable<T> items, Separator separator)
	{
		return partition(items.iterator(), separator);
	}

	/**
	 * Splits at the first item matching {@code separator}, reading {@code items}
	 * only as far as the match. The returned rest continues the same iterator.
	 */
	public static <T extends Fragment> Partition<T> partition(Iterator<T> items, Separator separator)
	{
		List<T> before = new ArrayList<>();
		while (items.hasNext())
		{
			T item = items.next();
			if (separator.test(item))
			{
				return new Partition<>(before, Optional.of(item), items);
			}
			before.add(item);
		}
		return new Partition<>(before, Optional.empty(), Collections.emptyIterator());
	}

	/**
	 * Splits at the last item matching {@code separator}.
	 * <p>
	 * Reverses the items, partitions, and reverses the pieces back. That is
	 * linear per call but quadratic when used to peel items off the same side
	 * over and over; repeated left-to-right splitting should use
	 * {@link #partition(Iterator, Separator)} and its lazy rest instead.
	 * </p>
	 */
	public static <T extends Fragment> Partition<T> rpartition(List<T> items, Separator separator)
	{
		List<T> reversed = new ArrayList<>(items);
		Collections.reverse(reversed);

		Partition<T> split = partition(reversed.iterator(), separator);
		if (!split.isMatched())
		{
			return new Partition<>(new ArrayList<>(items), Optional.empty(), Collections.emptyIterator());
		}
		List<T> before = split.restAsList();
		Collections.reverse(before);
		List<T> after = new ArrayList<>(split.before());
		Collections.reverse(after);
		return new Partition<>(before, split.separator(), after.iterator());
	}
}
