package org.lokray.scale.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * The result of splitting a sequence at a separator.
 * <p>
 * {@link #rest()} is the unread remainder of the sequence that was split, not
 * a copy: splitting it again continues where this split stopped, which keeps
 * repeated left-to-right splitting linear. It can be traversed once.
 * </p>
 *
 * @param before    Items before the separator; everything if there was none.
 * @param separator The matching item, if any.
 * @param rest      Items after the separator; empty if there was none.
 * @param <T>       Item type, usually {@link org.lokray.scale.lexer.Token} or
 *                  {@link org.lokray.scale.ast.Fragment}.
 */
public record Partition<T>(List<T> before, Optional<T> separator, Iterator<T> rest)
{
	public Partition
	{
		before = Collections.unmodifiableList(before);
	}

	public boolean isMatched()
	{
		return separator.isPresent();
	}

	/**
	 * Drains {@link #rest()} into a list.
	 */
	public List<T> restAsList()
	{
		List<T> after = new ArrayList<>();
		rest.forEachRemaining(after::add);
		return after;
	}
}
