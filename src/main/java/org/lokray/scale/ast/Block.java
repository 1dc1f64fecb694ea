package org.lokray.scale.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One indentation scope: an ordered list of statements, each with the block
 * indented beneath it. A statement without an indented body carries an
 * empty block.
 */
public final class Block
{
	/**
	 * A statement together with the block nested under it.
	 *
	 * @param statement The logical line.
	 * @param body      The indented block beneath it; empty for a leaf.
	 */
	public record Entry(Statement statement, Block body)
	{
		public boolean isLeaf()
		{
			return body.isEmpty();
		}
	}

	private final List<Entry> entries;

	public Block()
	{
		this.entries = new ArrayList<>();
	}

	/**
	 * Appends a statement with a fresh, empty body.
	 *
	 * @param statement The statement to add.
	 * @return The new entry, whose body may be filled in later.
	 */
	public Entry add(Statement statement)
	{
		Entry entry = new Entry(statement, new Block());
		entries.add(entry);
		return entry;
	}

	public List<Entry> getEntries()
	{
		return Collections.unmodifiableList(entries);
	}

	public Entry get(int index)
	{
		return entries.get(index);
	}

	public Entry last()
	{
		return entries.get(entries.size() - 1);
	}

	public int size()
	{
		return entries.size();
	}

	public boolean isEmpty()
	{
		return entries.isEmpty();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Entry entry : entries)
		{
			sb.append(entry.statement()).append("\n");
			if (!entry.isLeaf())
			{
				// Indent statements within the block
				sb.append(indent(entry.body().toString(), 1));
			}
		}
		return sb.toString();
	}

	// Helper for indentation
	private String indent(String text, int level)
	{
		StringBuilder indentedText = new StringBuilder();
		String prefix = "  ".repeat(level);
		for (String line : text.split("\n"))
		{
			indentedText.append(prefix).append(line).append("\n");
		}
		return indentedText.toString();
	}
}
