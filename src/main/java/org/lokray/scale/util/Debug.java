package org.lokray.scale.util;

import org.slf4j.Logger;

/**
 * Nesting-aware trace output for the block parser. Each level of
 * {@link #indent()} shifts subsequent lines two spaces to the right, so the
 * trace of a parse reads like the block tree being built.
 * Output goes to the wrapped logger at TRACE level.
 */
public class Debug
{
	private final Logger logger;
	private int indentLevel = 0;

	public Debug(Logger logger)
	{
		this.logger = logger;
	}

	/**
	 * Master switch: nothing is formatted unless TRACE is enabled.
	 */
	public boolean isEnabled()
	{
		return logger.isTraceEnabled();
	}

	/**
	 * Logs a formatted message if tracing is enabled.
	 *
	 * @param format The message format string (e.g., "indent to %d").
	 * @param args   The arguments to format into the message.
	 */
	public void log(String format, Object... args)
	{
		if (isEnabled())
		{
			String indent = "  ".repeat(indentLevel);
			logger.trace(indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public void indent()
	{
		indentLevel++;
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public void dedent()
	{
		indentLevel = Math.max(0, indentLevel - 1);
	}
}
