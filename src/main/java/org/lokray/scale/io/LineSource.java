package org.lokray.scale.io;

/**
 * A lazy sequence of source lines, pulled one at a time by the Lexer.
 */
@FunctionalInterface
public interface LineSource
{
	/**
	 * Reads the next physical line.
	 *
	 * @return The line including its terminator, or the empty string once the
	 * input is exhausted.
	 * @throws java.io.UncheckedIOException if the underlying input fails.
	 */
	String readLine();
}
