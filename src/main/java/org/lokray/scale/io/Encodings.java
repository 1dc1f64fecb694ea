package org.lokray.scale.io;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the encoding names found in source declarations
 * ({@code # -*- coding: latin-1 -*-}) to Java charsets.
 */
public final class Encodings
{
	// Python spellings that Charset.forName does not know.
	private static final Map<String, Charset> ALIASES = Map.of(
			"utf8", StandardCharsets.UTF_8,
			"u8", StandardCharsets.UTF_8,
			"latin-1", StandardCharsets.ISO_8859_1,
			"latin1", StandardCharsets.ISO_8859_1,
			"l1", StandardCharsets.ISO_8859_1,
			"iso-8859-1", StandardCharsets.ISO_8859_1,
			"ascii", StandardCharsets.US_ASCII,
			"us-ascii", StandardCharsets.US_ASCII);

	private Encodings()
	{
	}

	/**
	 * Looks up a declared encoding name.
	 *
	 * @param name The name as written in the declaration.
	 * @return The charset, or empty if the name is unknown to this JVM.
	 */
	public static Optional<Charset> forName(String name)
	{
		String key = normalize(name);
		Charset alias = ALIASES.get(key);
		if (alias != null)
		{
			return Optional.of(alias);
		}
		try
		{
			return Optional.of(Charset.forName(key));
		}
		catch (IllegalCharsetNameException | UnsupportedCharsetException e)
		{
			return Optional.empty();
		}
	}

	/**
	 * Whether the declared name denotes UTF-8, the only encoding compatible
	 * with a byte-order marker.
	 */
	public static boolean isUtf8(String name)
	{
		String key = normalize(name);
		return key.equals("utf8") || key.equals("utf-8");
	}

	private static String normalize(String name)
	{
		return name.toLowerCase(Locale.ROOT).replace('_', '-');
	}
}
