package org.lokray.scale.io;

import org.lokray.scale.lexer.Position;
import org.lokray.scale.lexer.TokenError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads lines from a byte stream, honouring a UTF-8 byte-order marker on the
 * first line and an encoding declaration comment ({@code # coding: name}) on
 * either of the first two lines.
 * <p>
 * Only "bare" lines are examined: a line that starts with the BOM, or that is
 * blank or holds nothing but a comment. The first line with real code ends the
 * search, as does finding an encoding or reading two lines. Lines read while
 * searching are decoded with the default charset (the BOM line as UTF-8);
 * everything after is decoded with the declared encoding through a
 * {@link Reader}, so the Lexer only ever sees decoded text.
 * </p>
 */
public class SourceReader implements LineSource
{
	private static final Logger logger = LoggerFactory.getLogger(SourceReader.class);

	private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
	private static final Pattern BLANK_OR_COMMENT = Pattern.compile("\\s*(#.*)?", Pattern.DOTALL);
	private static final Pattern CODING = Pattern.compile("coding[:=]\\s*([-\\w.]+)");

	/** Lines past this one never carry an encoding declaration. */
	private static final int DECLARATION_LINES = 2;

	private final InputStream in;
	private final Charset defaultCharset;

	private boolean searching = true;
	private int lineNumber = 0;
	private Charset declared;
	private Reader decoder;

	/**
	 * Constructs a SourceReader.
	 *
	 * @param in             The raw source. Not closed by this reader.
	 * @param defaultCharset Charset for lines not covered by a BOM or declaration.
	 */
	public SourceReader(InputStream in, Charset defaultCharset)
	{
		Objects.requireNonNull(in, "null input stream");
		this.in = in.markSupported() ? in : new BufferedInputStream(in);
		this.defaultCharset = Objects.requireNonNull(defaultCharset, "null default charset");
	}

	/**
	 * The encoding implied by a BOM or declaration, if one has been found so far.
	 */
	public Charset getDeclaredCharset()
	{
		return declared;
	}

	@Override
	public String readLine()
	{
		try
		{
			return searching ? readSearching() : readDecoded();
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("reading source line " + (lineNumber + 1) + ": " + e.getMessage(), e);
		}
	}

	private String readSearching() throws IOException
	{
		byte[] raw = readRawLine();
		if (raw.length == 0)
		{
			searching = false;
			return "";
		}
		lineNumber++;

		boolean bom = lineNumber == 1 && startsWithBom(raw);
		if (!bom && !isBare(new String(raw, StandardCharsets.ISO_8859_1)))
		{
			// Real code: the declaration window is closed.
			searching = false;
			return new String(raw, defaultCharset);
		}

		String line;
		if (bom)
		{
			declared = StandardCharsets.UTF_8;
			line = new String(raw, BOM.length, raw.length - BOM.length, StandardCharsets.UTF_8);
			logger.debug("UTF-8 byte-order marker on line 1");
		}
		else
		{
			line = new String(raw, defaultCharset);
		}

		if (line.contains("coding"))
		{
			Matcher m = CODING.matcher(line);
			if (m.find())
			{
				declared = resolve(m.group(1), new Position(lineNumber, m.start(1)), bom);
			}
		}

		if (declared != null || lineNumber >= DECLARATION_LINES)
		{
			searching = false;
		}
		return line;
	}

	private Charset resolve(String name, Position where, boolean bom)
	{
		if (bom && !Encodings.isUtf8(name))
		{
			throw new TokenError("UTF-8 BOM, but '" + name + "' encoding requested", where);
		}
		Charset charset = Encodings.forName(name)
				.orElseThrow(() -> new TokenError("unknown encoding: " + name, where));
		logger.debug("Encoding declared on line {}: {} ({})", where.line(), name, charset.name());
		return charset;
	}

	private String readDecoded() throws IOException
	{
		if (decoder == null)
		{
			decoder = new InputStreamReader(in, declared != null ? declared : defaultCharset);
		}
		StringBuilder line = new StringBuilder();
		int c;
		while ((c = decoder.read()) != -1)
		{
			line.append((char) c);
			if (c == '\n')
			{
				break;
			}
		}
		return line.toString();
	}

	private byte[] readRawLine() throws IOException
	{
		ByteArrayOutputStream line = new ByteArrayOutputStream();
		int b;
		while ((b = in.read()) != -1)
		{
			line.write(b);
			if (b == '\n')
			{
				break;
			}
		}
		return line.toByteArray();
	}

	private static boolean startsWithBom(byte[] raw)
	{
		if (raw.length < BOM.length)
		{
			return false;
		}
		for (int i = 0; i < BOM.length; i++)
		{
			if (raw[i] != BOM[i])
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * A line is bare when, ignoring its terminator, it is blank or comment-only.
	 */
	private static boolean isBare(String line)
	{
		return BLANK_OR_COMMENT.matcher(stripTerminator(line)).matches();
	}

	private static String stripTerminator(String line)
	{
		int end = line.length();
		if (end > 0 && line.charAt(end - 1) == '\n')
		{
			end--;
			if (end > 0 && line.charAt(end - 1) == '\r')
			{
				end--;
			}
		}
		return line.substring(0, end);
	}
}
