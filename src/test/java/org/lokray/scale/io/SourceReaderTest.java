package org.lokray.scale.io;

import org.lokray.scale.lexer.Position;
import org.lokray.scale.lexer.TokenError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceReader")
class SourceReaderTest
{
	private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

	private static byte[] bytes(String text, Charset charset)
	{
		return text.getBytes(charset);
	}

	private static byte[] withBom(String text)
	{
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.writeBytes(BOM);
		out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
		return out.toByteArray();
	}

	private static SourceReader reader(byte[] source)
	{
		return new SourceReader(new ByteArrayInputStream(source), StandardCharsets.ISO_8859_1);
	}

	private static List<String> readAll(SourceReader reader)
	{
		List<String> lines = new ArrayList<>();
		String line;
		while (!(line = reader.readLine()).isEmpty())
		{
			lines.add(line);
		}
		return lines;
	}

	@Nested
	@DisplayName("Byte-order marker")
	class ByteOrderMarker
	{
		@Test
		@DisplayName("is stripped and implies UTF-8")
		void stripped()
		{
			SourceReader reader = reader(withBom("x = 1\ns = 'é'\n"));
			assertEquals(List.of("x = 1\n", "s = 'é'\n"), readAll(reader));
			assertEquals(StandardCharsets.UTF_8, reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("agrees with a utf-8 declaration")
		void agreeingDeclaration()
		{
			SourceReader reader = reader(withBom("# coding: utf-8\ns = 'é'\n"));
			assertEquals(List.of("# coding: utf-8\n", "s = 'é'\n"), readAll(reader));
		}

		@Test
		@DisplayName("conflicts with any other declaration")
		void conflictingDeclaration()
		{
			SourceReader reader = reader(withBom("# coding: latin-1\n"));
			TokenError error = assertThrows(TokenError.class, reader::readLine);
			assertEquals("UTF-8 BOM, but 'latin-1' encoding requested", error.getRawMessage());
			assertEquals(new Position(1, 10), error.getPosition());
		}
	}

	@Nested
	@DisplayName("Encoding declaration")
	class EncodingDeclaration
	{
		@Test
		@DisplayName("on the first line")
		void firstLine()
		{
			SourceReader reader = reader(bytes("# -*- coding: utf-8 -*-\ns = 'é'\n", StandardCharsets.UTF_8));
			assertEquals(List.of("# -*- coding: utf-8 -*-\n", "s = 'é'\n"), readAll(reader));
			assertEquals(StandardCharsets.UTF_8, reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("on the second line, after a comment")
		void secondLine()
		{
			SourceReader reader = reader(bytes("#!/usr/bin/env scale\n# vim: set fileencoding=utf-8 :\ns = 'é'\n",
					StandardCharsets.UTF_8));
			List<String> lines = readAll(reader);
			assertEquals("s = 'é'\n", lines.get(2));
		}

		@Test
		@DisplayName("on the second line, after a non-ASCII comment")
		void secondLineAfterNonAsciiComment()
		{
			// UTF-8 'х' and 'Å' end in byte 0x85, a line break in ISO-8859-1
			SourceReader reader = reader(bytes("# х Å\n# -*- coding: utf-8 -*-\nx = 'é'\n", StandardCharsets.UTF_8));
			List<String> lines = readAll(reader);
			assertEquals("x = 'é'\n", lines.get(2));
			assertEquals(StandardCharsets.UTF_8, reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("python spellings of latin-1")
		void latin1()
		{
			SourceReader reader = reader(bytes("# coding: latin_1\ns = 'é'\n", StandardCharsets.ISO_8859_1));
			assertEquals("s = 'é'\n", readAll(reader).get(1));
			assertEquals(StandardCharsets.ISO_8859_1, reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("on the third line is not honoured")
		void thirdLine()
		{
			SourceReader reader = reader(bytes("\n\n# coding: utf-8\ns = 'é'\n", StandardCharsets.UTF_8));
			List<String> lines = readAll(reader);
			assertEquals("s = 'Ã©'\n", lines.get(3));
			assertNull(reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("after a line of code is not honoured")
		void afterCode()
		{
			SourceReader reader = reader(bytes("x = 1\n# coding: utf-8\ns = 'é'\n", StandardCharsets.UTF_8));
			assertEquals("s = 'Ã©'\n", readAll(reader).get(2));
			assertNull(reader.getDeclaredCharset());
		}

		@Test
		@DisplayName("naming an unknown encoding")
		void unknown()
		{
			SourceReader reader = reader(bytes("# coding: klingon\n", StandardCharsets.US_ASCII));
			TokenError error = assertThrows(TokenError.class, reader::readLine);
			assertEquals("unknown encoding: klingon", error.getRawMessage());
			assertEquals(new Position(1, 10), error.getPosition());
		}
	}

	@Test
	@DisplayName("undeclared bytes use the default charset")
	void defaultCharset()
	{
		SourceReader reader = reader(new byte[]{'a', (byte) 0xE9, '\n'});
		assertEquals(List.of("aé\n"), readAll(reader));
	}

	@Test
	@DisplayName("empty input")
	void emptyInput()
	{
		assertEquals("", reader(new byte[0]).readLine());
	}

	@Test
	@DisplayName("line terminators are kept")
	void terminators()
	{
		SourceReader reader = reader(bytes("a\r\nb", StandardCharsets.US_ASCII));
		assertEquals(List.of("a\r\n", "b"), readAll(reader));
	}
}
