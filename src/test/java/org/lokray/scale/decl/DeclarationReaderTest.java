package org.lokray.scale.decl;

import org.lokray.scale.ScaleDsl;
import org.lokray.scale.lexer.Position;
import org.lokray.scale.lexer.TokenError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeclarationReader")
class DeclarationReaderTest
{
	private static List<Declaration> read(String source)
	{
		return new DeclarationReader().read(ScaleDsl.parse(source));
	}

	private static TokenError readError(String source)
	{
		return assertThrows(TokenError.class, () -> read(source));
	}

	@Nested
	@DisplayName("Well-formed input")
	class WellFormed
	{
		@Test
		@DisplayName("simple, multi-name, contextual and nested declarations")
		void mixed()
		{
			String source = "# widgets\n"
					+ "name = \"Widget\"\n"
					+ "\n"
					+ "width, height = size(10, 20) from defaults\n"
					+ "layout = grid:\n"
					+ "    row = 1\n"
					+ "    column = row + 1\n";
			List<Declaration> declarations = read(source);
			assertEquals(3, declarations.size());

			Declaration name = declarations.get(0);
			assertEquals(List.of("name"), name.names());
			assertEquals("\"Widget\"", name.expressionSource());
			assertTrue(name.context().isEmpty());
			assertTrue(name.body().isEmpty());

			Declaration size = declarations.get(1);
			assertEquals(List.of("width", "height"), size.names());
			assertEquals("size(10, 20)", size.expressionSource());
			assertEquals(Optional.of("defaults"), size.contextSource());

			Declaration layout = declarations.get(2);
			assertEquals("grid", layout.expressionSource());
			List<Declaration> nested = new DeclarationReader().read(layout.body());
			assertEquals(List.of("row"), nested.get(0).names());
			assertEquals("row + 1", nested.get(1).expressionSource());
		}

		@Test
		@DisplayName("separators inside brackets do not split")
		void bracketsAreAtomic()
		{
			Declaration d = read("f = call(x=1, y=(a from b))\n").get(0);
			assertEquals(List.of("f"), d.names());
			assertEquals("call(x=1, y=(a from b))", d.expressionSource());
			assertTrue(d.context().isEmpty());
		}

		@Test
		@DisplayName("continuation lines keep their offset from the expression start")
		void multiLineExpression()
		{
			Declaration d = read("items = [1,\n          2]\n").get(0);
			assertEquals("[1,\n  2]", d.expressionSource());
		}

		@Test
		@DisplayName("comment-only input has no declarations")
		void commentsOnly()
		{
			assertTrue(read("# nothing\n\n").isEmpty());
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors
	{
		@Test
		@DisplayName("no assignment")
		void missingEquals()
		{
			TokenError error = readError("x + 1\n");
			assertEquals("expected '='", error.getRawMessage());
			assertEquals(new Position(1, 0), error.getPosition());
		}

		@Test
		@DisplayName("target is not a name")
		void badTarget()
		{
			TokenError error = readError("x.y = 1\n");
			assertEquals("expected a name", error.getRawMessage());
			assertEquals(new Position(1, 0), error.getPosition());
		}

		@Test
		@DisplayName("dangling comma in the names")
		void danglingComma()
		{
			TokenError error = readError("a, = 1\n");
			assertEquals("expected a name", error.getRawMessage());
			assertEquals(new Position(1, 3), error.getPosition());
		}

		@Test
		@DisplayName("nothing after '='")
		void missingExpression()
		{
			TokenError error = readError("x =\n");
			assertEquals("expected an expression", error.getRawMessage());
			assertEquals(new Position(1, 2), error.getPosition());
		}

		@Test
		@DisplayName("nothing after 'from'")
		void missingContext()
		{
			TokenError error = readError("x = y from\n");
			assertEquals("expected an expression", error.getRawMessage());
			assertEquals(new Position(1, 6), error.getPosition());
		}

		@Test
		@DisplayName("nested block without a colon")
		void missingColon()
		{
			TokenError error = readError("x = y\n    z = 1\n");
			assertEquals("expected ':' before nested block", error.getRawMessage());
			assertEquals(new Position(1, 4), error.getPosition());
		}
	}
}
