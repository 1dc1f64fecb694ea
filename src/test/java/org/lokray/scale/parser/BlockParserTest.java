package org.lokray.scale.parser;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.ast.Statement;
import org.lokray.scale.ast.Subexpression;
import org.lokray.scale.io.StringLineSource;
import org.lokray.scale.lexer.Lexer;
import org.lokray.scale.lexer.Position;
import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenError;
import org.lokray.scale.lexer.TokenType;
import org.lokray.scale.util.Tokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BlockParser")
class BlockParserTest
{
	private static List<Token> scan(String source)
	{
		return new Lexer(new StringLineSource(source)).scanTokens();
	}

	private static Block parse(String source)
	{
		return BlockParser.parse(scan(source));
	}

	private static TokenError parseError(String source)
	{
		return assertThrows(TokenError.class, () -> parse(source));
	}

	@Nested
	@DisplayName("Tree shape")
	class TreeShape
	{
		@Test
		@DisplayName("flat statements")
		void flat()
		{
			Block block = parse("a = 1\nb = 2\n");
			assertEquals(2, block.size());
			assertTrue(block.get(0).isLeaf());
			assertEquals("a = 1", block.get(0).statement().toString());
			assertEquals("b = 2", block.get(1).statement().toString());
		}

		@Test
		@DisplayName("nested blocks")
		void nested()
		{
			Block block = parse("if a:\n    b\n    if c:\n        d\ne\n");
			assertEquals(2, block.size());

			Block body = block.get(0).body();
			assertEquals(2, body.size());
			assertEquals("b", body.get(0).statement().toString());
			assertEquals("d", body.get(1).body().get(0).statement().toString());
			assertEquals("e", block.get(1).statement().toString());
			assertTrue(block.get(1).isLeaf());
		}

		@Test
		@DisplayName("statements keep their NEWLINE but no INDENT or DEDENT")
		void layoutTokens()
		{
			Block block = parse("if a:\n    b\nc\n");
			for (Token token : Tokens.flatten(block))
			{
				assertNotEquals(TokenType.INDENT, token.getType());
				assertNotEquals(TokenType.DEDENT, token.getType());
				assertNotEquals(TokenType.ENDMARKER, token.getType());
			}
			List<Fragment> fragments = block.get(1).statement().getFragments();
			assertEquals(TokenType.NEWLINE, ((Token) fragments.get(fragments.size() - 1)).getType());
		}

		@Test
		@DisplayName("comment lines join the statement that follows")
		void commentsJoinNextStatement()
		{
			Block block = parse("# heading\nx\n");
			assertEquals(1, block.size());
			List<Token> tokens = block.get(0).statement().tokens();
			assertEquals(TokenType.COMMENT, tokens.get(0).getType());
			assertEquals(TokenType.NL, tokens.get(1).getType());
			assertEquals("x", tokens.get(2).getText());
		}

		@Test
		@DisplayName("trailing comments become a statement of their own")
		void trailingComments()
		{
			Block block = parse("x\n# done\n");
			assertEquals(2, block.size());
			assertTrue(Tokens.stripWhitespace(block.get(1).statement().getFragments()).isEmpty());
		}

		@Test
		@DisplayName("empty input")
		void empty()
		{
			assertTrue(parse("").isEmpty());
		}

		@Test
		@DisplayName("flattening gives back the non-layout tokens in order")
		void flattenPreservesTokens()
		{
			String source = "def f(a,\n      b):\n    return [a, {b: (1)}]\n# end\n";
			List<Token> tokens = scan(source);
			Block block = BlockParser.parse(tokens);

			assertEquals(Tokens.stripWhitespace(tokens), Tokens.stripWhitespace(Tokens.flatten(block)));
		}
	}

	@Nested
	@DisplayName("Subexpressions")
	class Subexpressions
	{
		@Test
		@DisplayName("brackets group into one fragment")
		void grouping()
		{
			Statement statement = parse("f(a, b)\n").get(0).statement();
			List<Fragment> fragments = statement.getFragments();

			assertEquals(3, fragments.size());
			Subexpression call = assertInstanceOf(Subexpression.class, fragments.get(1));
			assertEquals("(", call.getOpen().getText());
			assertEquals(3, call.getInterior().size());
			Token close = (Token) call.getFragments().get(call.getFragments().size() - 1);
			assertEquals(")", close.getText());
		}

		@Test
		@DisplayName("nested brackets nest")
		void nesting()
		{
			Statement statement = parse("x = [1, (2, {3})]\n").get(0).statement();
			Subexpression list = (Subexpression) statement.getFragments().get(2);
			Subexpression tuple = (Subexpression) list.getInterior().get(2);
			Subexpression set = (Subexpression) tuple.getInterior().get(2);
			assertEquals("{", set.getOpen().getText());
			assertEquals(1, set.getInterior().size());
		}

		@Test
		@DisplayName("brackets span lines without ending the statement")
		void multiLine()
		{
			Block block = parse("x = (1,\n     2)\ny\n");
			assertEquals(2, block.size());
			Subexpression tuple = (Subexpression) block.get(0).statement().getFragments().get(2);
			assertTrue(tuple.getInterior().stream()
					.anyMatch(f -> f instanceof Token t && t.getType() == TokenType.NL));
		}

		@Test
		@DisplayName("indentation inside brackets is ignored")
		void indentInsideBrackets()
		{
			Block block = parse("x = [\n        1,\n  2]\n");
			assertEquals(1, block.size());
			assertTrue(block.get(0).isLeaf());
		}

		@Test
		@DisplayName("deep nesting does not overflow the stack")
		void deepNesting()
		{
			int depth = 20_000;
			String source = "(".repeat(depth) + "1" + ")".repeat(depth) + "\n";
			Block block = parse(source);
			assertEquals(2 * depth + 2, Tokens.flatten(block).size());
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors
	{
		@Test
		@DisplayName("unclosed bracket at end of input")
		void unclosed()
		{
			TokenError error = parseError("(1+1");
			assertEquals("unclosed parentheses ('(')", error.getRawMessage());
			assertEquals(new Position(2, 0), error.getPosition());
		}

		@Test
		@DisplayName("several unclosed brackets are listed innermost first")
		void severalUnclosed()
		{
			TokenError error = parseError("f([1,\n");
			assertEquals("unclosed parentheses ('[', '(')", error.getRawMessage());
		}

		@Test
		@DisplayName("mismatched closing bracket")
		void unmatched()
		{
			TokenError error = parseError("(1+2]");
			assertEquals("unmatched ]", error.getRawMessage());
			assertEquals(new Position(1, 4), error.getPosition());
		}

		@Test
		@DisplayName("closing bracket with nothing open")
		void strayClose()
		{
			TokenError error = parseError("x)\n");
			assertEquals("unmatched )", error.getRawMessage());
			assertEquals(new Position(1, 1), error.getPosition());
		}

		@Test
		@DisplayName("indent before any statement")
		void unexpectedIndent()
		{
			TokenError error = parseError("   1+2");
			assertEquals("unexpected indent", error.getRawMessage());
			assertEquals(new Position(1, 0), error.getPosition());
		}

		@Test
		@DisplayName("dedent to a level that was never opened")
		void badDedent()
		{
			TokenError error = parseError("if foo:\n    bar\n  baz\n");
			assertEquals("unindent does not match any outer indentation level", error.getRawMessage());
			assertEquals(new Position(3, 2), error.getPosition());
		}

		@Test
		@DisplayName("dedent while a bracket is open")
		void dedentInsideBrackets()
		{
			Position end = new Position(2, 0);
			List<Token> tokens = List.of(
					new Token(TokenType.NAME, "f", new Position(1, 0), new Position(1, 1), "f(\n"),
					new Token(TokenType.OP, "(", new Position(1, 1), new Position(1, 2), "f(\n"),
					new Token(TokenType.DEDENT, "", end, end, ""),
					new Token(TokenType.ENDMARKER, "", end, end, ""));
			TokenError error = assertThrows(TokenError.class, () -> BlockParser.parse(tokens));
			assertEquals("unclosed parentheses ('(')", error.getRawMessage());
			assertEquals(end, error.getPosition());
		}

		@Test
		@DisplayName("token stream without ENDMARKER")
		void missingEndmarker()
		{
			List<Token> tokens = scan("x\n");
			List<Token> truncated = tokens.subList(0, tokens.size() - 1);
			assertThrows(IllegalStateException.class, () -> BlockParser.parse(truncated));
		}

		@Test
		@DisplayName("a parser instance is single use")
		void singleUse()
		{
			BlockParser parser = new BlockParser();
			parser.parseTokens(scan("x\n"));
			assertThrows(IllegalStateException.class, () -> parser.parseTokens(scan("y\n")));
		}
	}
}
