package org.lokray.scale.parser;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.ast.Statement;
import org.lokray.scale.ast.Subexpression;
import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenError;
import org.lokray.scale.lexer.TokenType;
import org.lokray.scale.util.Debug;
import org.lokray.scale.util.Tabs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a flat token stream into a tree of statements and indented blocks.
 * <p>
 * The parser makes a single pass and keeps all of its nesting in explicit
 * stacks rather than on the call stack, so arbitrarily deep indentation or
 * bracket nesting cannot overflow it. Each logical line becomes one
 * {@link Statement}; a bracket pair becomes a {@link Subexpression} inside the
 * statement; an INDENT opens the body of the last statement and the matching
 * DEDENT closes it again.
 * </p>
 * An instance parses one token stream; create a new parser per input.
 */
public class BlockParser
{
	private static final Logger logger = LoggerFactory.getLogger(BlockParser.class);

	private static final Map<String, String> CLOSE_TO_OPEN = Map.of(")", "(", "]", "[", "}", "{");

	private final int tabSize;
	private final Debug debug = new Debug(logger);

	// --- Parse state ---
	private final Block output = new Block();
	private final Deque<Block> scopes = new ArrayDeque<>();            // Enclosing blocks of the current one
	private final Deque<Token> parens = new ArrayDeque<>();            // Open brackets, innermost on top
	private final Deque<List<Fragment>> outerBuffers = new ArrayDeque<>(); // Buffers suspended by an open bracket
	private final List<Integer> indents = new ArrayList<>(List.of(0));

	private Block scope = output;
	private List<Fragment> statement = new ArrayList<>(); // The statement being filled
	private List<Fragment> buffer = statement;            // Where the next token goes; nested while brackets are open
	private boolean started = false;

	public BlockParser()
	{
		this(Tabs.DEFAULT_TAB_SIZE);
	}

	/**
	 * Constructs a BlockParser.
	 *
	 * @param tabSize Tab stop interval used to measure dedent widths; must match the Lexer's.
	 */
	public BlockParser(int tabSize)
	{
		this.tabSize = tabSize;
	}

	/**
	 * Parses a token stream with a fresh parser.
	 *
	 * @param tokens Tokens ending with an ENDMARKER.
	 * @return The top-level block.
	 * @throws TokenError on a structural error in the source.
	 */
	public static Block parse(Iterable<Token> tokens)
	{
		return new BlockParser().parseTokens(tokens);
	}

	/**
	 * Consumes the tokens up to and including the ENDMARKER.
	 *
	 * @param tokens Tokens as produced by the Lexer.
	 * @return The completed top-level block, now owned by the caller.
	 * @throws TokenError            on a structural error in the source.
	 * @throws IllegalStateException if the stream itself is inconsistent
	 *                               (unbalanced INDENT/DEDENT, no ENDMARKER), or
	 *                               if this parser was already used.
	 */
	public Block parseTokens(Iterable<Token> tokens)
	{
		if (started)
		{
			throw new IllegalStateException("BlockParser instances parse a single stream");
		}
		started = true;

		for (Token token : tokens)
		{
			if (accept(token))
			{
				logger.debug("Parsed block of {} top-level statements", output.size());
				return output;
			}
		}
		throw new IllegalStateException("token stream ended without an ENDMARKER");
	}

	/**
	 * Advances the parse by one token.
	 *
	 * @return True once the ENDMARKER has completed the tree.
	 */
	private boolean accept(Token token)
	{
		switch (token.getType())
		{
			case INDENT:
				indent(token);
				return false;
			case DEDENT:
				dedent(token);
				return false;
			case ENDMARKER:
				endOfInput(token);
				return true;
			case NEWLINE:
				buffer.add(token);
				if (parens.isEmpty())
				{
					closeStatement();
				}
				return false;
			case OP:
				if (isOpen(token))
				{
					openBracket(token);
				}
				else if (CLOSE_TO_OPEN.containsKey(token.getText()))
				{
					closeBracket(token);
				}
				else
				{
					buffer.add(token);
				}
				return false;
			default:
				buffer.add(token);
				return false;
		}
	}

	private void indent(Token token)
	{
		if (scope.isEmpty())
		{
			// No statement that this indent is under
			throw new TokenError("unexpected indent", token.getStart());
		}
		int width = Tabs.width(token.getText(), tabSize);
		debug.log("indent to %d under: %s", width, scope.last().statement());
		debug.indent();

		scopes.push(scope);
		indents.add(width);
		scope = scope.last().body();
	}

	private void dedent(Token token)
	{
		int width = Tabs.width(token.getLine(), token.getStart().column(), tabSize);
		if (!indents.contains(width))
		{
			throw new TokenError("unindent does not match any outer indentation level", token.getStart());
		}
		checkNoOpenBrackets(token);
		indents.remove(indents.size() - 1);

		if (!statement.isEmpty())
		{
			closeStatement();
		}
		if (scopes.isEmpty())
		{
			throw new IllegalStateException("extra DEDENT token at " + token.getStart());
		}
		scope = scopes.pop();
		debug.dedent();
		debug.log("dedent to %d", width);
	}

	private void endOfInput(Token token)
	{
		checkNoOpenBrackets(token);
		if (!statement.isEmpty())
		{
			closeStatement();
		}
		if (!scopes.isEmpty())
		{
			throw new IllegalStateException("missing DEDENT tokens at end of input " + token.getStart());
		}
	}

	private void openBracket(Token token)
	{
		parens.push(token);
		outerBuffers.push(buffer);

		List<Fragment> nested = new ArrayList<>();
		nested.add(token);
		buffer.add(new Subexpression(nested));
		buffer = nested;
	}

	private void closeBracket(Token token)
	{
		String expected = CLOSE_TO_OPEN.get(token.getText());
		if (parens.isEmpty() || !parens.peek().getText().equals(expected))
		{
			throw new TokenError("unmatched " + token.getText(), token.getStart());
		}
		buffer.add(token);
		parens.pop();
		buffer = outerBuffers.pop();
	}

	private void closeStatement()
	{
		Statement closed = new Statement(statement);
		scope.add(closed);
		debug.log("%s", closed);
		statement = new ArrayList<>();
		buffer = statement;
	}

	private void checkNoOpenBrackets(Token token)
	{
		if (!parens.isEmpty())
		{
			String open = parens.stream()
					.map(t -> "'" + t.getText() + "'")
					.collect(Collectors.joining(", ", "(", ")"));
			throw new TokenError("unclosed parentheses " + open, token.getStart());
		}
	}

	private static boolean isOpen(Token token)
	{
		return token.isOp("(") || token.isOp("[") || token.isOp("{");
	}
}
