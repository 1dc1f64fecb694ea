package org.lokray.scale.lexer;

import org.lokray.scale.io.LineSource;
import org.lokray.scale.util.Tabs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * The Lexer performs lexical analysis of Python-like source text.
 * It pulls physical lines from a {@link LineSource} one at a time and turns
 * them into tokens lazily, as the caller iterates. Besides names, numbers,
 * strings and operators it produces the layout tokens the block parser relies
 * on: NEWLINE at the end of each logical line, NL for line ends that do not
 * end a statement, INDENT and DEDENT when the indentation changes, and a
 * final ENDMARKER.
 * <p>
 * Whether a dedent lands on an outer indentation level is deliberately not
 * checked here; {@link org.lokray.scale.parser.BlockParser} reports that, as
 * well as brackets still open at the end of the input.
 * </p>
 */
public class Lexer implements Iterator<Token>
{
	private static final Set<String> THREE_CHAR_OPS = Set.of("**=", ">>=", "<<=", "//=");
	private static final Set<String> TWO_CHAR_OPS = Set.of(
			"**", ">>", "<<", "<>", "!=", "//",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "==", "<=", ">=");
	private static final String ONE_CHAR_OPS = "+-*/%&|^=<>~()[]{}:;.,`@";

	private final LineSource source;
	private final int tabSize;
	private final Deque<Token> pending = new ArrayDeque<>(); // Tokens scanned but not yet handed out

	private String line = "";      // The physical line being scanned
	private int lineNumber = 0;
	private int current = 0;       // Current position in the line
	private int start = 0;         // Current token's starting position in the line

	private int parenDepth = 0;
	private boolean continued = false; // Previous line ended in a backslash
	private boolean finished = false;  // ENDMARKER has been queued

	// Indentation widths with tabs at tabSize, and with tabs counted as one column.
	// The two must order lines the same way or tabs and spaces were mixed inconsistently.
	private final List<Integer> indents = new ArrayList<>(List.of(0));
	private final List<Integer> altIndents = new ArrayList<>(List.of(0));

	// --- State of a string literal spanning several lines ---
	private StringBuilder contString;
	private StringBuilder contLine;
	private Position stringStart;
	private String closingQuote;
	private boolean needsBackslash; // Single-quoted: every continued line must end in '\'

	/**
	 * Constructs a Lexer with the default tab size.
	 *
	 * @param source The lines to tokenize.
	 */
	public Lexer(LineSource source)
	{
		this(source, Tabs.DEFAULT_TAB_SIZE);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source  The lines to tokenize.
	 * @param tabSize Tab stop interval used to measure indentation.
	 */
	public Lexer(LineSource source, int tabSize)
	{
		if (tabSize <= 0)
		{
			throw new IllegalArgumentException("tabSize: " + tabSize);
		}
		this.source = source;
		this.tabSize = tabSize;
	}

	@Override
	public boolean hasNext()
	{
		while (pending.isEmpty() && !finished)
		{
			scanLine();
		}
		return !pending.isEmpty();
	}

	@Override
	public Token next()
	{
		if (!hasNext())
		{
			throw new NoSuchElementException("past ENDMARKER");
		}
		return pending.poll();
	}

	/**
	 * Scans the remaining source and returns the tokens, ENDMARKER included.
	 */
	public List<Token> scanTokens()
	{
		List<Token> tokens = new ArrayList<>();
		while (hasNext())
		{
			tokens.add(next());
		}
		return tokens;
	}

	/**
	 * Reads one physical line and queues its tokens.
	 */
	private void scanLine()
	{
		line = source.readLine();
		lineNumber++;
		current = 0;

		if (contString != null)
		{
			if (!continueString())
			{
				return;
			}
		}
		else if (parenDepth == 0 && !continued)
		{
			if (line.isEmpty())
			{
				finish();
				return;
			}
			if (!scanIndentation())
			{
				return;
			}
		}
		else
		{
			if (line.isEmpty())
			{
				if (parenDepth == 0)
				{
					throw new TokenError("EOF in multi-line statement", new Position(lineNumber, 0));
				}
				// Open brackets at EOF are reported by the block parser.
				finish();
				return;
			}
			continued = false;
		}

		while (!isAtEnd())
		{
			scanToken();
		}
	}

	/**
	 * Handles a line inside a multi-line string literal.
	 *
	 * @return True if the string closed on this line and scanning should go on.
	 */
	private boolean continueString()
	{
		int end = findClosingQuote(0);
		if (end >= 0)
		{
			contString.append(line, 0, end);
			contLine.append(line);
			current = end;
			pending.add(new Token(TokenType.STRING, contString.toString(), stringStart,
					new Position(lineNumber, end), contLine.toString()));
			contString = null;
			contLine = null;
			return true;
		}
		if (line.isEmpty())
		{
			throw new TokenError("EOF in multi-line string", stringStart);
		}
		if (needsBackslash && !endsWithBackslashNewline(line))
		{
			throw new TokenError("EOL while scanning string literal", stringStart);
		}
		contString.append(line);
		contLine.append(line);
		return false;
	}

	/**
	 * Measures the indentation of a new statement line and queues INDENT or
	 * DEDENT tokens. Blank and comment-only lines produce NL (and COMMENT)
	 * tokens and never change the indentation.
	 *
	 * @return True if the rest of the line holds tokens to scan.
	 */
	private boolean scanIndentation()
	{
		int column = 0;
		int altColumn = 0;
		while (!isAtEnd())
		{
			char c = peek();
			if (c == ' ')
			{
				column++;
				altColumn++;
			}
			else if (c == '\t')
			{
				column = (column / tabSize + 1) * tabSize;
				altColumn++;
			}
			else if (c == '\f')
			{
				column = 0;
				altColumn = 0;
			}
			else
			{
				break;
			}
			current++;
		}
		if (isAtEnd())
		{
			// Trailing whitespace without a line end: nothing left in the input.
			finish();
			return false;
		}

		char c = peek();
		if (c == '#' || c == '\r' || c == '\n')
		{
			if (c == '#')
			{
				int commentEnd = lineContentEnd();
				addToken(TokenType.COMMENT, current, commentEnd);
				addToken(TokenType.NL, commentEnd, line.length());
			}
			else
			{
				addToken(TokenType.NL, current, line.length());
			}
			return false;
		}

		int top = indents.get(indents.size() - 1);
		int altTop = altIndents.get(altIndents.size() - 1);
		if (column > top)
		{
			if (altColumn <= altTop)
			{
				throw inconsistentTabs();
			}
			indents.add(column);
			altIndents.add(altColumn);
			addToken(TokenType.INDENT, 0, current);
		}
		else
		{
			while (column < indents.get(indents.size() - 1))
			{
				indents.remove(indents.size() - 1);
				altIndents.remove(altIndents.size() - 1);
				addToken(TokenType.DEDENT, current, current);
			}
			if (column == indents.get(indents.size() - 1)
					&& altColumn != altIndents.get(altIndents.size() - 1))
			{
				throw inconsistentTabs();
			}
		}
		return true;
	}

	private TokenError inconsistentTabs()
	{
		return new TokenError("inconsistent use of tabs and spaces in indentation", new Position(lineNumber, current));
	}

	/**
	 * Scans a single token starting at the current position.
	 */
	private void scanToken()
	{
		while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\f'))
		{
			current++;
		}
		if (isAtEnd())
		{
			return;
		}
		start = current;
		char c = advance();

		switch (c)
		{
			case '\r':
				if (!match('\n'))
				{
					addToken(TokenType.ERRORTOKEN);
					return;
				}
				addToken(parenDepth > 0 ? TokenType.NL : TokenType.NEWLINE);
				return;
			case '\n':
				addToken(parenDepth > 0 ? TokenType.NL : TokenType.NEWLINE);
				return;
			case '#':
				current = lineContentEnd();
				addToken(TokenType.COMMENT);
				return;
			case '\\':
				if (match('\n') || (peek() == '\r' && peekNext() == '\n'))
				{
					// Explicit line continuation: no token, the statement goes on.
					current = line.length();
					continued = true;
				}
				else
				{
					addToken(TokenType.ERRORTOKEN);
				}
				return;
			case '\'':
			case '"':
				scanString();
				return;
			case '.':
				if (Character.isDigit(peek()))
				{
					scanNumber();
				}
				else
				{
					addToken(TokenType.OP);
				}
				return;
			default:
				break;
		}

		if (Character.isDigit(c))
		{
			scanNumber();
		}
		else if (isStringPrefix())
		{
			scanString();
		}
		else if (Character.isLetter(c) || c == '_')
		{
			scanIdentifier();
		}
		else if (!scanOperator())
		{
			addToken(TokenType.ERRORTOKEN);
		}
	}

	/**
	 * Checks whether the name starting at {@code start} is really a string
	 * prefix ({@code u}, {@code b}, {@code r}, {@code ur}, {@code br}, any case).
	 * If so, moves the cursor onto the opening quote.
	 */
	private boolean isStringPrefix()
	{
		int i = start;
		char c = Character.toLowerCase(line.charAt(i));
		if (c == 'u' || c == 'b')
		{
			i++;
			if (i < line.length() && Character.toLowerCase(line.charAt(i)) == 'r')
			{
				i++;
			}
		}
		else if (c == 'r')
		{
			i++;
		}
		else
		{
			return false;
		}
		if (i < line.length() && (line.charAt(i) == '\'' || line.charAt(i) == '"'))
		{
			current = i + 1;
			return true;
		}
		return false;
	}

	/**
	 * Scans a string literal; the cursor is just past its opening quote.
	 * Triple-quoted strings and backslash-continued single-quoted strings may
	 * run on over following lines.
	 */
	private void scanString()
	{
		char quote = line.charAt(current - 1);
		String triple = String.valueOf(quote).repeat(3);
		boolean isTriple = line.startsWith(triple, current - 1);

		closingQuote = isTriple ? triple : String.valueOf(quote);
		if (isTriple)
		{
			current += 2;
		}

		int end = findClosingQuote(current);
		if (end >= 0)
		{
			current = end;
			addToken(TokenType.STRING);
			return;
		}

		if (!isTriple && !endsWithBackslashNewline(line))
		{
			throw new TokenError("EOL while scanning string literal", new Position(lineNumber, start));
		}
		stringStart = new Position(lineNumber, start);
		contString = new StringBuilder(line.substring(start));
		contLine = new StringBuilder(line);
		needsBackslash = !isTriple;
		current = line.length();
	}

	/**
	 * Looks for {@link #closingQuote} from {@code from}, honouring backslash
	 * escapes. A single-quoted string cannot cross a bare line end.
	 *
	 * @return The index just past the closing quote, or -1 if it is not on this line.
	 */
	private int findClosingQuote(int from)
	{
		boolean single = closingQuote.length() == 1;
		int i = from;
		while (i < line.length())
		{
			char c = line.charAt(i);
			if (c == '\\')
			{
				i += 2;
				continue;
			}
			if (single && c == '\n')
			{
				return -1;
			}
			if (line.startsWith(closingQuote, i))
			{
				return i + closingQuote.length();
			}
			i++;
		}
		return -1;
	}

	/**
	 * Scans a number: hex, octal or binary integers, decimal integers, floats
	 * with optional exponent, and the {@code L} / {@code j} suffixes.
	 */
	private void scanNumber()
	{
		char first = line.charAt(start);
		if (first == '0' && (peek() == 'x' || peek() == 'X'))
		{
			advance();
			while (isHexDigit(peek()))
			{
				advance();
			}
			matchAny("lL");
			addToken(TokenType.NUMBER);
			return;
		}
		if (first == '0' && (peek() == 'b' || peek() == 'B' || peek() == 'o' || peek() == 'O')
				&& Character.isDigit(peekNext()))
		{
			advance();
			while (Character.isDigit(peek()))
			{
				advance();
			}
			matchAny("lL");
			addToken(TokenType.NUMBER);
			return;
		}

		boolean isFloat = first == '.';
		while (Character.isDigit(peek()))
		{
			advance();
		}
		if (!isFloat && peek() == '.')
		{
			isFloat = true;
			advance();
			while (Character.isDigit(peek()))
			{
				advance();
			}
		}
		if ((peek() == 'e' || peek() == 'E')
				&& (Character.isDigit(peekNext())
				|| ((peekNext() == '+' || peekNext() == '-') && Character.isDigit(peek(2)))))
		{
			isFloat = true;
			advance();
			matchAny("+-");
			while (Character.isDigit(peek()))
			{
				advance();
			}
		}
		if (!matchAny("jJ") && !isFloat)
		{
			matchAny("lL");
		}
		addToken(TokenType.NUMBER);
	}

	/**
	 * Scans a name. Keywords are plain NAME tokens: giving them meaning is up
	 * to the language built on top.
	 */
	private void scanIdentifier()
	{
		while (Character.isLetterOrDigit(peek()) || peek() == '_')
		{
			advance();
		}
		addToken(TokenType.NAME);
	}

	/**
	 * Scans the longest operator at {@code start}.
	 *
	 * @return False if no operator starts there.
	 */
	private boolean scanOperator()
	{
		if (line.length() >= start + 3 && THREE_CHAR_OPS.contains(line.substring(start, start + 3)))
		{
			current = start + 3;
		}
		else if (line.length() >= start + 2 && TWO_CHAR_OPS.contains(line.substring(start, start + 2)))
		{
			current = start + 2;
		}
		else if (ONE_CHAR_OPS.indexOf(line.charAt(start)) >= 0)
		{
			current = start + 1;
		}
		else
		{
			return false;
		}

		char c = line.charAt(start);
		if (c == '(' || c == '[' || c == '{')
		{
			parenDepth++;
		}
		else if ((c == ')' || c == ']' || c == '}') && parenDepth > 0)
		{
			parenDepth--;
		}
		addToken(TokenType.OP);
		return true;
	}

	/**
	 * Queues the closing DEDENTs and the ENDMARKER.
	 */
	private void finish()
	{
		Position end = new Position(lineNumber, 0);
		for (int i = 1; i < indents.size(); i++)
		{
			pending.add(new Token(TokenType.DEDENT, "", end, end, ""));
		}
		indents.subList(1, indents.size()).clear();
		altIndents.subList(1, altIndents.size()).clear();
		pending.add(new Token(TokenType.ENDMARKER, "", end, end, ""));
		finished = true;
	}

	// --- Cursor helpers ---

	private void addToken(TokenType type)
	{
		addToken(type, start, current);
	}

	private void addToken(TokenType type, int from, int to)
	{
		pending.add(new Token(type, line.substring(from, to),
				new Position(lineNumber, from), new Position(lineNumber, to), line));
	}

	/**
	 * Consumes the current character and returns it.
	 */
	private char advance()
	{
		return line.charAt(current++);
	}

	/**
	 * Consumes the current character if it matches.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || line.charAt(current) != expected)
		{
			return false;
		}
		current++;
		return true;
	}

	private boolean matchAny(String chars)
	{
		if (!isAtEnd() && chars.indexOf(line.charAt(current)) >= 0)
		{
			current++;
			return true;
		}
		return false;
	}

	/**
	 * Looks at the current character without consuming it.
	 *
	 * @return The current character, or '\0' at the end of the line.
	 */
	private char peek()
	{
		return peek(0);
	}

	private char peekNext()
	{
		return peek(1);
	}

	private char peek(int offset)
	{
		if (current + offset >= line.length())
		{
			return '\0';
		}
		return line.charAt(current + offset);
	}

	private boolean isAtEnd()
	{
		return current >= line.length();
	}

	/**
	 * Index where the line's content ends, i.e. before any trailing "\r\n" or "\n".
	 */
	private int lineContentEnd()
	{
		int end = line.length();
		while (end > current && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r'))
		{
			end--;
		}
		return end;
	}

	private static boolean isHexDigit(char c)
	{
		return Character.digit(c, 16) >= 0 && c < 128;
	}

	private static boolean endsWithBackslashNewline(String text)
	{
		return text.endsWith("\\\n") || text.endsWith("\\\r\n");
	}
}
