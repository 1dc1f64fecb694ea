package org.lokray.scale;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.ast.Statement;
import org.lokray.scale.codegen.Detokenizer;
import org.lokray.scale.io.SourceReader;
import org.lokray.scale.io.StringLineSource;
import org.lokray.scale.lexer.Lexer;
import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenStream;
import org.lokray.scale.parser.BlockParser;
import org.lokray.scale.util.Partition;
import org.lokray.scale.util.ScaleConfig;
import org.lokray.scale.util.Separator;
import org.lokray.scale.util.Tokens;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for parsing Python-like DSL source.
 * <p>
 * The usual flow is {@code tokenize -> parseBlock}, then walking the
 * {@link Block} tree, and finally {@code detokenize} to write any part of it
 * back out:
 * </p>
 * <pre>
 * Block block = ScaleDsl.parseBlock(ScaleDsl.tokenize(source));
 * for (Block.Entry entry : block.getEntries())
 * {
 *     String body = ScaleDsl.detokenize(ScaleDsl.flatten(entry.body()), 4);
 * }
 * </pre>
 * Methods without a {@link ScaleConfig} argument use {@link ScaleConfig#load()}.
 */
public final class ScaleDsl
{
	private static final ScaleConfig CONFIG = ScaleConfig.load();

	private ScaleDsl()
	{
	}

	// --- Tokenizing ---

	/**
	 * Tokenizes already decoded text. No encoding detection takes place.
	 */
	public static TokenStream tokenize(String text)
	{
		return tokenize(text, CONFIG);
	}

	public static TokenStream tokenize(String text, ScaleConfig config)
	{
		return new TokenStream(new Lexer(new StringLineSource(text), config.getTabSize()));
	}

	/**
	 * Tokenizes raw bytes, honouring a UTF-8 BOM and an encoding declaration
	 * on the first two lines.
	 */
	public static TokenStream tokenize(byte[] source)
	{
		return tokenize(new ByteArrayInputStream(source), CONFIG);
	}

	public static TokenStream tokenize(InputStream in)
	{
		return tokenize(in, CONFIG);
	}

	/**
	 * Tokenizes a byte stream lazily. The stream is read as tokens are pulled
	 * and is not closed.
	 */
	public static TokenStream tokenize(InputStream in, ScaleConfig config)
	{
		SourceReader reader = new SourceReader(in, config.getDefaultCharset());
		return new TokenStream(new Lexer(reader, config.getTabSize()));
	}

	/**
	 * Tokenizes a source file, honouring a UTF-8 BOM and an encoding declaration.
	 */
	public static TokenStream tokenizeFile(Path file) throws IOException
	{
		return tokenizeFile(file, CONFIG);
	}

	public static TokenStream tokenizeFile(Path file, ScaleConfig config) throws IOException
	{
		return new SourceLoader(config).tokenize(file);
	}

	// --- Block trees ---

	public static Block parseBlock(Iterable<Token> tokens)
	{
		return parseBlock(tokens, CONFIG);
	}

	public static Block parseBlock(Iterable<Token> tokens, ScaleConfig config)
	{
		return new BlockParser(config.getTabSize()).parseTokens(tokens);
	}

	/**
	 * Shorthand for {@code parseBlock(tokenize(text))}.
	 */
	public static Block parse(String text)
	{
		return parseBlock(tokenize(text));
	}

	public static List<Token> flatten(Block block)
	{
		return Tokens.flatten(block);
	}

	public static List<Token> flattenStatement(Statement statement)
	{
		return Tokens.flattenStatement(statement);
	}

	public static <T extends Fragment> List<T> stripWhitespace(Iterable<T> items)
	{
		return Tokens.stripWhitespace(items);
	}

	public static <T extends Fragment> Partition<T> partition(Iterable<T> items, Separator separator)
	{
		return Tokens.partition(items, separator);
	}

	public static <T extends Fragment> Partition<T> rpartition(List<T> items, Separator separator)
	{
		return Tokens.rpartition(items, separator);
	}

	// --- Writing source back out ---

	public static String detokenize(Iterable<? extends Token> tokens)
	{
		return detokenize(tokens, CONFIG.getDetokenizerIndent());
	}

	/**
	 * Reconstructs source text, shifting every line right by {@code indent} spaces.
	 */
	public static String detokenize(Iterable<? extends Token> tokens, int indent)
	{
		return new Detokenizer(indent, CONFIG.getTabSize()).detokenize(tokens);
	}
}
