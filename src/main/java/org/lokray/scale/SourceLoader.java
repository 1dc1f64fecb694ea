package org.lokray.scale;

import org.lokray.scale.ast.Block;
import org.lokray.scale.io.SourceReader;
import org.lokray.scale.lexer.Lexer;
import org.lokray.scale.lexer.TokenStream;
import org.lokray.scale.parser.BlockParser;
import org.lokray.scale.util.ScaleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads DSL source files from disk, either one at a time or by discovering
 * every {@value #EXTENSION} file under a set of source roots.
 */
public class SourceLoader
{
	private static final Logger logger = LoggerFactory.getLogger(SourceLoader.class);

	public static final String EXTENSION = ".scale";

	private final ScaleConfig config;

	public SourceLoader(ScaleConfig config)
	{
		this.config = config;
	}

	/**
	 * Reads a file and returns its tokens. The file is read up front; decoding
	 * and scanning happen lazily as the tokens are pulled.
	 */
	public TokenStream tokenize(Path file) throws IOException
	{
		logger.debug("Tokenizing {}", file);
		byte[] source = Files.readAllBytes(file);
		SourceReader reader = new SourceReader(new ByteArrayInputStream(source), config.getDefaultCharset());
		return new TokenStream(new Lexer(reader, config.getTabSize()));
	}

	/**
	 * Parses a single source file into its block tree.
	 */
	public Block load(Path file) throws IOException
	{
		return new BlockParser(config.getTabSize()).parseTokens(tokenize(file));
	}

	/**
	 * Scans all source roots for {@value #EXTENSION} files and parses each of
	 * them. A file reachable from several roots is parsed once.
	 *
	 * @param sourceRoots Directories to search; missing ones are skipped with a warning.
	 * @return The block tree of every file, keyed by its real path, in discovery order.
	 * @throws org.lokray.scale.lexer.TokenError on the first file with a structural error.
	 */
	public Map<Path, Block> loadAll(List<Path> sourceRoots) throws IOException
	{
		List<Path> files = new ArrayList<>();
		for (Path rootDir : sourceRoots)
		{
			if (!Files.isDirectory(rootDir))
			{
				logger.warn("Source root not found or is not a directory: {}", rootDir);
				continue;
			}
			try (Stream<Path> stream = Files.walk(rootDir))
			{
				files.addAll(stream
						.filter(path -> Files.isRegularFile(path) && path.toString().endsWith(EXTENSION))
						.sorted()
						.collect(Collectors.toList()));
			}
		}

		Map<Path, Block> blocks = new LinkedHashMap<>();
		for (Path file : files)
		{
			Path canonicalPath = file.toRealPath();
			if (blocks.containsKey(canonicalPath))
			{
				continue; // Reached through more than one root
			}
			logger.debug("Parsing {}", file.getFileName());
			blocks.put(canonicalPath, load(canonicalPath));
		}
		logger.info("Loaded {} source file(s)", blocks.size());
		return blocks;
	}
}
