package org.lokray.scale;

import org.lokray.scale.ast.Block;
import org.lokray.scale.lexer.TokenError;
import org.lokray.scale.util.ScaleConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceLoaderTest
{
	private final SourceLoader loader = new SourceLoader(ScaleConfig.defaults());

	private static Path write(Path file, String text) throws IOException
	{
		Files.createDirectories(file.getParent());
		return Files.writeString(file, text, StandardCharsets.UTF_8);
	}

	@Test
	void loadsSingleFile(@TempDir Path dir) throws IOException
	{
		Path file = write(dir.resolve("a.scale"), "x = 1\nif x:\n    y\n");
		Block block = loader.load(file);
		assertEquals(2, block.size());
		assertEquals(1, block.get(1).body().size());
	}

	@Test
	void discoversFilesUnderRoots(@TempDir Path dir) throws IOException
	{
		write(dir.resolve("src/a.scale"), "a = 1\n");
		write(dir.resolve("src/nested/b.scale"), "b = 2\n");
		write(dir.resolve("src/notes.txt"), "not ( source\n");

		Map<Path, Block> blocks = loader.loadAll(List.of(dir.resolve("src"), dir.resolve("missing")));
		assertEquals(2, blocks.size());
		assertTrue(blocks.keySet().stream().allMatch(p -> p.toString().endsWith(SourceLoader.EXTENSION)));
	}

	@Test
	void overlappingRootsParseOnce(@TempDir Path dir) throws IOException
	{
		write(dir.resolve("src/nested/b.scale"), "b = 2\n");
		Map<Path, Block> blocks = loader.loadAll(List.of(dir.resolve("src"), dir.resolve("src/nested")));
		assertEquals(1, blocks.size());
	}

	@Test
	void structuralErrorStopsLoading(@TempDir Path dir) throws IOException
	{
		write(dir.resolve("src/bad.scale"), "x = (1,\n");
		assertThrows(TokenError.class, () -> loader.loadAll(List.of(dir.resolve("src"))));
	}
}
