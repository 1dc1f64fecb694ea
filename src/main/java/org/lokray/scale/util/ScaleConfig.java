package org.lokray.scale.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Holds configuration settings for the Scale toolkit, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class ScaleConfig
{
	private static final Logger logger = LoggerFactory.getLogger(ScaleConfig.class);

	public static final String RESOURCE = "scale.properties";

	private final int tabSize;
	private final Charset defaultCharset;
	private final int detokenizerIndent;

	public ScaleConfig(Properties props)
	{
		this.tabSize = parsePositive(props.getProperty("lexer.tab_size"), Tabs.DEFAULT_TAB_SIZE, "lexer.tab_size");
		// Undeclared bytes pass through one char per byte unless told otherwise.
		this.defaultCharset = parseCharset(props.getProperty("reader.default_charset", "ISO-8859-1"));
		this.detokenizerIndent = parseNonNegative(props.getProperty("detokenizer.indent"), 0, "detokenizer.indent");
	}

	/**
	 * The configuration with every setting at its default.
	 */
	public static ScaleConfig defaults()
	{
		return new ScaleConfig(new Properties());
	}

	/**
	 * Loads the bundled {@value #RESOURCE} from the classpath, then applies
	 * any overrides found in {@code ~/.config/scale/scale.conf}.
	 */
	public static ScaleConfig load()
	{
		Properties props = new Properties();
		try (InputStream input = ScaleConfig.class.getClassLoader().getResourceAsStream(RESOURCE))
		{
			if (input != null)
			{
				props.load(input);
			}
		}
		catch (IOException e)
		{
			logger.warn("Could not read classpath resource {}: {}", RESOURCE, e.getMessage());
		}

		Path userConfig = Paths.get(System.getProperty("user.home"), ".config", "scale", "scale.conf");
		if (Files.exists(userConfig))
		{
			try (InputStream input = Files.newInputStream(userConfig))
			{
				props.load(input);
				logger.info("Loaded configuration from {}", userConfig);
			}
			catch (IOException e)
			{
				logger.warn("Could not read config file at {}. Using default settings.", userConfig);
			}
		}
		return new ScaleConfig(props);
	}

	public int getTabSize()
	{
		return tabSize;
	}

	public Charset getDefaultCharset()
	{
		return defaultCharset;
	}

	public int getDetokenizerIndent()
	{
		return detokenizerIndent;
	}

	private static int parsePositive(String value, int fallback, String key)
	{
		int n = parseNonNegative(value, fallback, key);
		if (n == 0)
		{
			throw new IllegalArgumentException(key + " must be positive");
		}
		return n;
	}

	private static int parseNonNegative(String value, int fallback, String key)
	{
		if (value == null || value.isBlank())
		{
			return fallback;
		}
		int n;
		try
		{
			n = Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + " is not a number: " + value, e);
		}
		if (n < 0)
		{
			throw new IllegalArgumentException(key + " must not be negative: " + n);
		}
		return n;
	}

	private static Charset parseCharset(String name)
	{
		try
		{
			return Charset.forName(name.trim());
		}
		catch (IllegalCharsetNameException | UnsupportedCharsetException e)
		{
			logger.warn("Unknown reader.default_charset '{}', falling back to ISO-8859-1", name);
			return StandardCharsets.ISO_8859_1;
		}
	}
}
