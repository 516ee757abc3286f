package edu.upf.taln.amrreader.common;

import edu.upf.taln.amrreader.core.ReaderOptions;
import edu.upf.taln.amrreader.core.ReaderOptions.GraphSource;
import edu.upf.taln.amrreader.core.ReaderOptions.Notation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reader settings from a properties file on the classpath. Missing keys keep the defaults of {@link ReaderOptions}.
 */
public class ReaderProperties
{
	public static final String DEFAULT_RESOURCE = "config.properties";
	public static final String STRICT = "amr.strict";
	public static final String REMOVE_WIKI = "amr.remove_wiki";
	public static final String NOTATION = "amr.alignments.notation";
	public static final String GRAPH_SOURCE = "amr.graph.source";
	public static final String JAMR_END_EXCLUSIVE = "amr.jamr.end_exclusive";
	public static final String THREADS = "amr.threads";

	private final ReaderOptions options = new ReaderOptions();
	private final static Logger log = LogManager.getLogger();

	public ReaderProperties()
	{
		this(DEFAULT_RESOURCE);
	}

	public ReaderProperties(String resource)
	{
		Properties prop = new Properties();
		try (InputStream input = ReaderProperties.class.getClassLoader().getResourceAsStream(resource))
		{
			if (input == null)
				log.warn("Unable to find " + resource + ", using default settings");
			else
				prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + resource + ": " + e);
		}
		read(prop);
	}

	public ReaderProperties(Properties prop)
	{
		read(prop);
	}

	private void read(Properties prop)
	{
		options.strict = getBoolean(prop, STRICT, options.strict);
		options.remove_wiki = getBoolean(prop, REMOVE_WIKI, options.remove_wiki);
		options.jamr_end_exclusive = getBoolean(prop, JAMR_END_EXCLUSIVE, options.jamr_end_exclusive);

		String notation = prop.getProperty(NOTATION);
		if (notation != null)
			options.notation = CMLCheckers.getEnum(Notation.class, notation).toJavaUtil()
					.orElseThrow(() -> new IllegalArgumentException("Invalid value for " + NOTATION + ": " + notation));

		String source = prop.getProperty(GRAPH_SOURCE);
		if (source != null)
			options.graph_source = CMLCheckers.getEnum(GraphSource.class, source).toJavaUtil()
					.orElseThrow(() -> new IllegalArgumentException("Invalid value for " + GRAPH_SOURCE + ": " + source));

		String threads = prop.getProperty(THREADS);
		if (threads != null)
		{
			try
			{
				options.threads = Integer.parseInt(threads.trim());
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Invalid value for " + THREADS + ": " + threads);
			}
			if (options.threads < 1)
				throw new IllegalArgumentException(THREADS + " must be greater than 0: " + threads);
		}
	}

	private static boolean getBoolean(Properties prop, String key, boolean default_value)
	{
		String value = prop.getProperty(key);
		if (value == null)
			return default_value;
		value = value.trim();
		if (value.equalsIgnoreCase("true"))
			return true;
		if (value.equalsIgnoreCase("false"))
			return false;
		throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
	}

	// A copy, so that command line flags can override it
	public ReaderOptions getOptions()
	{
		return new ReaderOptions(options);
	}
}
