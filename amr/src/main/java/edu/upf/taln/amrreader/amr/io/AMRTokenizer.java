package edu.upf.taln.amrreader.amr.io;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Streams;
import com.google.common.io.CharSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Splits an AMR bank into blocks separated by blank lines. Iteration is lazy, and each call to iterator() reads the
 * source again from the start. The underlying reader is closed when iteration reaches the end; callers that may stop
 * early should use {@link #stream()} in a try-with-resources block instead.
 */
public class AMRTokenizer implements Iterable<AMRBlock>
{
	private final CharSource source;
	// keys whose value spans the rest of the line, tab-separated or free text
	private static final ImmutableSet<String> whole_line_keys = ImmutableSet.of(AMRBlock.NODE, AMRBlock.EDGE,
			AMRBlock.ROOT, AMRBlock.SENTENCE, AMRBlock.TOKENS);
	private static final Pattern key_pattern = Pattern.compile("(?:^|\\s)::(\\S+)");
	private final static Logger log = LogManager.getLogger();

	public AMRTokenizer(CharSource source)
	{
		this.source = source;
	}

	public static AMRTokenizer of(String text)
	{
		return new AMRTokenizer(CharSource.wrap(text));
	}

	@Override
	public Iterator<AMRBlock> iterator()
	{
		return open();
	}

	/**
	 * Lazy stream of blocks. Closing the stream closes the source, whether or not all blocks were read.
	 */
	public Stream<AMRBlock> stream()
	{
		BlockIterator blocks = open();
		return Streams.stream(blocks).onClose(blocks::close);
	}

	private BlockIterator open()
	{
		try
		{
			return new BlockIterator(source.openBufferedStream());
		}
		catch (IOException e)
		{
			throw new UncheckedIOException("Cannot open AMR source", e);
		}
	}

	/**
	 * Fails if the block has neither graph text nor ::node declarations, or if its parentheses are unbalanced.
	 */
	public static void check(AMRBlock block) throws FormatError
	{
		if (!block.hasGraphText() && !block.hasNodeDeclarations())
			throw new FormatError("Block " + block.getNumber() + " has metadata but no graph", block.getFirstLine());
		if (block.hasGraphText())
			checkBalanced(block.getGraphText(), block.getGraphLine());
	}

	// Parentheses inside quoted strings are ignored, as are backslash-escaped characters within them
	static void checkBalanced(String text, int first_line) throws FormatError
	{
		int depth = 0;
		boolean in_quotes = false;
		for (int i = 0; i < text.length(); ++i)
		{
			char c = text.charAt(i);
			if (c == '"')
				in_quotes = !in_quotes;
			else if (in_quotes)
			{
				if (c == '\\')
					++i; // escaped character
			}
			else if (c == '(')
				++depth;
			else if (c == ')')
			{
				if (--depth < 0)
					throw FormatError.at(text, i, first_line, "unmatched ')'");
			}
		}
		if (in_quotes)
			throw FormatError.at(text, text.length(), first_line, "unterminated quoted string");
		if (depth > 0)
			throw FormatError.at(text, text.length(), first_line, depth + " unclosed '('");
	}

	/**
	 * Adds the ::key value pairs of a comment line to the metadata. Returns false if the line has no metadata.
	 */
	static boolean readMetadata(String line, ListMultimap<String, String> metadata)
	{
		String content = line.substring(1).trim();
		if (!content.startsWith("::"))
			return false;

		int key_end = 2;
		while (key_end < content.length() && !Character.isWhitespace(content.charAt(key_end)))
			++key_end;
		String first_key = content.substring(2, key_end);
		if (whole_line_keys.contains(first_key))
		{
			// drop the single separator after the key, keeping empty tab-separated columns
			String value = key_end < content.length() ? content.substring(key_end + 1) : "";
			metadata.put(first_key, value);
			return true;
		}

		Matcher m = key_pattern.matcher(content);
		String key = null;
		int value_start = 0;
		while (m.find())
		{
			if (key != null)
				metadata.put(key, content.substring(value_start, m.start()).trim());
			key = m.group(1);
			value_start = m.end();
		}
		if (key != null)
			metadata.put(key, content.substring(value_start).trim());
		return true;
	}

	private static class BlockIterator extends AbstractIterator<AMRBlock> implements Closeable
	{
		private final BufferedReader reader;
		private int line_number = 0;
		private int block_number = 0;

		BlockIterator(BufferedReader reader)
		{
			this.reader = reader;
		}

		@Override
		protected AMRBlock computeNext()
		{
			try
			{
				while (true)
				{
					ListMultimap<String, String> metadata = LinkedListMultimap.create();
					List<String> comments = new ArrayList<>();
					StringBuilder graph = new StringBuilder();
					int first_line = 0;
					int graph_line = 0;

					String line;
					while ((line = reader.readLine()) != null)
					{
						++line_number;
						if (line.trim().isEmpty())
						{
							if (first_line > 0)
								break;
							continue;
						}
						if (first_line == 0)
							first_line = line_number;

						if (line.startsWith("#") && graph.length() == 0)
						{
							if (!readMetadata(line, metadata))
								comments.add(line);
						}
						else
						{
							if (graph.length() == 0)
								graph_line = line_number;
							else
								graph.append("\n");
							graph.append(line);
						}
					}

					if (first_line == 0)
					{
						close();
						return endOfData();
					}
					if (metadata.isEmpty() && graph.length() == 0)
					{
						log.debug("Skipping comment block at line " + first_line);
						continue;
					}

					return new AMRBlock(++block_number, first_line, metadata, comments, graph.toString(), graph_line);
				}
			}
			catch (IOException e)
			{
				throw new UncheckedIOException("Failed to read AMR source at line " + line_number, e);
			}
		}

		@Override
		public void close()
		{
			try
			{
				reader.close();
			}
			catch (IOException e)
			{
				throw new UncheckedIOException("Failed to close AMR source", e);
			}
		}
	}
}
