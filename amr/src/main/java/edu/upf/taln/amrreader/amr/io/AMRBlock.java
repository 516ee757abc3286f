package edu.upf.taln.amrreader.amr.io;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * A chunk of an AMR bank between blank lines: metadata, opaque comments and the graph text.
 */
public final class AMRBlock
{
	public static final String ID = "id";
	public static final String TOKENS = "tok";
	public static final String SENTENCE = "snt";
	public static final String ALIGNMENTS = "alignments";
	public static final String NODE = "node";
	public static final String EDGE = "edge";
	public static final String ROOT = "root";

	private final int number; // 1-based
	private final int first_line; // 1-based
	private final ImmutableListMultimap<String, String> metadata;
	private final ImmutableList<String> comments;
	private final String graph_text;
	private final int graph_line;

	public AMRBlock(int number, int first_line, ListMultimap<String, String> metadata, List<String> comments,
	                String graph_text, int graph_line)
	{
		this.number = number;
		this.first_line = first_line;
		this.metadata = ImmutableListMultimap.copyOf(metadata);
		this.comments = ImmutableList.copyOf(comments);
		this.graph_text = graph_text;
		this.graph_line = graph_line;
	}

	public int getNumber() { return number; }
	public int getFirstLine() { return first_line; }
	public ListMultimap<String, String> getMetadata() { return metadata; }
	public List<String> getComments() { return comments; }
	public String getGraphText() { return graph_text; }
	public int getGraphLine() { return graph_line; }
	public boolean hasGraphText() { return !StringUtils.isBlank(graph_text); }
	public boolean hasNodeDeclarations() { return metadata.containsKey(NODE); }
	public List<String> getMetadata(String key) { return metadata.get(key); }

	public Optional<String> getMetadataValue(String key)
	{
		return metadata.get(key).stream().findFirst();
	}

	// AMR id, or the block number if there is no ::id
	public String getId()
	{
		return getMetadataValue(ID)
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.map(s -> s.split("\\s+")[0])
				.orElse(Integer.toString(number));
	}

	public List<String> getTokens()
	{
		return getMetadataValue(TOKENS)
				.map(t -> Splitter.on(' ').omitEmptyStrings().splitToList(t.trim()))
				.orElse(ImmutableList.of());
	}

	@Override
	public String toString()
	{
		return "block " + number + " (" + getId() + ", line " + first_line + ")";
	}
}
