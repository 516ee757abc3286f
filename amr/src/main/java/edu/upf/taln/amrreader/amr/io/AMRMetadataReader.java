package edu.upf.taln.amrreader.amr.io;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import edu.upf.taln.amrreader.amr.alignments.AlignmentFormatError;
import edu.upf.taln.amrreader.amr.alignments.JAMRAlignmentReader;
import edu.upf.taln.amrreader.amr.alignments.NativeRef;
import edu.upf.taln.amrreader.amr.alignments.RawAlignment;
import edu.upf.taln.amrreader.amr.io.parse.AMRParser;
import edu.upf.taln.amrreader.amr.io.parse.ParsedGraph;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import org.apache.commons.lang3.StringUtils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds graphs from JAMR-style metadata:
 * <pre>
 * # ::node	id	label	[span]
 * # ::root	id	label
 * # ::edge	source-label	role	target-label	source-id	target-id	[span]
 * </pre>
 * Outgoing edges of a node take their slots from the order of the ::edge lines. When all ids are JAMR paths
 * (0, 0.1, 0.1.0...) the children introduced by a node are put back in the order given by their paths.
 * Otherwise ids are taken as the variables of the graph. Spans become JAMR alignments addressed by declared id.
 */
public class AMRMetadataReader
{
	private static final Pattern jamr_path = Pattern.compile("\\d+(\\.\\d+)*");

	public static final class Result
	{
		public final ParsedGraph graph;
		public final List<RawAlignment> alignments;
		public final List<AlignmentFormatError> errors;

		private Result(ParsedGraph graph, List<RawAlignment> alignments, List<AlignmentFormatError> errors)
		{
			this.graph = graph;
			this.alignments = alignments;
			this.errors = errors;
		}
	}

	private static final class EdgeLine
	{
		final String source;
		final String role;
		final String target;

		EdgeLine(String source, String role, String target)
		{
			this.source = source;
			this.role = role;
			this.target = target;
		}
	}

	private final JAMRAlignmentReader span_reader;

	public AMRMetadataReader(boolean end_exclusive)
	{
		this.span_reader = new JAMRAlignmentReader(end_exclusive);
	}

	public Result read(AMRBlock block, OptionalInt sentence_length) throws FormatError
	{
		ParsedGraph graph = new ParsedGraph();
		List<RawAlignment> alignments = new ArrayList<>();
		List<AlignmentFormatError> errors = new ArrayList<>();
		Map<String, Integer> declared = new LinkedHashMap<>();
		int line = block.getFirstLine();

		List<List<String>> node_lines = new ArrayList<>();
		for (String node_line : block.getMetadata(AMRBlock.NODE))
		{
			List<String> cols = columns(node_line);
			if (cols.size() < 2 || cols.get(0).isEmpty() || cols.get(1).isEmpty())
				throw new FormatError("Malformed ::node line: " + node_line, line);
			node_lines.add(cols);
		}
		// ids are either JAMR paths or the variables of the graph
		boolean path_ids = node_lines.stream().allMatch(cols -> jamr_path.matcher(cols.get(0)).matches());

		for (List<String> cols : node_lines)
		{
			String id = cols.get(0);
			String label = cols.get(1);
			if (declared.containsKey(id))
				throw new FormatError("Node " + id + " is declared more than once", line);

			int index;
			if (AMRParser.isConstant(label))
				index = graph.addConstant(id, label);
			else
				index = graph.addConcept(id, path_ids ? null : id, label);
			declared.put(id, index);

			if (cols.size() > 2 && !cols.get(2).isEmpty())
				readAlignment(cols.get(2), NativeRef.nodeId(id), sentence_length, alignments, errors);
		}

		String root = block.getMetadataValue(AMRBlock.ROOT)
				.map(r -> columns(r).get(0))
				.filter(r -> !r.isEmpty())
				.orElseThrow(() -> new FormatError("Missing ::root line", line));
		if (!declared.containsKey(root))
			throw new FormatError("Root " + root + " is not a declared node", line);
		graph.setRoot(declared.get(root));

		ListMultimap<String, EdgeLine> edges = LinkedListMultimap.create();
		for (String edge_line : block.getMetadata(AMRBlock.EDGE))
		{
			List<String> cols = columns(edge_line);
			if (cols.size() < 5)
				throw new FormatError("Malformed ::edge line: " + edge_line, line);
			String role = cols.get(1).startsWith(":") ? cols.get(1) : ":" + cols.get(1);
			String source = cols.get(3);
			String target = cols.get(4);
			if (!declared.containsKey(source))
				throw new FormatError("Edge source " + source + " is not a declared node", line);
			if (!declared.containsKey(target))
				throw new FormatError("Edge target " + target + " is not a declared node", line);
			edges.put(source, new EdgeLine(source, role, target));

			if (cols.size() > 5 && !cols.get(5).isEmpty())
				readAlignment(cols.get(5), NativeRef.edgeIds(source, role, target), sentence_length, alignments, errors);
		}

		for (String source : edges.keySet())
		{
			List<EdgeLine> ordered = path_ids ? orderByPath(source, edges.get(source)) : edges.get(source);
			int slot = 0;
			for (EdgeLine e : ordered)
				graph.addEdge(declared.get(e.source), e.role, declared.get(e.target), ++slot);
		}

		return new Result(graph, alignments, errors);
	}

	// Children introduced by source (id source.k) are sorted by k, other edges keep their position
	private static List<EdgeLine> orderByPath(String source, List<EdgeLine> edges)
	{
		List<Integer> positions = new ArrayList<>();
		List<EdgeLine> tree_edges = new ArrayList<>();
		Set<String> targets = new HashSet<>();
		for (int i = 0; i < edges.size(); ++i)
		{
			EdgeLine e = edges.get(i);
			if (childIndex(source, e.target).isPresent() && targets.add(e.target))
			{
				positions.add(i);
				tree_edges.add(e);
			}
		}
		tree_edges.sort(Comparator.comparingInt(e -> childIndex(source, e.target).orElse(0)));

		List<EdgeLine> ordered = new ArrayList<>(edges);
		for (int i = 0; i < positions.size(); ++i)
			ordered.set(positions.get(i), tree_edges.get(i));
		return ordered;
	}

	private static OptionalInt childIndex(String parent, String child)
	{
		String prefix = parent + ".";
		if (!child.startsWith(prefix))
			return OptionalInt.empty();
		String rest = child.substring(prefix.length());
		if (rest.isEmpty() || !StringUtils.isNumeric(rest))
			return OptionalInt.empty();
		return OptionalInt.of(Integer.parseInt(rest));
	}

	private void readAlignment(String span, NativeRef ref, OptionalInt sentence_length, List<RawAlignment> alignments,
	                           List<AlignmentFormatError> errors)
	{
		String raw = ref.getRaw() + " " + span;
		try
		{
			List<Integer> tokens = span_reader.readSpan(span, sentence_length, raw);
			RawAlignment.checkRange(tokens, sentence_length, raw);
			alignments.add(new RawAlignment(AlignmentType.JAMR, tokens, ImmutableList.of(ref), raw));
		}
		catch (AlignmentFormatError e)
		{
			errors.add(e);
		}
	}

	/**
	 * Splits a tab-separated metadata value, joining back quoted labels that contain tabs.
	 */
	static List<String> columns(String value)
	{
		List<String> cols = new ArrayList<>();
		StringBuilder quoted = null;
		for (String col : value.split("\t", -1))
		{
			String val = col.trim();
			if (quoted != null)
			{
				quoted.append('\t').append(col);
				if (val.endsWith("\""))
				{
					cols.add(quoted.toString().trim());
					quoted = null;
				}
			}
			else if (val.startsWith("\"") && (val.length() == 1 || !val.endsWith("\"")))
				quoted = new StringBuilder(col);
			else
				cols.add(val);
		}
		if (quoted != null)
			cols.add(quoted.toString().trim());
		return cols;
	}
}
