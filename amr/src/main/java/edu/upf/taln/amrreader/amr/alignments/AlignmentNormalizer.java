package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.amrreader.core.structures.*;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.function.Function;

/**
 * Rewrites alignments from their native addressing into canonical node ids and edge triples, then merges records
 * of the same type sharing their tokens or their targets.
 */
public class AlignmentNormalizer
{
	// Node reached by a path, and the edge taken by its last step (null for the root)
	static final class Position
	{
		final String node;
		final Edge edge;

		Position(String node, Edge edge)
		{
			this.node = node;
			this.edge = edge;
		}
	}

	@FunctionalInterface
	interface PathWalker
	{
		Position walk(AMRGraph graph, NativeRef ref, RawAlignment record) throws ResolutionError;
	}

	public static final class Result
	{
		public final AMRAlignments alignments;
		public final List<ResolutionError> errors;

		private Result(AMRAlignments alignments, List<ResolutionError> errors)
		{
			this.alignments = alignments;
			this.errors = errors;
		}
	}

	private static final Map<AlignmentType, PathWalker> walkers = new EnumMap<>(AlignmentType.class);
	static
	{
		walkers.put(AlignmentType.LDC, AlignmentNormalizer::walkSlots);
		walkers.put(AlignmentType.ISI, AlignmentNormalizer::walkSlots);
		walkers.put(AlignmentType.JAMR, AlignmentNormalizer::walkTree);
	}
	private final static Logger log = LogManager.getLogger();

	public static Result normalize(AMRGraph graph, List<RawAlignment> raw_alignments)
	{
		List<AlignmentRecord> records = new ArrayList<>();
		List<ResolutionError> errors = new ArrayList<>();

		for (RawAlignment raw : raw_alignments)
		{
			Set<String> nodes = new HashSet<>();
			Set<Triple<String, String, String>> edges = new HashSet<>();
			for (NativeRef ref : raw.getRefs())
			{
				try
				{
					resolve(graph, ref, raw, nodes, edges);
				}
				catch (ResolutionError e)
				{
					log.debug("Graph " + graph.getId() + ": " + e.getMessage());
					errors.add(e);
				}
			}
			if (!nodes.isEmpty() || !edges.isEmpty())
				records.add(new AlignmentRecord(raw.getType(), raw.getTokens(), nodes, edges));
		}

		return new Result(new AMRAlignments(graph, merge(records)), errors);
	}

	private static void resolve(AMRGraph graph, NativeRef ref, RawAlignment raw, Set<String> nodes,
	                            Set<Triple<String, String, String>> edges) throws ResolutionError
	{
		switch (ref.getKind())
		{
			case NODE_PATH:
				nodes.add(walkers.get(raw.getType()).walk(graph, ref, raw).node);
				break;
			case EDGE_PATH:
			{
				Position p = walkers.get(raw.getType()).walk(graph, ref, raw);
				if (p.edge == null)
					throw new ResolutionError("The root has no incoming edge", ref.getRaw(), raw.getRaw());
				edges.add(p.edge.getTriple());
				break;
			}
			case NODE_ID:
				nodes.add(graph.resolveDeclaredId(ref.getId())
						.orElseThrow(() -> new ResolutionError("Unknown node id", ref.getRaw(), raw.getRaw())));
				break;
			case EDGE_IDS:
			{
				Triple<String, String, String> e = ref.getEdge();
				String source = graph.resolveDeclaredId(e.getLeft())
						.orElseThrow(() -> new ResolutionError("Unknown source node id", ref.getRaw(), raw.getRaw()));
				String target = graph.resolveDeclaredId(e.getRight())
						.orElseThrow(() -> new ResolutionError("Unknown target node id", ref.getRaw(), raw.getRaw()));
				Triple<String, String, String> triple = Triple.of(source, e.getMiddle(), target);
				if (!graph.containsEdge(triple))
					throw new ResolutionError("No such edge", ref.getRaw(), raw.getRaw());
				edges.add(triple);
				break;
			}
		}
	}

	// Paths from root 1, each step selects the edge in that slot, re-entrant edges included
	private static Position walkSlots(AMRGraph graph, NativeRef ref, RawAlignment raw) throws ResolutionError
	{
		List<Integer> path = ref.getPath();
		if (path.isEmpty() || path.get(0) != 1)
			throw new ResolutionError("Paths must start at the root 1", ref.getRaw(), raw.getRaw());

		Position p = new Position(graph.getRoot(), null);
		for (int slot : path.subList(1, path.size()))
		{
			Edge e = graph.getEdgeInSlot(p.node, slot)
					.orElseThrow(() -> new ResolutionError("No edge in slot " + slot, ref.getRaw(), raw.getRaw()));
			p = new Position(e.getTarget(), e);
		}
		return p;
	}

	// Paths from root 0, each step selects the n-th non re-entrant child from 0
	private static Position walkTree(AMRGraph graph, NativeRef ref, RawAlignment raw) throws ResolutionError
	{
		List<Integer> path = ref.getPath();
		if (path.isEmpty() || path.get(0) != 0)
			throw new ResolutionError("Paths must start at the root 0", ref.getRaw(), raw.getRaw());

		Position p = new Position(graph.getRoot(), null);
		for (int child : path.subList(1, path.size()))
		{
			List<Edge> children = graph.getTreeEdges(p.node);
			if (child >= children.size())
				throw new ResolutionError("No child " + child, ref.getRaw(), raw.getRaw());
			Edge e = children.get(child);
			p = new Position(e.getTarget(), e);
		}
		return p;
	}

	/**
	 * Merges records of the same type with the same tokens, then those with the same nodes and edges, until
	 * no more records can be merged.
	 */
	public static List<AlignmentRecord> merge(List<AlignmentRecord> records)
	{
		Map<AlignmentType, List<AlignmentRecord>> by_type = new EnumMap<>(AlignmentType.class);
		records.forEach(r -> by_type.computeIfAbsent(r.getType(), t -> new ArrayList<>()).add(r));

		ImmutableList.Builder<AlignmentRecord> merged = ImmutableList.builder();
		for (List<AlignmentRecord> type_records : by_type.values())
		{
			List<AlignmentRecord> current = type_records;
			int size;
			do
			{
				size = current.size();
				current = mergeBy(current, AlignmentRecord::getTokens);
				current = mergeBy(current, r -> Pair.of(r.getNodes(), r.getEdges()));
			}
			while (current.size() < size);
			merged.addAll(current);
		}
		return merged.build();
	}

	private static List<AlignmentRecord> mergeBy(List<AlignmentRecord> records, Function<AlignmentRecord, Object> key)
	{
		Map<Object, AlignmentRecord> groups = new LinkedHashMap<>();
		records.forEach(r -> groups.merge(key.apply(r), r, AlignmentRecord::merge));
		return new ArrayList<>(groups.values());
	}
}
