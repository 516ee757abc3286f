package edu.upf.taln.amrreader.amr.io;

import edu.upf.taln.amrreader.amr.io.parse.ParsedGraph;
import edu.upf.taln.amrreader.amr.io.parse.ParsedGraph.ParsedEdge;
import edu.upf.taln.amrreader.amr.io.parse.ParsedGraph.ParsedNode;
import edu.upf.taln.amrreader.core.structures.AMRGraph;
import edu.upf.taln.amrreader.core.structures.CanonicalIds;
import edu.upf.taln.amrreader.core.structures.Edge;
import edu.upf.taln.amrreader.core.structures.Node;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.joining;

/**
 * Assigns positional ids to the nodes and edges of a parsed graph.
 * Nodes are identified at their first visit in a depth-first traversal from the root that follows edges in slot
 * order: the root is 1 and the target of the edge in slot n of node X is X.n. Edges reaching an already
 * identified node are re-entrant.
 */
public class IdentifierAssigner
{
	private final static Logger log = LogManager.getLogger();

	public static AMRGraph assign(String amr_id, ParsedGraph parsed) throws FormatError
	{
		return assign(AMRGraph.builder(amr_id), parsed);
	}

	/**
	 * @param builder graph builder, possibly already holding tokens and metadata
	 */
	public static AMRGraph assign(AMRGraph.Builder builder, ParsedGraph parsed) throws FormatError
	{
		if (!parsed.hasRoot())
			throw new FormatError("Graph has no root");

		Set<Integer> reachable = parsed.getReachable();
		List<ParsedNode> unreachable = new ArrayList<>();
		for (ParsedNode n : parsed.getNodes())
		{
			if (!reachable.contains(n.index))
				unreachable.add(n);
		}
		if (!unreachable.isEmpty())
			throw new FormatError("Nodes not reachable from the root: " + unreachable.stream()
					.map(ParsedNode::toString)
					.collect(joining(", ")));

		Map<Integer, String> ids = new LinkedHashMap<>();
		List<ParsedEdge> traversed = new ArrayList<>();
		ids.put(parsed.getRoot(), CanonicalIds.ROOT);
		visit(parsed, parsed.getRoot(), ids, traversed);

		ids.forEach((index, id) ->
		{
			ParsedNode n = parsed.getNode(index);
			if (n.isConstant())
				builder.addNode(Node.constant(id, n.value));
			else
				builder.addNode(Node.concept(id, n.variable, n.concept));
			if (n.declared_id != null)
				builder.declaredId(n.declared_id, id);
		});

		// edge ids are derived once all node ids are known
		Set<Triple<String, String, String>> triples = new HashSet<>();
		Set<String> introduced = new HashSet<>();
		introduced.add(CanonicalIds.ROOT);
		for (ParsedEdge e : traversed)
		{
			String source = ids.get(e.source);
			String target = ids.get(e.target);
			Triple<String, String, String> triple = Triple.of(source, e.role, target);
			if (!triples.add(triple))
			{
				log.warn("Duplicate edge " + source + " " + e.role + " " + target + " ignored");
				continue;
			}
			boolean reentrant = !introduced.add(target);
			builder.addEdge(new Edge(source, e.role, target, e.slot, reentrant));
		}

		return builder.build();
	}

	// Depth-first, a node gets its id from the first edge that reaches it
	private static void visit(ParsedGraph parsed, int root, Map<Integer, String> ids, List<ParsedEdge> traversed)
	{
		Deque<Pair<Integer, Iterator<ParsedEdge>>> stack = new ArrayDeque<>();
		stack.push(Pair.of(root, parsed.getOutgoingEdges(root).iterator()));
		while (!stack.isEmpty())
		{
			Pair<Integer, Iterator<ParsedEdge>> top = stack.peek();
			if (!top.getRight().hasNext())
			{
				stack.pop();
				continue;
			}

			ParsedEdge e = top.getRight().next();
			traversed.add(e);
			if (!ids.containsKey(e.target))
			{
				ids.put(e.target, CanonicalIds.child(ids.get(top.getLeft()), e.slot));
				stack.push(Pair.of(e.target, parsed.getOutgoingEdges(e.target).iterator()));
			}
		}
	}
}
