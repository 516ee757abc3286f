package edu.upf.taln.amrreader.amr.io.parse;

import com.google.common.base.Preconditions;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.traverse.DepthFirstIterator;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Graph as read from the input, before identifiers are assigned.
 * Nodes live in an index-addressed list and the JGraphT graph only holds their indices.
 */
public class ParsedGraph
{
	public static final String WIKI = ":wiki";

	public static final class ParsedNode
	{
		public final int index;
		public final String declared_id; // variable or ::node id, null for constants in parenthesized graphs
		public final String variable;
		public final String concept; // null for constants
		public final String value; // null for concepts

		private ParsedNode(int index, String declared_id, String variable, String concept, String value)
		{
			this.index = index;
			this.declared_id = declared_id;
			this.variable = variable;
			this.concept = concept;
			this.value = value;
		}

		public boolean isConstant() { return concept == null; }

		@Override
		public String toString()
		{
			return isConstant() ? value : (declared_id != null ? declared_id + " / " : "") + concept;
		}
	}

	// Edges are compared by identity, so that repeated triples remain distinct edges
	public static final class ParsedEdge
	{
		public final int source;
		public final String role;
		public final int target;
		public final int slot;

		private ParsedEdge(int source, String role, int target, int slot)
		{
			this.source = source;
			this.role = role;
			this.target = target;
			this.slot = slot;
		}

		@Override
		public String toString()
		{
			return source + " " + role + " " + target + " (" + slot + ")";
		}
	}

	private final List<ParsedNode> nodes = new ArrayList<>();
	private final DirectedPseudograph<Integer, ParsedEdge> graph = new DirectedPseudograph<>(ParsedEdge.class);
	private int root = -1;

	public int addConcept(String declared_id, String variable, String concept)
	{
		return add(new ParsedNode(nodes.size(), declared_id, variable, concept, null));
	}

	public int addConstant(String declared_id, String value)
	{
		return add(new ParsedNode(nodes.size(), declared_id, null, null, value));
	}

	private int add(ParsedNode node)
	{
		nodes.add(node);
		graph.addVertex(node.index);
		return node.index;
	}

	public ParsedEdge addEdge(int source, String role, int target, int slot)
	{
		Preconditions.checkArgument(graph.containsVertex(source) && graph.containsVertex(target));
		ParsedEdge e = new ParsedEdge(source, role, target, slot);
		graph.addEdge(source, target, e);
		return e;
	}

	public void setRoot(int root)
	{
		Preconditions.checkArgument(graph.containsVertex(root));
		this.root = root;
	}

	public int getRoot() { return root; }
	public boolean hasRoot() { return root >= 0; }
	public ParsedNode getNode(int index) { return nodes.get(index); }

	// Nodes currently in the graph, in creation order
	public List<ParsedNode> getNodes()
	{
		return nodes.stream()
				.filter(n -> graph.containsVertex(n.index))
				.collect(toList());
	}

	public List<ParsedEdge> getOutgoingEdges(int index)
	{
		return graph.outgoingEdgesOf(index).stream()
				.sorted(Comparator.comparingInt(e -> e.slot))
				.collect(toList());
	}

	public int getNumEdges() { return graph.edgeSet().size(); }

	public Set<Integer> getReachable()
	{
		Set<Integer> reachable = new HashSet<>();
		if (!hasRoot())
			return reachable;
		new DepthFirstIterator<>(graph, root).forEachRemaining(reachable::add);
		return reachable;
	}

	/**
	 * Removes :wiki edges whose target is a constant without other incoming edges, along with the target.
	 * Slots of the remaining edges are not changed.
	 * @return number of removed edges
	 */
	public int removeWiki()
	{
		List<ParsedEdge> wiki = graph.edgeSet().stream()
				.filter(e -> e.role.equals(WIKI))
				.filter(e -> nodes.get(e.target).isConstant())
				.filter(e -> graph.inDegreeOf(e.target) == 1)
				.collect(toList());
		wiki.forEach(e ->
		{
			graph.removeEdge(e);
			graph.removeVertex(e.target);
		});
		return wiki.size();
	}
}
