package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Preconditions;
import com.google.common.collect.*;
import org.apache.commons.lang3.tuple.Triple;

import java.io.Serializable;
import java.util.*;

/**
 * Immutable AMR graph whose nodes and edges are identified by canonical positional ids.
 * Nodes are kept in depth-first order of first visit, edges in the order they were traversed.
 */
public final class AMRGraph implements Serializable
{
	private final String id;
	private final String root;
	private final ImmutableMap<String, Node> nodes;
	private final ImmutableList<Edge> edges;
	private final ImmutableMap<Triple<String, String, String>, Edge> edges_by_triple;
	private final ImmutableListMultimap<String, Edge> outgoing; // sorted by slot
	private final ImmutableListMultimap<String, Edge> incoming;
	private final ImmutableList<String> tokens;
	private final ImmutableListMultimap<String, String> metadata;
	private final ImmutableList<String> comments;
	private final ImmutableMap<String, String> declared_ids; // variables or ::node ids -> canonical ids
	private final static long serialVersionUID = 1L;

	private AMRGraph(Builder b)
	{
		Preconditions.checkNotNull(b.id);
		Preconditions.checkArgument(b.nodes.containsKey(CanonicalIds.ROOT), "Graph " + b.id + " has no root node");
		this.id = b.id;
		this.root = CanonicalIds.ROOT;
		this.nodes = ImmutableMap.copyOf(b.nodes);
		this.edges = ImmutableList.copyOf(b.edges);

		ImmutableMap.Builder<Triple<String, String, String>, Edge> by_triple = ImmutableMap.builder();
		ImmutableListMultimap.Builder<String, Edge> out = ImmutableListMultimap.builder();
		ImmutableListMultimap.Builder<String, Edge> in = ImmutableListMultimap.builder();
		for (Edge e : edges)
		{
			Preconditions.checkArgument(nodes.containsKey(e.getSource()), "Unknown source node in edge " + e);
			Preconditions.checkArgument(nodes.containsKey(e.getTarget()), "Unknown target node in edge " + e);
			by_triple.put(e.getTriple(), e);
			out.put(e.getSource(), e);
			in.put(e.getTarget(), e);
		}
		out.orderValuesBy(Comparator.comparingInt(Edge::getSlot));
		this.edges_by_triple = by_triple.build();
		this.outgoing = out.build();
		this.incoming = in.build();
		this.tokens = ImmutableList.copyOf(b.tokens);
		this.metadata = ImmutableListMultimap.copyOf(b.metadata);
		this.comments = ImmutableList.copyOf(b.comments);
		this.declared_ids = ImmutableMap.copyOf(b.declared_ids);
	}

	public static Builder builder(String id)
	{
		return new Builder(id);
	}

	public String getId() { return id; }
	public String getRoot() { return root; }
	public Node getRootNode() { return nodes.get(root); }
	public Collection<Node> getNodes() { return nodes.values(); }
	public Set<String> getNodeIds() { return nodes.keySet(); }
	public List<Edge> getEdges() { return edges; }
	public boolean containsNode(String node_id) { return nodes.containsKey(node_id); }
	public Optional<Node> getNode(String node_id) { return Optional.ofNullable(nodes.get(node_id)); }
	public List<String> getTokens() { return tokens; }
	public ListMultimap<String, String> getMetadata() { return metadata; }
	public List<String> getComments() { return comments; }
	public Map<String, String> getDeclaredIds() { return declared_ids; }

	public boolean containsEdge(Triple<String, String, String> triple) { return edges_by_triple.containsKey(triple); }
	public Optional<Edge> getEdge(Triple<String, String, String> triple) { return Optional.ofNullable(edges_by_triple.get(triple)); }
	public Optional<Edge> getEdge(String source, String role, String target) { return getEdge(Triple.of(source, role, target)); }

	// Edges leaving a node, in slot order
	public List<Edge> getOutgoingEdges(String node_id) { return outgoing.get(node_id); }
	public List<Edge> getIncomingEdges(String node_id) { return incoming.get(node_id); }

	public Optional<Edge> getEdgeInSlot(String node_id, int slot)
	{
		return outgoing.get(node_id).stream()
				.filter(e -> e.getSlot() == slot)
				.findFirst();
	}

	// Outgoing edges that introduced their target, i.e. edges of the spanning tree, in slot order
	public List<Edge> getTreeEdges(String node_id)
	{
		return outgoing.get(node_id).stream()
				.filter(e -> !e.isReentrant())
				.collect(ImmutableList.toImmutableList());
	}

	public Optional<String> resolveDeclaredId(String declared_id)
	{
		return Optional.ofNullable(declared_ids.get(declared_id));
	}

	/**
	 * Number of tokens of the sentence, if known from the ::tok metadata.
	 */
	public OptionalInt getSentenceLength()
	{
		return tokens.isEmpty() ? OptionalInt.empty() : OptionalInt.of(tokens.size());
	}

	public Optional<String> getMetadataValue(String key)
	{
		return metadata.get(key).stream().findFirst();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AMRGraph graph = (AMRGraph) o;
		return id.equals(graph.id) && nodes.equals(graph.nodes) && edges.equals(graph.edges) &&
				tokens.equals(graph.tokens) && metadata.equals(graph.metadata) && comments.equals(graph.comments) &&
				declared_ids.equals(graph.declared_ids);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, nodes, edges, tokens);
	}

	@Override
	public String toString()
	{
		return id + " (" + nodes.size() + " nodes, " + edges.size() + " edges)";
	}

	public static final class Builder
	{
		private final String id;
		private final Map<String, Node> nodes = new LinkedHashMap<>();
		private final List<Edge> edges = new ArrayList<>();
		private final List<String> tokens = new ArrayList<>();
		private final ListMultimap<String, String> metadata = LinkedListMultimap.create();
		private final List<String> comments = new ArrayList<>();
		private final Map<String, String> declared_ids = new LinkedHashMap<>();

		private Builder(String id)
		{
			this.id = id;
		}

		public Builder addNode(Node node)
		{
			Preconditions.checkArgument(!nodes.containsKey(node.getId()), "Duplicate node id " + node.getId());
			nodes.put(node.getId(), node);
			return this;
		}

		public Builder addEdge(Edge edge)
		{
			edges.add(edge);
			return this;
		}

		public Builder tokens(List<String> tokens)
		{
			this.tokens.addAll(tokens);
			return this;
		}

		public Builder metadata(ListMultimap<String, String> metadata)
		{
			this.metadata.putAll(metadata);
			return this;
		}

		public Builder comments(List<String> comments)
		{
			this.comments.addAll(comments);
			return this;
		}

		public Builder declaredId(String declared_id, String canonical_id)
		{
			declared_ids.put(declared_id, canonical_id);
			return this;
		}

		public AMRGraph build()
		{
			return new AMRGraph(this);
		}
	}
}
