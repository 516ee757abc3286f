package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.commons.lang3.tuple.Triple;

import java.io.Serializable;
import java.util.Collection;
import java.util.Objects;

/**
 * Aligns an ascending set of 0-based token offsets with a set of nodes and edges of a graph, all referenced by
 * canonical ids. Edges are referenced by their (source, role, target) triple.
 */
public final class AlignmentRecord implements Serializable
{
	private final AlignmentType type;
	private final ImmutableSortedSet<Integer> tokens;
	private final ImmutableSortedSet<String> nodes;
	private final ImmutableSortedSet<Triple<String, String, String>> edges;
	private final static long serialVersionUID = 1L;

	public AlignmentRecord(AlignmentType type, Collection<Integer> tokens, Collection<String> nodes,
	                       Collection<Triple<String, String, String>> edges)
	{
		Preconditions.checkNotNull(type);
		Preconditions.checkArgument(!tokens.isEmpty(), "Alignment without tokens");
		Preconditions.checkArgument(tokens.stream().allMatch(t -> t != null && t >= 0), "Invalid token offsets " + tokens);
		this.type = type;
		this.tokens = ImmutableSortedSet.copyOf(tokens);
		this.nodes = ImmutableSortedSet.copyOf(CanonicalIds.COMPARATOR, nodes);
		this.edges = ImmutableSortedSet.copyOf(CanonicalIds.TRIPLE_COMPARATOR, edges);
	}

	public AlignmentType getType() { return type; }
	public ImmutableSortedSet<Integer> getTokens() { return tokens; }
	public ImmutableSortedSet<String> getNodes() { return nodes; }
	public ImmutableSortedSet<Triple<String, String, String>> getEdges() { return edges; }
	public boolean isEmpty() { return nodes.isEmpty() && edges.isEmpty(); }

	public boolean sameTargets(AlignmentRecord other)
	{
		return nodes.equals(other.nodes) && edges.equals(other.edges);
	}

	/**
	 * @return a new record with the union of tokens, nodes and edges of both records
	 */
	public AlignmentRecord merge(AlignmentRecord other)
	{
		Preconditions.checkArgument(type == other.type, "Cannot merge " + type + " and " + other.type + " alignments");
		return new AlignmentRecord(type,
				ImmutableSortedSet.<Integer>naturalOrder().addAll(tokens).addAll(other.tokens).build(),
				ImmutableSortedSet.orderedBy(CanonicalIds.COMPARATOR).addAll(nodes).addAll(other.nodes).build(),
				ImmutableSortedSet.orderedBy(CanonicalIds.TRIPLE_COMPARATOR).addAll(edges).addAll(other.edges).build());
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AlignmentRecord that = (AlignmentRecord) o;
		return type == that.type && tokens.equals(that.tokens) && nodes.equals(that.nodes) && edges.equals(that.edges);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, tokens, nodes, edges);
	}

	@Override
	public String toString()
	{
		return type + " " + tokens + " -> " + nodes + (edges.isEmpty() ? "" : " " + edges);
	}
}
