package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Triple;

import java.io.Serializable;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static java.util.stream.Collectors.toList;

/**
 * Normalized alignments of one AMR graph. All node and edge ids refer to the attached graph.
 */
public final class AMRAlignments implements Serializable
{
	private final String graph_id;
	private final ImmutableList<AlignmentRecord> records;
	private final static long serialVersionUID = 1L;

	public static final Comparator<AlignmentRecord> RECORD_ORDER =
			Comparator.comparing((AlignmentRecord r) -> r.getTokens().first())
					.thenComparing(AlignmentRecord::getType)
					.thenComparing(AlignmentRecord::toString);

	public AMRAlignments(AMRGraph graph, Collection<AlignmentRecord> records)
	{
		for (AlignmentRecord r : records)
		{
			r.getNodes().forEach(n -> Preconditions.checkArgument(graph.containsNode(n),
					"Alignment " + r + " refers to node " + n + " missing from graph " + graph.getId()));
			r.getEdges().forEach(e -> Preconditions.checkArgument(graph.containsEdge(e),
					"Alignment " + r + " refers to edge " + e + " missing from graph " + graph.getId()));
		}
		this.graph_id = graph.getId();
		this.records = records.stream()
				.sorted(RECORD_ORDER)
				.collect(ImmutableList.toImmutableList());
	}

	public static AMRAlignments empty(AMRGraph graph)
	{
		return new AMRAlignments(graph, ImmutableList.of());
	}

	public String getGraphId() { return graph_id; }
	public List<AlignmentRecord> getRecords() { return records; }
	public boolean isEmpty() { return records.isEmpty(); }

	public List<AlignmentRecord> getRecords(AlignmentType type)
	{
		return records.stream()
				.filter(r -> r.getType() == type)
				.collect(toList());
	}

	public List<AlignmentRecord> getRecordsForToken(int token)
	{
		return records.stream()
				.filter(r -> r.getTokens().contains(token))
				.collect(toList());
	}

	public List<AlignmentRecord> getRecordsForNode(String node_id)
	{
		return records.stream()
				.filter(r -> r.getNodes().contains(node_id))
				.collect(toList());
	}

	public List<AlignmentRecord> getRecordsForEdge(Triple<String, String, String> edge)
	{
		return records.stream()
				.filter(r -> r.getEdges().contains(edge))
				.collect(toList());
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AMRAlignments that = (AMRAlignments) o;
		return graph_id.equals(that.graph_id) && records.equals(that.records);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(graph_id, records);
	}

	@Override
	public String toString()
	{
		return graph_id + " " + records;
	}
}
