package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.tuple.Triple;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a node or edge in the addressing of an alignment notation: positional paths for the
 * ::alignments notations and ISI markers, declared ids for JAMR ::node and ::edge spans.
 */
public final class NativeRef
{
	public enum Kind
	{
		NODE_PATH, // a node, by positional path
		EDGE_PATH, // the edge taken by the last step of a positional path
		NODE_ID, // a node, by declared id
		EDGE_IDS // an edge, by declared ids of its source and target and its role
	}

	private final Kind kind;
	private final ImmutableList<Integer> path;
	private final String id;
	private final Triple<String, String, String> edge;
	private final String raw;

	private NativeRef(Kind kind, List<Integer> path, String id, Triple<String, String, String> edge, String raw)
	{
		this.kind = kind;
		this.path = path != null ? ImmutableList.copyOf(path) : ImmutableList.of();
		this.id = id;
		this.edge = edge;
		this.raw = raw;
	}

	public static NativeRef nodePath(List<Integer> path, String raw) { return new NativeRef(Kind.NODE_PATH, path, null, null, raw); }
	public static NativeRef edgePath(List<Integer> path, String raw) { return new NativeRef(Kind.EDGE_PATH, path, null, null, raw); }
	public static NativeRef nodeId(String id) { return new NativeRef(Kind.NODE_ID, null, id, null, id); }

	public static NativeRef edgeIds(String source_id, String role, String target_id)
	{
		return new NativeRef(Kind.EDGE_IDS, null, null, Triple.of(source_id, role, target_id),
				source_id + " " + role + " " + target_id);
	}

	public Kind getKind() { return kind; }
	public List<Integer> getPath() { return path; }
	public String getId() { return id; }
	public Triple<String, String, String> getEdge() { return edge; }
	public String getRaw() { return raw; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NativeRef ref = (NativeRef) o;
		return kind == ref.kind && path.equals(ref.path) && Objects.equals(id, ref.id) && Objects.equals(edge, ref.edge);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, path, id, edge);
	}

	@Override
	public String toString()
	{
		return raw;
	}
}
