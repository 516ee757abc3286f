package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.tuple.Triple;

import java.io.Serializable;
import java.util.Objects;

/**
 * A labelled edge between two nodes of the same AMR graph, referenced by their canonical ids.
 */
public final class Edge implements Serializable
{
	private final String id;
	private final String source;
	private final String role;
	private final String target;
	private final int slot; // 1-based position among the outgoing edges of source, in textual order
	private final boolean reentrant; // true if target was already identified through an earlier edge
	private final static long serialVersionUID = 1L;

	public Edge(String source, String role, String target, int slot, boolean reentrant)
	{
		Preconditions.checkNotNull(source);
		Preconditions.checkNotNull(target);
		Preconditions.checkArgument(role != null && role.startsWith(":"), "Invalid role " + role);
		Preconditions.checkArgument(slot > 0, "Slots are 1-based");
		this.id = CanonicalIds.edgeId(source, role, target);
		this.source = source;
		this.role = role;
		this.target = target;
		this.slot = slot;
		this.reentrant = reentrant;
	}

	public String getId() { return id; }
	public String getSource() { return source; }
	public String getRole() { return role; }
	public String getTarget() { return target; }
	public int getSlot() { return slot; }
	public boolean isReentrant() { return reentrant; }

	public Triple<String, String, String> getTriple()
	{
		return Triple.of(source, role, target);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Edge edge = (Edge) o;
		return slot == edge.slot && reentrant == edge.reentrant &&
				source.equals(edge.source) && role.equals(edge.role) && target.equals(edge.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(source, role, target, slot, reentrant);
	}

	@Override
	public String toString()
	{
		return source + " " + role + " " + target;
	}
}
