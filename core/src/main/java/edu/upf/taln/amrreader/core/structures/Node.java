package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Preconditions;

import java.io.Serializable;
import java.util.Objects;

/**
 * A node of an AMR graph. Concept nodes have a variable (unless read from metadata declarations) and a concept.
 * Constants and attributes (quoted strings, numbers, polarity...) have no concept and keep their literal as value.
 */
public final class Node implements Serializable
{
	private final String id;
	private final String variable;
	private final String concept;
	private final String value;
	private final static long serialVersionUID = 1L;

	private Node(String id, String variable, String concept, String value)
	{
		Preconditions.checkNotNull(id);
		this.id = id;
		this.variable = variable;
		this.concept = concept;
		this.value = value;
	}

	public static Node concept(String id, String variable, String concept)
	{
		Preconditions.checkNotNull(concept, "Concept nodes need a concept");
		return new Node(id, variable, concept, null);
	}

	public static Node constant(String id, String value)
	{
		Preconditions.checkNotNull(value, "Constant nodes need a value");
		return new Node(id, null, null, value);
	}

	public String getId() { return id; }
	public String getVariable() { return variable; }
	public String getConcept() { return concept; }
	public String getValue() { return value; }
	public boolean isConstant() { return concept == null; }

	// Concept for concept nodes, literal for constants
	public String getLabel() { return isConstant() ? value : concept; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Node node = (Node) o;
		return id.equals(node.id) &&
				Objects.equals(variable, node.variable) &&
				Objects.equals(concept, node.concept) &&
				Objects.equals(value, node.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, variable, concept, value);
	}

	@Override
	public String toString()
	{
		if (isConstant())
			return id + " " + value;
		return id + " (" + (variable != null ? variable + " / " : "") + concept + ")";
	}
}
