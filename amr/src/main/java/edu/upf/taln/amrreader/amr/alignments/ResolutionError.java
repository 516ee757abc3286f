package edu.upf.taln.amrreader.amr.alignments;

/**
 * An alignment refers to a position, id or edge that does not exist in its graph.
 */
public class ResolutionError extends Exception
{
	private final String reference; // the unresolved native reference, as written in the input
	private final String record; // the raw record it belongs to

	public ResolutionError(String message, String reference, String record)
	{
		super(message + ": " + reference + " in " + record);
		this.reference = reference;
		this.record = record;
	}

	public String getReference() { return reference; }
	public String getRecord() { return record; }
}
