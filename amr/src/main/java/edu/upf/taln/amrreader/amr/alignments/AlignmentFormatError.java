package edu.upf.taln.amrreader.amr.alignments;

/**
 * Malformed alignment in its native notation, e.g. a bad token span or an out-of-range token.
 * Only the offending record is discarded.
 */
public class AlignmentFormatError extends Exception
{
	private final String raw;

	public AlignmentFormatError(String message, String raw)
	{
		super(message + ": " + raw);
		this.raw = raw;
	}

	public String getRaw()
	{
		return raw;
	}
}
