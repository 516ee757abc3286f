package edu.upf.taln.amrreader.amr.io;

/**
 * An error found while reading one block of an AMR bank.
 */
public final class BlockError
{
	public enum Kind
	{
		Format, // the whole block is discarded
		AlignmentFormat, // one alignment is discarded
		Resolution, // one alignment reference is discarded
		Internal // unexpected failure, the whole block is discarded
	}

	private final Kind kind;
	private final int block;
	private final String amr_id;
	private final int line;
	private final String message;

	public BlockError(Kind kind, int block, String amr_id, int line, String message)
	{
		this.kind = kind;
		this.block = block;
		this.amr_id = amr_id;
		this.line = line;
		this.message = message;
	}

	public Kind getKind() { return kind; }
	public int getBlock() { return block; }
	public String getAMRId() { return amr_id; }
	public int getLine() { return line; }
	public String getMessage() { return message; }

	@Override
	public String toString()
	{
		return kind + " error in block " + block + " (" + amr_id + ", line " + line + "): " + message;
	}
}
