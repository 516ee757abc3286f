package edu.upf.taln.amrreader.amr.io;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.amrreader.core.structures.AMRAlignments;
import edu.upf.taln.amrreader.core.structures.AMRGraph;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of reading one block: a graph and its alignments if the block could be read, and its errors.
 */
public final class BlockResult
{
	private final int block;
	private final String amr_id;
	private final AMRGraph graph;
	private final AMRAlignments alignments;
	private final ImmutableList<BlockError> errors;

	private BlockResult(int block, String amr_id, AMRGraph graph, AMRAlignments alignments, List<BlockError> errors)
	{
		this.block = block;
		this.amr_id = amr_id;
		this.graph = graph;
		this.alignments = alignments;
		this.errors = ImmutableList.copyOf(errors);
	}

	static BlockResult success(AMRBlock block, AMRGraph graph, AMRAlignments alignments, List<BlockError> errors)
	{
		return new BlockResult(block.getNumber(), graph.getId(), graph, alignments, errors);
	}

	static BlockResult failure(AMRBlock block, List<BlockError> errors)
	{
		return new BlockResult(block.getNumber(), block.getId(), null, null, errors);
	}

	public int getBlock() { return block; }
	public String getAMRId() { return amr_id; }
	public Optional<AMRGraph> getGraph() { return Optional.ofNullable(graph); }
	public Optional<AMRAlignments> getAlignments() { return Optional.ofNullable(alignments); }
	public List<BlockError> getErrors() { return errors; }
	public boolean isSuccess() { return graph != null; }

	@Override
	public String toString()
	{
		return "Block " + block + " (" + amr_id + "): " + (isSuccess() ? graph : "failed") +
				(errors.isEmpty() ? "" : ", " + errors.size() + " errors");
	}
}
