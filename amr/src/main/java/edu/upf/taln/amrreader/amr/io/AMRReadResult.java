package edu.upf.taln.amrreader.amr.io;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.amrreader.core.structures.AMRAlignments;
import edu.upf.taln.amrreader.core.structures.AMRGraph;
import edu.upf.taln.amrreader.core.structures.AlignmentRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Graphs, alignments and errors read from an AMR bank, in input order.
 */
public final class AMRReadResult
{
	public static final String KEY_SEPARATOR = "#";
	private final ImmutableList<BlockResult> results;
	private final static Logger log = LogManager.getLogger();

	public AMRReadResult(List<BlockResult> results)
	{
		this.results = ImmutableList.copyOf(results);
	}

	public List<BlockResult> getResults() { return results; }
	public int getNumBlocks() { return results.size(); }

	public List<AMRGraph> getGraphs()
	{
		return results.stream()
				.map(BlockResult::getGraph)
				.flatMap(Optional::stream)
				.collect(toList());
	}

	public List<AMRAlignments> getAlignments()
	{
		return results.stream()
				.map(BlockResult::getAlignments)
				.flatMap(Optional::stream)
				.collect(toList());
	}

	/**
	 * AMR id -> alignment records, for serialization. A graph whose id was already taken by an earlier block is
	 * keyed as id#block.
	 */
	public Map<String, List<AlignmentRecord>> getAlignmentsById()
	{
		Map<String, List<AlignmentRecord>> map = new LinkedHashMap<>();
		for (BlockResult r : results)
		{
			if (!r.getAlignments().isPresent())
				continue;
			AMRAlignments alignments = r.getAlignments().get();
			String key = alignments.getGraphId();
			if (map.containsKey(key))
			{
				String unique = key + KEY_SEPARATOR + r.getBlock();
				for (int i = 2; map.containsKey(unique); ++i)
					unique = key + KEY_SEPARATOR + r.getBlock() + KEY_SEPARATOR + i;
				log.warn("Graph id " + key + " of block " + r.getBlock() + " is already used, alignments stored as " + unique);
				key = unique;
			}
			map.put(key, alignments.getRecords());
		}
		return map;
	}

	public List<BlockError> getErrors()
	{
		return results.stream()
				.flatMap(r -> r.getErrors().stream())
				.collect(toList());
	}

	public List<BlockError> getErrors(BlockError.Kind kind)
	{
		return getErrors().stream()
				.filter(e -> e.getKind() == kind)
				.collect(toList());
	}

	public List<BlockResult> getFailures()
	{
		return results.stream()
				.filter(r -> !r.isSuccess())
				.collect(toList());
	}

	public boolean hasErrors()
	{
		return results.stream().anyMatch(r -> !r.getErrors().isEmpty());
	}

	@Override
	public String toString()
	{
		return results.size() + " blocks, " + getGraphs().size() + " graphs, " + getErrors().size() + " errors";
	}
}
