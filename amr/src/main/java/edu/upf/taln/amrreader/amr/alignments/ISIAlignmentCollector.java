package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import edu.upf.taln.amrreader.core.structures.CanonicalIds;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects inline ~e.N[,M...] markers while a parenthesized graph is parsed.
 * Markers are recorded against the positional path (1-based, counting every role slot) of the item they are
 * attached to: the node itself for concepts, constants and variable references, the edge for roles.
 */
public class ISIAlignmentCollector
{
	private static final Pattern marker_pattern = Pattern.compile("e\\.(\\d+(?:,\\d+)*)");
	private final OptionalInt sentence_length;
	private final List<RawAlignment> alignments = new ArrayList<>();
	private final List<AlignmentFormatError> errors = new ArrayList<>();

	public ISIAlignmentCollector()
	{
		this(OptionalInt.empty());
	}

	public ISIAlignmentCollector(OptionalInt sentence_length)
	{
		this.sentence_length = sentence_length;
	}

	// marker is the text following '~', e.g. "e.2,3"
	public void node(List<Integer> path, String marker)
	{
		String raw = "~" + marker + "@" + CanonicalIds.formatPath(path);
		add(marker, NativeRef.nodePath(path, raw), raw);
	}

	public void edge(List<Integer> path, String marker)
	{
		String raw = "~" + marker + "@" + CanonicalIds.formatPath(path) + ".r";
		add(marker, NativeRef.edgePath(path, raw), raw);
	}

	private void add(String marker, NativeRef ref, String raw)
	{
		try
		{
			Matcher m = marker_pattern.matcher(marker);
			if (!m.matches())
				throw new AlignmentFormatError("Malformed ISI alignment marker", raw);

			List<Integer> tokens = new ArrayList<>();
			for (String t : m.group(1).split(","))
				tokens.add(Integer.parseInt(t));
			RawAlignment.checkRange(tokens, sentence_length, raw);
			alignments.add(new RawAlignment(AlignmentType.ISI, tokens, ImmutableList.of(ref), raw));
		}
		catch (NumberFormatException e)
		{
			errors.add(new AlignmentFormatError("Token offset too large", raw));
		}
		catch (AlignmentFormatError e)
		{
			errors.add(e);
		}
	}

	public List<RawAlignment> getAlignments() { return alignments; }
	public List<AlignmentFormatError> getErrors() { return errors; }
}
