package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import edu.upf.taln.amrreader.core.structures.CanonicalIds;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads LDC ::alignments lines, e.g. "0-1.1 1-1 2-1.2+1.2.1 3-1.1.r".
 * Each item aligns one token with one or more '+'-joined positional paths. Paths start at the root (1) and count
 * every role slot of a node, constants and re-entrant references included. A path ending in ".r" refers to the
 * edge taken by its last step.
 * <p>
 * A repeated (source, role, target) triple keeps a single edge, in the slot of its first occurrence. The slots of
 * the dropped repetitions stay empty, so a path through one of them, such as 1.2 in "(a / and :op1 (b / boy)
 * :op1 b)", is reported as a resolution error.
 */
public class LDCAlignmentReader
{
	public static final String ROLE_SUFFIX = "r";
	private static final String role_suffix = CanonicalIds.SEPARATOR + ROLE_SUFFIX;
	private static final Pattern item_pattern = Pattern.compile("(\\d+)-(\\S+)");
	private static final Splitter path_splitter = Splitter.on('+');

	/**
	 * @param errors receives one error per malformed item, other items are still read
	 */
	public static List<RawAlignment> read(String line, OptionalInt sentence_length, List<AlignmentFormatError> errors)
	{
		List<RawAlignment> alignments = new ArrayList<>();
		String value = StringUtils.substringBefore(line, "::");
		for (String item : StringUtils.split(value))
		{
			try
			{
				alignments.add(readItem(item, sentence_length));
			}
			catch (AlignmentFormatError e)
			{
				errors.add(e);
			}
		}
		return alignments;
	}

	static RawAlignment readItem(String item, OptionalInt sentence_length) throws AlignmentFormatError
	{
		Matcher m = item_pattern.matcher(item);
		if (!m.matches())
			throw new AlignmentFormatError("Malformed LDC alignment", item);

		int token;
		try
		{
			token = Integer.parseInt(m.group(1));
		}
		catch (NumberFormatException e)
		{
			throw new AlignmentFormatError("Token offset too large", item);
		}
		RawAlignment.checkRange(ImmutableList.of(token), sentence_length, item);

		List<NativeRef> refs = new ArrayList<>();
		for (String path : path_splitter.split(m.group(2)))
		{
			try
			{
				if (path.endsWith(role_suffix))
					refs.add(NativeRef.edgePath(CanonicalIds.parsePath(StringUtils.removeEnd(path, role_suffix)), path));
				else
					refs.add(NativeRef.nodePath(CanonicalIds.parsePath(path), path));
			}
			catch (IllegalArgumentException e)
			{
				throw new AlignmentFormatError("Malformed path " + path, item);
			}
		}
		return new RawAlignment(AlignmentType.LDC, ImmutableList.of(token), refs, item);
	}
}
