package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.base.Splitter;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import edu.upf.taln.amrreader.core.structures.CanonicalIds;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Reads JAMR ::alignments lines, e.g. "0-1|0.0 1-2|0 3-5|0.1+0.1.0".
 * Token spans are "start-end", a single offset or a comma-separated list. Paths start at the root (0) and only
 * count the children of a node that are not re-entrant, from 0.
 */
public class JAMRAlignmentReader
{
	public static final boolean DEFAULT_END_EXCLUSIVE = true; // "2-4" covers tokens 2 and 3
	public static final int MAX_SPAN_WIDTH = 1000; // for ranges in blocks without ::tok
	private static final Splitter path_splitter = Splitter.on('+');
	private final boolean end_exclusive;

	public JAMRAlignmentReader()
	{
		this(DEFAULT_END_EXCLUSIVE);
	}

	public JAMRAlignmentReader(boolean end_exclusive)
	{
		this.end_exclusive = end_exclusive;
	}

	/**
	 * @param errors receives one error per malformed item, other items are still read
	 */
	public List<RawAlignment> read(String line, OptionalInt sentence_length, List<AlignmentFormatError> errors)
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

	RawAlignment readItem(String item, OptionalInt sentence_length) throws AlignmentFormatError
	{
		int bar = item.indexOf('|');
		if (bar <= 0 || bar == item.length() - 1)
			throw new AlignmentFormatError("Malformed JAMR alignment", item);

		List<Integer> tokens = readSpan(item.substring(0, bar), sentence_length, item);
		RawAlignment.checkRange(tokens, sentence_length, item);

		List<NativeRef> refs = new ArrayList<>();
		for (String path : path_splitter.split(item.substring(bar + 1)))
		{
			try
			{
				refs.add(NativeRef.nodePath(CanonicalIds.parsePath(path), path));
			}
			catch (IllegalArgumentException e)
			{
				throw new AlignmentFormatError("Malformed path " + path, item);
			}
		}
		return new RawAlignment(AlignmentType.JAMR, tokens, refs, item);
	}

	public List<Integer> readSpan(String span, String raw) throws AlignmentFormatError
	{
		return readSpan(span, OptionalInt.empty(), raw);
	}

	/**
	 * Reads "a-b" ranges, "a,b,c" lists and single offsets. Ranges are checked against the sentence length, or
	 * against {@link #MAX_SPAN_WIDTH} if it is unknown, before their tokens are listed.
	 * @param raw record the span belongs to, for error messages
	 */
	public List<Integer> readSpan(String span, OptionalInt sentence_length, String raw) throws AlignmentFormatError
	{
		List<Integer> tokens = new ArrayList<>();
		try
		{
			if (span.contains("-"))
			{
				String[] limits = span.split("-", -1);
				if (limits.length != 2)
					throw new AlignmentFormatError("Malformed token span " + span, raw);
				long start = Long.parseLong(limits[0].trim());
				long end = Long.parseLong(limits[1].trim());
				if (!end_exclusive)
					++end;
				if (end <= start)
					throw new AlignmentFormatError("Empty token span " + span, raw);
				if (end > Integer.MAX_VALUE)
					throw new AlignmentFormatError("Token offset too large in span " + span, raw);
				if (sentence_length.isPresent() && end > sentence_length.getAsInt())
					throw new AlignmentFormatError("Token span " + span + " out of range for a sentence of " +
							sentence_length.getAsInt() + " tokens", raw);
				if (!sentence_length.isPresent() && end - start > MAX_SPAN_WIDTH)
					throw new AlignmentFormatError("Token span " + span + " is wider than " + MAX_SPAN_WIDTH + " tokens", raw);
				for (long i = start; i < end; ++i)
					tokens.add((int) i);
			}
			else
			{
				for (String t : span.split(","))
					tokens.add(Integer.parseInt(t.trim()));
			}
		}
		catch (NumberFormatException e)
		{
			throw new AlignmentFormatError("Malformed token span " + span, raw);
		}
		return tokens;
	}
}
