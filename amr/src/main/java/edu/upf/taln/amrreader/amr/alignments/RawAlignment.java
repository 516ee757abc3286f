package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import edu.upf.taln.amrreader.core.structures.AlignmentType;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * An alignment as read from the input, with references in the native addressing of its notation.
 */
public final class RawAlignment
{
	private final AlignmentType type;
	private final ImmutableSortedSet<Integer> tokens;
	private final ImmutableList<NativeRef> refs;
	private final String raw;

	public RawAlignment(AlignmentType type, Collection<Integer> tokens, List<NativeRef> refs, String raw)
	{
		Preconditions.checkArgument(!tokens.isEmpty(), "No tokens in " + raw);
		Preconditions.checkArgument(!refs.isEmpty(), "No references in " + raw);
		this.type = type;
		this.tokens = ImmutableSortedSet.copyOf(tokens);
		this.refs = ImmutableList.copyOf(refs);
		this.raw = raw;
	}

	public AlignmentType getType() { return type; }
	public ImmutableSortedSet<Integer> getTokens() { return tokens; }
	public List<NativeRef> getRefs() { return refs; }
	public String getRaw() { return raw; }

	public static void checkRange(Collection<Integer> tokens, OptionalInt sentence_length, String raw) throws AlignmentFormatError
	{
		for (int t : tokens)
		{
			if (t < 0)
				throw new AlignmentFormatError("Negative token offset " + t, raw);
			if (sentence_length.isPresent() && t >= sentence_length.getAsInt())
				throw new AlignmentFormatError("Token " + t + " out of range for a sentence of " +
						sentence_length.getAsInt() + " tokens", raw);
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RawAlignment that = (RawAlignment) o;
		return type == that.type && tokens.equals(that.tokens) && refs.equals(that.refs);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, tokens, refs);
	}

	@Override
	public String toString()
	{
		return type + " " + raw;
	}
}
