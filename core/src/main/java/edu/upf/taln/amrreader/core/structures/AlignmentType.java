package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Enums;
import com.google.common.base.Optional;

/**
 * Notations in which token-to-graph alignments are annotated in AMR corpora.
 */
public enum AlignmentType
{
	LDC("ldc"), // # ::alignments 0-1.1 1-1 ... 1-indexed paths over all role slots
	JAMR("jamr"), // # ::alignments 0-1|0.0 ... token spans and 0-indexed tree paths
	ISI("isi"); // inline ~e.N markers

	private final String name;

	AlignmentType(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	public static Optional<AlignmentType> fromName(String name)
	{
		if (name == null)
			return Optional.absent();
		return Enums.getIfPresent(AlignmentType.class, name.trim().toUpperCase());
	}

	@Override
	public String toString()
	{
		return name;
	}
}
