package edu.upf.taln.amrreader.core.structures;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Positional identifiers shared by nodes, edges and alignments.
 * The root is "1" and the n-th child (1-based, textual order of roles) of node X is "X.n".
 */
public final class CanonicalIds
{
	public static final String ROOT = "1";
	public static final char SEPARATOR = '.';
	private static final Splitter splitter = Splitter.on(SEPARATOR);

	public static final Comparator<String> COMPARATOR = CanonicalIds::compare;
	public static final Comparator<Triple<String, String, String>> TRIPLE_COMPARATOR =
			Comparator.comparing((Triple<String, String, String> t) -> t.getLeft(), COMPARATOR)
					.thenComparing(Triple::getMiddle)
					.thenComparing(Triple::getRight, COMPARATOR);

	private CanonicalIds() {}

	public static String child(String parent_id, int slot)
	{
		return parent_id + SEPARATOR + slot;
	}

	/**
	 * Edge ids only depend on the (source, role, target) triple, e.g. "1_ARG0_1.1" for (1, :ARG0, 1.1).
	 */
	public static String edgeId(String source_id, String role, String target_id)
	{
		return source_id + "_" + StringUtils.removeStart(role, ":") + "_" + target_id;
	}

	public static int depth(String id)
	{
		return StringUtils.countMatches(id, SEPARATOR) + 1;
	}

	/**
	 * Parses a dotted sequence of non-negative integers such as "1.2.1".
	 * @throws IllegalArgumentException if some component is not a number
	 */
	public static List<Integer> parsePath(String path)
	{
		if (StringUtils.isBlank(path))
			throw new IllegalArgumentException("Empty path");

		ImmutableList.Builder<Integer> components = ImmutableList.builder();
		for (String component : splitter.split(path))
		{
			if (component.isEmpty() || !StringUtils.isNumeric(component))
				throw new IllegalArgumentException("Not a dotted positional path: " + path);
			components.add(Integer.parseInt(component));
		}
		return components.build();
	}

	public static String formatPath(List<Integer> path)
	{
		StringBuilder b = new StringBuilder();
		for (Integer i : path)
		{
			if (b.length() > 0)
				b.append(SEPARATOR);
			b.append(i);
		}
		return b.toString();
	}

	// Numeric component-wise comparison, so that 1.2 < 1.10
	private static int compare(String id1, String id2)
	{
		Iterator<String> i1 = splitter.split(id1).iterator();
		Iterator<String> i2 = splitter.split(id2).iterator();
		while (i1.hasNext() && i2.hasNext())
		{
			String c1 = i1.next();
			String c2 = i2.next();
			int c;
			if (StringUtils.isNumeric(c1) && StringUtils.isNumeric(c2) && !c1.isEmpty() && !c2.isEmpty())
				c = Long.compare(Long.parseLong(c1), Long.parseLong(c2));
			else
				c = c1.compareTo(c2);
			if (c != 0)
				return c;
		}
		return Boolean.compare(i1.hasNext(), i2.hasNext());
	}
}
