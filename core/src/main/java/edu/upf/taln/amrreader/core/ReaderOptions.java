package edu.upf.taln.amrreader.core;

public class ReaderOptions
{
	public enum Notation {Auto, LDC, JAMR}
	public enum GraphSource {Auto, Parentheses, Metadata}

	public boolean strict = false; // if true, any alignment error makes the whole block fail
	public boolean remove_wiki = false; // drop :wiki edges and their constant targets before assigning ids
	public Notation notation = Notation.Auto; // notation of ::alignments lines. Auto -> JAMR if '|' is found, LDC otherwise
	public GraphSource graph_source = GraphSource.Auto; // Auto -> ::node metadata if present, parenthesized graph otherwise
	public boolean jamr_end_exclusive = true; // JAMR spans a-b cover tokens a..b-1
	public int threads = 1; // number of worker threads processing blocks. 1 -> sequential

	public ReaderOptions() {}

	public ReaderOptions(ReaderOptions o)
	{
		this.strict = o.strict;
		this.remove_wiki = o.remove_wiki;
		this.notation = o.notation;
		this.graph_source = o.graph_source;
		this.jamr_end_exclusive = o.jamr_end_exclusive;
		this.threads = o.threads;
	}

	@Override
	public String toString()
	{
		return "Options:" +
				"\n\tstrict = " + strict +
				"\n\tremove_wiki = " + remove_wiki +
				"\n\tnotation = " + notation +
				"\n\tgraph_source = " + graph_source +
				"\n\tjamr_end_exclusive = " + jamr_end_exclusive +
				"\n\tthreads = " + threads;
	}
}
