package edu.upf.taln.amrreader.amr.io;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.CharSource;
import edu.upf.taln.amrreader.amr.io.parse.AMRParserTest;
import edu.upf.taln.amrreader.core.ReaderOptions;
import edu.upf.taln.amrreader.core.structures.AMRAlignments;
import edu.upf.taln.amrreader.core.structures.AMRGraph;
import edu.upf.taln.amrreader.core.structures.AlignmentRecord;
import edu.upf.taln.amrreader.core.structures.Edge;
import edu.upf.taln.amrreader.core.structures.Node;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

public class AMRReaderTest
{
	private static final String chase = "(c / chase-01 :ARG0 (d / dog) :ARG1 (c2 / cat))";
	private static final String ohio = "# ::id ohio\n" +
			"# ::tok Ohio\n" +
			"# ::alignments 0-1.2.1 0-1.1\n" +
			"(c / city :wiki \"Q1\" :name (n / name :op1 \"Ohio\"))\n";

	private static Path resource(String name) throws Exception
	{
		return Paths.get(AMRReaderTest.class.getClassLoader().getResource(name).toURI());
	}

	private static Map<String, String> labels(AMRGraph graph)
	{
		Map<String, String> labels = new TreeMap<>();
		graph.getNodes().forEach(n -> labels.put(n.getId(), n.getLabel()));
		return labels;
	}

	private static List<String> edges(AMRGraph graph)
	{
		return graph.getEdges().stream()
				.map(Edge::getId)
				.sorted()
				.collect(toList());
	}

	// token -> aligned nodes, regardless of the notation the alignments were read from
	private static Map<Integer, ImmutableSet<String>> nodeAlignments(AMRAlignments alignments)
	{
		Map<Integer, ImmutableSet<String>> map = new TreeMap<>();
		for (AlignmentRecord r : alignments.getRecords())
			r.getTokens().forEach(t -> map.put(t, ImmutableSet.copyOf(r.getNodes())));
		return map;
	}

	@Test
	public void testBlocksAreReadIndependently() throws Exception
	{
		AMRReadResult result = new AMRReader().read(resource("broken.amr"));
		Assert.assertEquals(3, result.getNumBlocks());
		Assert.assertEquals(2, result.getGraphs().size());
		Assert.assertEquals("first", result.getGraphs().get(0).getId());
		Assert.assertEquals("third", result.getGraphs().get(1).getId());

		Assert.assertEquals(1, result.getErrors().size());
		BlockError error = result.getErrors().get(0);
		Assert.assertEquals(BlockError.Kind.Format, error.getKind());
		Assert.assertEquals(2, error.getBlock());
		Assert.assertEquals("second", error.getAMRId());
		Assert.assertTrue(error.getLine() >= 4);
		Assert.assertEquals(1, result.getFailures().size());
		Assert.assertFalse(result.getResults().get(1).isSuccess());
		Assert.assertFalse(result.getResults().get(1).getGraph().isPresent());
	}

	@Test
	public void testReadingIsRepeatable() throws Exception
	{
		AMRReader reader = new AMRReader();
		AMRReadResult r1 = reader.read(resource("sample.amr"));
		AMRReadResult r2 = reader.read(resource("sample.amr"));
		Assert.assertEquals(r1.getGraphs(), r2.getGraphs());
		Assert.assertEquals(r1.getAlignments(), r2.getAlignments());
	}

	@Test
	public void testAllFormatsConverge() throws Exception
	{
		AMRReadResult result = new AMRReader().read(resource("sample.amr"));
		Assert.assertFalse(result.toString(), result.hasErrors());
		Assert.assertEquals(4, result.getGraphs().size());

		AMRGraph ldc = result.getGraphs().get(0);
		Map<String, String> expected_labels = labels(ldc);
		Assert.assertEquals("chase-01", expected_labels.get("1"));
		Assert.assertEquals("dog", expected_labels.get("1.1"));
		Assert.assertEquals("cat", expected_labels.get("1.2"));
		List<String> expected_edges = edges(ldc);
		Assert.assertEquals(List.of("1_ARG0_1.1", "1_ARG1_1.2"), expected_edges);

		Map<Integer, ImmutableSet<String>> expected_alignments = nodeAlignments(result.getAlignments().get(0));
		Assert.assertEquals(ImmutableSet.of("1.1"), expected_alignments.get(1));
		Assert.assertEquals(ImmutableSet.of("1"), expected_alignments.get(2));
		Assert.assertEquals(ImmutableSet.of("1.2"), expected_alignments.get(4));

		for (int i = 1; i < 4; ++i)
		{
			AMRGraph graph = result.getGraphs().get(i);
			Assert.assertEquals(graph.getId(), expected_labels, labels(graph));
			Assert.assertEquals(graph.getId(), expected_edges, edges(graph));
			Assert.assertEquals(graph.getId(), expected_alignments, nodeAlignments(result.getAlignments().get(i)));
		}
	}

	@Test
	public void testMetadataAndParenthesesGiveSameIds() throws Exception
	{
		AMRReadResult result = new AMRReader().read(resource("sample.amr"));
		AMRGraph from_text = result.getGraphs().get(0);
		AMRGraph from_metadata = result.getGraphs().get(3);
		Assert.assertEquals("meta.1", from_metadata.getId());
		Assert.assertEquals(from_text.getNodeIds(), from_metadata.getNodeIds());
		for (Node n : from_metadata.getNodes())
			Assert.assertNull(n.getVariable());
		Assert.assertEquals("1.1", from_metadata.resolveDeclaredId("0.0").orElse(null));
		Assert.assertEquals(3, from_metadata.getDeclaredIds().size());
		Assert.assertEquals("1.2", from_text.resolveDeclaredId("c2").orElse(null));

		String variables = "# ::id vars\n" +
				"# ::node\tc\tchase-01\n" +
				"# ::node\td\tdog\n" +
				"# ::node\tc2\tcat\n" +
				"# ::root\tc\tchase-01\n" +
				"# ::edge\tchase-01\tARG0\tdog\tc\td\n" +
				"# ::edge\tchase-01\tARG1\tcat\tc\tc2\n";
		AMRGraph from_variables = new AMRReader().read(variables).getGraphs().get(0);
		AMRGraph parenthesized = new AMRReader().read(chase).getGraphs().get(0);
		Assert.assertEquals(ImmutableList.copyOf(parenthesized.getNodes()), ImmutableList.copyOf(from_variables.getNodes()));
		Assert.assertEquals(parenthesized.getEdges(), from_variables.getEdges());
		Assert.assertEquals(parenthesized.getDeclaredIds(), from_variables.getDeclaredIds());
	}

	@Test
	public void testEdgeAlignments() throws Exception
	{
		String bank = "# ::tok The dog chases the cat\n# ::alignments 1-1.1 2-1.1.r 2-1\n" + chase + "\n";
		AMRReadResult result = new AMRReader().read(bank);
		Assert.assertFalse(result.hasErrors());
		AMRAlignments alignments = result.getAlignments().get(0);
		List<AlignmentRecord> records = alignments.getRecordsForEdge(Triple.of("1", ":ARG0", "1.1"));
		Assert.assertEquals(1, records.size());
		Assert.assertEquals(ImmutableSet.of(2), records.get(0).getTokens());
		Assert.assertEquals(ImmutableSet.of("1"), records.get(0).getNodes());
		Assert.assertEquals("1", alignments.getGraphId());
	}

	@Test
	public void testUnresolvedAlignmentsAndStrictMode() throws Exception
	{
		String bank = "# ::id bad\n# ::tok The dog chases the cat\n# ::alignments 1-1.1 0-1.5\n" + chase + "\n";

		AMRReadResult lenient = new AMRReader().read(bank);
		Assert.assertEquals(1, lenient.getGraphs().size());
		Assert.assertEquals(1, lenient.getErrors(BlockError.Kind.Resolution).size());
		Assert.assertEquals(1, lenient.getAlignments().get(0).getRecords().size());
		Assert.assertTrue(lenient.getFailures().isEmpty());

		ReaderOptions options = new ReaderOptions();
		options.strict = true;
		AMRReadResult strict = new AMRReader(options).read(bank);
		Assert.assertTrue(strict.getGraphs().isEmpty());
		Assert.assertEquals(1, strict.getFailures().size());
		Assert.assertEquals(1, strict.getErrors(BlockError.Kind.Resolution).size());
	}

	@Test
	public void testWikiRemoval() throws Exception
	{
		AMRReadResult kept = new AMRReader().read(ohio);
		AMRGraph graph = kept.getGraphs().get(0);
		Assert.assertEquals(4, graph.getNodes().size());
		Assert.assertEquals("\"Q1\"", graph.getNode("1.1").map(Node::getLabel).orElse(null));
		Assert.assertEquals(ImmutableSet.of("1.1", "1.2.1"), kept.getAlignments().get(0).getRecords().get(0).getNodes());

		ReaderOptions options = new ReaderOptions();
		options.remove_wiki = true;
		AMRReadResult removed = new AMRReader(options).read(ohio);
		Assert.assertFalse(removed.hasErrors());
		graph = removed.getGraphs().get(0);
		Assert.assertEquals(3, graph.getNodes().size());
		Assert.assertFalse(graph.containsNode("1.1"));
		Assert.assertEquals("name", graph.getNode("1.2").map(Node::getLabel).orElse(null));
		Assert.assertEquals("\"Ohio\"", graph.getNode("1.2.1").map(Node::getLabel).orElse(null));

		List<AlignmentRecord> records = removed.getAlignments().get(0).getRecords();
		Assert.assertEquals(1, records.size());
		Assert.assertEquals(ImmutableSet.of("1.2.1"), records.get(0).getNodes());
	}

	@Test
	public void testParallelReading() throws Exception
	{
		AMRReadResult sequential = new AMRReader().read(resource("sample.amr"));
		ReaderOptions options = new ReaderOptions();
		options.threads = 4;
		AMRReadResult parallel = new AMRReader(options).read(resource("sample.amr"));
		Assert.assertEquals(sequential.getGraphs(), parallel.getGraphs());
		Assert.assertEquals(sequential.getAlignments(), parallel.getAlignments());
		Assert.assertEquals(sequential.getAlignmentsById().keySet(), parallel.getAlignmentsById().keySet());
	}

	@Test
	public void testForcedNotation() throws Exception
	{
		ReaderOptions options = new ReaderOptions();
		options.notation = ReaderOptions.Notation.LDC;
		AMRReadResult result = new AMRReader(options).read(resource("sample.amr"));
		Assert.assertEquals(4, result.getGraphs().size());
		List<BlockError> errors = result.getErrors(BlockError.Kind.AlignmentFormat);
		Assert.assertEquals(3, errors.size());
		errors.forEach(e -> Assert.assertEquals("jamr.1", e.getAMRId()));
	}

	@Test
	public void testForcedGraphSource() throws Exception
	{
		ReaderOptions options = new ReaderOptions();
		options.graph_source = ReaderOptions.GraphSource.Metadata;
		AMRReadResult metadata = new AMRReader(options).read(resource("sample.amr"));
		Assert.assertEquals(1, metadata.getGraphs().size());
		Assert.assertEquals("meta.1", metadata.getGraphs().get(0).getId());
		Assert.assertEquals(3, metadata.getErrors(BlockError.Kind.Format).size());

		options.graph_source = ReaderOptions.GraphSource.Parentheses;
		AMRReadResult parentheses = new AMRReader(options).read(resource("sample.amr"));
		Assert.assertEquals(3, parentheses.getGraphs().size());
		Assert.assertEquals(1, parentheses.getFailures().size());
		Assert.assertEquals("meta.1", parentheses.getFailures().get(0).getAMRId());
	}

	@Test
	public void testLazyIteration()
	{
		int n = 0;
		for (BlockResult r : new AMRReader().iterate(CharSource.wrap("(a / a)\n\n(b / b)\n\n(c / c")))
		{
			++n;
			Assert.assertEquals(n, r.getBlock());
			Assert.assertEquals(n < 3, r.isSuccess());
		}
		Assert.assertEquals(3, n);
	}

	@Test
	public void testLargeSpanOnlyDropsItsRecord()
	{
		String bank = "# ::id a\n# ::tok The dog\n# ::alignments 0-2000000000|0 1-2|0\n(d / dog)\n\n# ::id b\n(c / cat)\n";
		AMRReadResult result = new AMRReader().read(bank);
		Assert.assertEquals(2, result.getGraphs().size());
		Assert.assertEquals(1, result.getErrors().size());
		Assert.assertEquals(BlockError.Kind.AlignmentFormat, result.getErrors().get(0).getKind());
		Assert.assertEquals(1, result.getAlignments().get(0).getRecords().size());
	}

	@Test
	public void testDeeplyNestedBlockIsSkipped()
	{
		String bank = "# ::id first\n(d / dog)\n\n# ::id deep\n" + AMRParserTest.nested(20000) + "\n\n# ::id last\n(c / cat)\n";
		AMRReadResult result = new AMRReader().read(bank);
		Assert.assertEquals(3, result.getNumBlocks());
		Assert.assertEquals(List.of("first", "last"), result.getGraphs().stream().map(AMRGraph::getId).collect(toList()));
		Assert.assertEquals(1, result.getErrors(BlockError.Kind.Format).size());
		Assert.assertEquals("deep", result.getErrors().get(0).getAMRId());
		Assert.assertTrue(result.getErrors().get(0).getMessage().contains("nested deeper"));
	}

	@Test
	public void testRepeatedIdsKeepAllAlignments()
	{
		String bank = "# ::id x\n# ::alignments 0-1\n(d / dog)\n\n" +
				"# ::id x\n# ::alignments 0-1\n(c / cat)\n\n" +
				"# ::alignments 0-1\n(b / bird)\n\n" +
				"# ::id 3\n# ::alignments 0-1\n(m / mouse)\n";
		AMRReadResult result = new AMRReader().read(bank);
		Assert.assertEquals(4, result.getGraphs().size());
		Map<String, List<AlignmentRecord>> by_id = result.getAlignmentsById();
		Assert.assertEquals(List.of("x", "x#2", "3", "3#4"), List.copyOf(by_id.keySet()));
		by_id.values().forEach(records -> Assert.assertEquals(1, records.size()));
	}

	@Test
	public void testCollapsedDuplicateEdgeSlot()
	{
		String bank = "# ::tok boy boys\n# ::alignments 0-1.1 1-1.2\n(a / and :op1 (b / boy) :op1 b)\n";
		AMRReadResult result = new AMRReader().read(bank);
		Assert.assertEquals(1, result.getGraphs().get(0).getEdges().size());
		List<BlockError> errors = result.getErrors(BlockError.Kind.Resolution);
		Assert.assertEquals(1, errors.size());
		Assert.assertTrue(errors.get(0).getMessage(), errors.get(0).getMessage().contains("slot 2"));
		List<AlignmentRecord> records = result.getAlignments().get(0).getRecords();
		Assert.assertEquals(1, records.size());
		Assert.assertEquals(ImmutableSet.of("1.1"), records.get(0).getNodes());
	}

	@Test
	public void testStreamStopsEarly()
	{
		try (Stream<BlockResult> results = new AMRReader().stream(CharSource.wrap("(a / a)\n\n(b / b\n\n(c / c)\n")))
		{
			Assert.assertEquals(List.of(true, false), results.limit(2).map(BlockResult::isSuccess).collect(toList()));
		}
	}
}
