package edu.upf.taln.amrreader.amr.alignments;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import edu.upf.taln.amrreader.amr.io.FormatError;
import edu.upf.taln.amrreader.amr.io.IdentifierAssigner;
import edu.upf.taln.amrreader.amr.io.parse.AMRParser;
import edu.upf.taln.amrreader.core.structures.AMRGraph;
import edu.upf.taln.amrreader.core.structures.AlignmentRecord;
import edu.upf.taln.amrreader.core.structures.AlignmentType;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

public class AlignmentNormalizerTest
{
	private static final String chase = "(c / chase-01 :ARG0 (d / dog) :ARG1 (c2 / cat))";
	private static final String want = "(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-01 :ARG0 b))";

	private static AMRGraph graph(String text) throws FormatError
	{
		return IdentifierAssigner.assign("test", AMRParser.parse(text));
	}

	private static AlignmentNormalizer.Result ldc(AMRGraph graph, String line)
	{
		List<AlignmentFormatError> errors = new ArrayList<>();
		List<RawAlignment> raw = LDCAlignmentReader.read(line, OptionalInt.empty(), errors);
		Assert.assertTrue(errors.isEmpty());
		return AlignmentNormalizer.normalize(graph, raw);
	}

	private static AlignmentNormalizer.Result jamr(AMRGraph graph, String line)
	{
		List<AlignmentFormatError> errors = new ArrayList<>();
		List<RawAlignment> raw = new JAMRAlignmentReader().read(line, OptionalInt.empty(), errors);
		Assert.assertTrue(errors.isEmpty());
		return AlignmentNormalizer.normalize(graph, raw);
	}

	@Test
	public void testLDC() throws Exception
	{
		AlignmentNormalizer.Result result = ldc(graph(chase), "0-1.1 1-1 2-1.2");
		Assert.assertTrue(result.errors.isEmpty());
		List<AlignmentRecord> records = result.alignments.getRecords();
		Assert.assertEquals(3, records.size());
		Assert.assertEquals(ImmutableSet.of("1.1"), records.get(0).getNodes());
		Assert.assertEquals(ImmutableSet.of("1"), records.get(1).getNodes());
		Assert.assertEquals(ImmutableSet.of("1.2"), records.get(2).getNodes());
	}

	@Test
	public void testSameResultForAllNotations() throws Exception
	{
		AMRGraph graph = graph(chase);
		List<AlignmentRecord> ldc = ldc(graph, "0-1.1 1-1 2-1.2").alignments.getRecords();
		List<AlignmentRecord> jamr = jamr(graph, "0-1|0.0 1-2|0 2-3|0.1").alignments.getRecords();

		ISIAlignmentCollector collector = new ISIAlignmentCollector();
		AMRGraph isi_graph = IdentifierAssigner.assign("test",
				AMRParser.parse("(c / chase-01~e.1 :ARG0 (d / dog~e.0) :ARG1 (c2 / cat~e.2))", 1, collector));
		Assert.assertEquals(ImmutableList.copyOf(graph.getNodes()), ImmutableList.copyOf(isi_graph.getNodes()));
		List<AlignmentRecord> isi = AlignmentNormalizer.normalize(isi_graph, collector.getAlignments()).alignments.getRecords();

		Assert.assertEquals(3, ldc.size());
		for (int i = 0; i < ldc.size(); ++i)
		{
			Assert.assertEquals(ldc.get(i).getTokens(), jamr.get(i).getTokens());
			Assert.assertEquals(ldc.get(i).getTokens(), isi.get(i).getTokens());
			Assert.assertTrue(ldc.get(i).sameTargets(jamr.get(i)));
			Assert.assertTrue(ldc.get(i).sameTargets(isi.get(i)));
		}
	}

	@Test
	public void testReentrantPaths() throws Exception
	{
		AMRGraph graph = graph(want);

		// slot paths go through re-entrant edges
		AlignmentNormalizer.Result result = ldc(graph, "1-1.2.1 2-1.2.1.r");
		Assert.assertTrue(result.errors.isEmpty());
		Assert.assertEquals(ImmutableSet.of("1.1"), result.alignments.getRecords().get(0).getNodes());
		Assert.assertEquals(ImmutableSet.of(Triple.of("1.2", ":ARG0", "1.1")), result.alignments.getRecords().get(1).getEdges());

		// tree paths do not
		result = jamr(graph, "1-2|0.0 4-5|0.1.0");
		Assert.assertEquals(1, result.alignments.getRecords().size());
		Assert.assertEquals(1, result.errors.size());
		Assert.assertEquals("0.1.0", result.errors.get(0).getReference());
	}

	@Test
	public void testUnresolvedReferences() throws Exception
	{
		AMRGraph graph = graph(chase);
		AlignmentNormalizer.Result result = ldc(graph, "0-1.1+1.5 1-1.r 2-2.1");
		Assert.assertEquals(3, result.errors.size());
		Assert.assertEquals("1.5", result.errors.get(0).getReference());
		Assert.assertEquals("0-1.1+1.5", result.errors.get(0).getRecord());
		Assert.assertEquals("1.r", result.errors.get(1).getReference());

		// the resolved path of the first record is kept
		Assert.assertEquals(1, result.alignments.getRecords().size());
		Assert.assertEquals(ImmutableSet.of("1.1"), result.alignments.getRecords().get(0).getNodes());
	}

	@Test
	public void testDeclaredIds() throws Exception
	{
		AMRGraph graph = graph(chase);
		List<RawAlignment> raw = ImmutableList.of(
				new RawAlignment(AlignmentType.JAMR, ImmutableList.of(0), ImmutableList.of(NativeRef.nodeId("d")), "d 0-1"),
				new RawAlignment(AlignmentType.JAMR, ImmutableList.of(1), ImmutableList.of(NativeRef.edgeIds("c", ":ARG1", "c2")), "c :ARG1 c2 1-2"),
				new RawAlignment(AlignmentType.JAMR, ImmutableList.of(2), ImmutableList.of(NativeRef.edgeIds("c", ":ARG2", "c2")), "c :ARG2 c2 2-3"),
				new RawAlignment(AlignmentType.JAMR, ImmutableList.of(3), ImmutableList.of(NativeRef.nodeId("x")), "x 3-4"));
		AlignmentNormalizer.Result result = AlignmentNormalizer.normalize(graph, raw);
		Assert.assertEquals(2, result.alignments.getRecords().size());
		Assert.assertEquals(ImmutableSet.of("1.1"), result.alignments.getRecords().get(0).getNodes());
		Assert.assertEquals(ImmutableSet.of(Triple.of("1", ":ARG1", "1.2")), result.alignments.getRecords().get(1).getEdges());
		Assert.assertEquals(2, result.errors.size());
	}

	@Test
	public void testMerge() throws Exception
	{
		AMRGraph graph = graph(chase);
		// same token twice, then two tokens for the same node
		List<AlignmentRecord> records = ldc(graph, "1-1 1-1.1 3-1.2 4-1.2").alignments.getRecords();
		Assert.assertEquals(2, records.size());
		Assert.assertEquals(ImmutableSet.of(1), records.get(0).getTokens());
		Assert.assertEquals(ImmutableSet.of("1", "1.1"), records.get(0).getNodes());
		Assert.assertEquals(ImmutableSet.of(3, 4), records.get(1).getTokens());
	}

	@Test
	public void testMergeToFixpoint()
	{
		// merging {2}->1.2 and {3}->1.2 gives tokens {2,3}, which then merges with the other {2,3} record
		List<AlignmentRecord> records = AlignmentNormalizer.merge(ImmutableList.of(
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(2), ImmutableList.of("1.2"), ImmutableList.of()),
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(3), ImmutableList.of("1.2"), ImmutableList.of()),
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(2, 3), ImmutableList.of("1.1"), ImmutableList.of()),
				new AlignmentRecord(AlignmentType.ISI, ImmutableList.of(2), ImmutableList.of("1.2"), ImmutableList.of())));
		Assert.assertEquals(2, records.size());
		Assert.assertEquals(ImmutableSet.of("1.1", "1.2"), records.get(0).getNodes());
		Assert.assertEquals(AlignmentType.ISI, records.get(1).getType());
	}
}
