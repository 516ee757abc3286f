package edu.upf.taln.amrreader.core.structures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.Assert;
import org.junit.Test;

public class AlignmentRecordTest
{
	private static AMRGraph chase()
	{
		return AMRGraph.builder("chase")
				.addNode(Node.concept("1", "c", "chase-01"))
				.addNode(Node.concept("1.1", "d", "dog"))
				.addNode(Node.concept("1.2", "c2", "cat"))
				.addEdge(new Edge("1", ":ARG0", "1.1", 1, false))
				.addEdge(new Edge("1", ":ARG1", "1.2", 2, false))
				.tokens(ImmutableList.of("dog", "chases", "cat"))
				.build();
	}

	@Test
	public void testMerge()
	{
		AlignmentRecord r1 = new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(1), ImmutableList.of("1"), ImmutableList.of());
		AlignmentRecord r2 = new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(1),
				ImmutableList.of("1.1"), ImmutableList.of(Triple.of("1", ":ARG0", "1.1")));
		AlignmentRecord merged = r1.merge(r2);

		Assert.assertEquals(ImmutableSet.of(1), merged.getTokens());
		Assert.assertEquals(ImmutableList.of("1", "1.1"), merged.getNodes().asList());
		Assert.assertEquals(1, merged.getEdges().size());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMergeDifferentTypes()
	{
		AlignmentRecord r1 = new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(1), ImmutableList.of("1"), ImmutableList.of());
		AlignmentRecord r2 = new AlignmentRecord(AlignmentType.JAMR, ImmutableList.of(1), ImmutableList.of("1"), ImmutableList.of());
		r1.merge(r2);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeToken()
	{
		new AlignmentRecord(AlignmentType.ISI, ImmutableList.of(-1), ImmutableList.of("1"), ImmutableList.of());
	}

	@Test
	public void testAlignmentsLookup()
	{
		AMRGraph graph = chase();
		AMRAlignments alignments = new AMRAlignments(graph, ImmutableList.of(
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(2), ImmutableList.of("1.2"), ImmutableList.of()),
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(0), ImmutableList.of("1.1"), ImmutableList.of())));

		// sorted by first token
		Assert.assertEquals(ImmutableSet.of(0), alignments.getRecords().get(0).getTokens());
		Assert.assertEquals(1, alignments.getRecordsForNode("1.2").size());
		Assert.assertTrue(alignments.getRecordsForToken(1).isEmpty());
		Assert.assertTrue(alignments.getRecords(AlignmentType.JAMR).isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testAlignmentsToMissingNode()
	{
		new AMRAlignments(chase(), ImmutableList.of(
				new AlignmentRecord(AlignmentType.LDC, ImmutableList.of(0), ImmutableList.of("1.3"), ImmutableList.of())));
	}

	@Test
	public void testGraphLookups()
	{
		AMRGraph graph = chase();
		Assert.assertEquals("chase-01", graph.getRootNode().getConcept());
		Assert.assertEquals(2, graph.getOutgoingEdges("1").size());
		Assert.assertEquals("1.2", graph.getEdgeInSlot("1", 2).get().getTarget());
		Assert.assertFalse(graph.getEdgeInSlot("1", 3).isPresent());
		Assert.assertEquals("1_ARG1_1.2", graph.getEdge("1", ":ARG1", "1.2").get().getId());
		Assert.assertEquals(3, graph.getSentenceLength().getAsInt());
	}
}
