package edu.upf.taln.amrreader.amr.io;

import com.google.common.base.Stopwatch;
import com.google.common.collect.Iterables;
import com.google.common.io.CharSource;
import com.google.common.io.Files;
import edu.upf.taln.amrreader.amr.alignments.*;
import edu.upf.taln.amrreader.amr.io.parse.AMRParser;
import edu.upf.taln.amrreader.amr.io.parse.ParsedGraph;
import edu.upf.taln.amrreader.core.ReaderOptions;
import edu.upf.taln.amrreader.core.ReaderOptions.GraphSource;
import edu.upf.taln.amrreader.core.ReaderOptions.Notation;
import edu.upf.taln.amrreader.core.structures.AMRAlignments;
import edu.upf.taln.amrreader.core.structures.AMRGraph;
import edu.upf.taln.amrreader.core.structures.AlignmentRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * Reads AMR banks into graphs with positional ids and normalized alignments.
 * Blocks are read independently: a block that cannot be read is reported and the next one is read.
 */
public class AMRReader
{
	private final ReaderOptions options;
	private final static Logger log = LogManager.getLogger();

	public AMRReader() { this(new ReaderOptions()); }

	public AMRReader(ReaderOptions options)
	{
		this.options = new ReaderOptions(options);
	}

	/**
	 * Lazily reads the blocks of a source, one result per block. The source is closed once all blocks are read;
	 * use {@link #stream(CharSource)} to stop earlier.
	 */
	public Iterable<BlockResult> iterate(CharSource source)
	{
		return Iterables.transform(new AMRTokenizer(source), this::readBlock);
	}

	/**
	 * Lazily reads the blocks of a source. Closing the stream closes the source.
	 */
	public Stream<BlockResult> stream(CharSource source)
	{
		return new AMRTokenizer(source).stream().map(this::readBlock);
	}

	public AMRReadResult read(Path file)
	{
		return read(Files.asCharSource(file.toFile(), StandardCharsets.UTF_8));
	}

	public AMRReadResult read(String amr_bank)
	{
		return read(CharSource.wrap(amr_bank));
	}

	public AMRReadResult read(CharSource source)
	{
		log.info("Reading AMR graphs");
		Stopwatch timer = Stopwatch.createStarted();

		List<BlockResult> results;
		if (options.threads > 1)
			results = readParallel(source);
		else
		{
			results = new ArrayList<>();
			iterate(source).forEach(results::add);
		}

		AMRReadResult result = new AMRReadResult(results);
		log.info(result.getGraphs().size() + " graphs read from " + result.getNumBlocks() + " blocks in " + timer.stop());
		if (result.hasErrors())
			log.warn(result.getErrors().size() + " errors, " + result.getFailures().size() + " blocks discarded");
		return result;
	}

	// Results are returned in input order
	private List<BlockResult> readParallel(CharSource source)
	{
		ExecutorService pool = Executors.newFixedThreadPool(options.threads);
		try
		{
			List<Future<BlockResult>> futures = new ArrayList<>();
			for (AMRBlock block : new AMRTokenizer(source))
				futures.add(pool.submit(() -> readBlock(block)));

			List<BlockResult> results = new ArrayList<>();
			for (Future<BlockResult> f : futures)
				results.add(f.get());
			return results;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while reading AMR graphs", e);
		}
		catch (ExecutionException e)
		{
			throw new IllegalStateException("Failed to read AMR graphs", e.getCause());
		}
		finally
		{
			pool.shutdownNow();
		}
	}

	public BlockResult readBlock(AMRBlock block)
	{
		String id = block.getId();
		List<BlockError> errors = new ArrayList<>();
		try
		{
			AMRTokenizer.check(block);
			OptionalInt length = block.getTokens().isEmpty() ? OptionalInt.empty() : OptionalInt.of(block.getTokens().size());

			List<RawAlignment> raw = new ArrayList<>();
			List<AlignmentFormatError> format_errors = new ArrayList<>();
			ParsedGraph parsed;
			if (fromMetadata(block))
			{
				AMRMetadataReader.Result r = new AMRMetadataReader(options.jamr_end_exclusive).read(block, length);
				parsed = r.graph;
				raw.addAll(r.alignments);
				format_errors.addAll(r.errors);
			}
			else
			{
				ISIAlignmentCollector isi = new ISIAlignmentCollector(length);
				parsed = AMRParser.parse(block.getGraphText(), block.getGraphLine(), isi);
				raw.addAll(isi.getAlignments());
				format_errors.addAll(isi.getErrors());
			}
			for (String line : block.getMetadata(AMRBlock.ALIGNMENTS))
				raw.addAll(readAlignments(line, length, format_errors));

			AMRGraph graph = IdentifierAssigner.assign(newGraph(block), parsed);
			AlignmentNormalizer.Result normalized = AlignmentNormalizer.normalize(graph, raw);
			AMRAlignments alignments = normalized.alignments;

			if (options.remove_wiki && parsed.removeWiki() > 0)
			{
				// slots are kept, so ids of the remaining nodes do not change
				graph = IdentifierAssigner.assign(newGraph(block), parsed);
				alignments = prune(graph, alignments);
			}

			format_errors.forEach(e -> errors.add(error(BlockError.Kind.AlignmentFormat, block, id, block.getFirstLine(), e)));
			normalized.errors.forEach(e -> errors.add(error(BlockError.Kind.Resolution, block, id, block.getFirstLine(), e)));
			if (!errors.isEmpty() && options.strict)
			{
				log.error("Discarding graph " + id + ": " + errors.size() + " alignment errors");
				return BlockResult.failure(block, errors);
			}
			return BlockResult.success(block, graph, alignments, errors);
		}
		catch (FormatError e)
		{
			int line = e.getLine() > 0 ? e.getLine() : block.getFirstLine();
			errors.add(error(BlockError.Kind.Format, block, id, line, e));
			return BlockResult.failure(block, errors);
		}
		catch (RuntimeException e)
		{
			errors.add(error(BlockError.Kind.Internal, block, id, block.getFirstLine(), e));
			return BlockResult.failure(block, errors);
		}
	}

	private boolean fromMetadata(AMRBlock block) throws FormatError
	{
		switch (options.graph_source)
		{
			case Metadata:
				if (!block.hasNodeDeclarations())
					throw new FormatError("No ::node declarations", block.getFirstLine());
				return true;
			case Parentheses:
				if (!block.hasGraphText())
					throw new FormatError("No graph text", block.getFirstLine());
				return false;
			default:
				return block.hasNodeDeclarations();
		}
	}

	private List<RawAlignment> readAlignments(String line, OptionalInt length, List<AlignmentFormatError> errors)
	{
		Notation notation = options.notation;
		if (notation == Notation.Auto)
			notation = line.contains("|") ? Notation.JAMR : Notation.LDC;

		if (notation == Notation.JAMR)
			return new JAMRAlignmentReader(options.jamr_end_exclusive).read(line, length, errors);
		return LDCAlignmentReader.read(line, length, errors);
	}

	private static AMRGraph.Builder newGraph(AMRBlock block)
	{
		return AMRGraph.builder(block.getId())
				.tokens(block.getTokens())
				.metadata(block.getMetadata())
				.comments(block.getComments());
	}

	// Drops references to nodes and edges removed from the graph
	private static AMRAlignments prune(AMRGraph graph, AMRAlignments alignments)
	{
		List<AlignmentRecord> kept = alignments.getRecords().stream()
				.map(r -> new AlignmentRecord(r.getType(), r.getTokens(),
						r.getNodes().stream().filter(graph::containsNode).collect(toList()),
						r.getEdges().stream().filter(graph::containsEdge).collect(toList())))
				.filter(r -> !r.isEmpty())
				.collect(toList());
		if (kept.size() < alignments.getRecords().size())
			log.debug("Graph " + graph.getId() + ": " + (alignments.getRecords().size() - kept.size()) +
					" alignments to :wiki nodes removed");
		return new AMRAlignments(graph, AlignmentNormalizer.merge(kept));
	}

	private static BlockError error(BlockError.Kind kind, AMRBlock block, String id, int line, Exception e)
	{
		BlockError error = new BlockError(kind, block.getNumber(), id, line, e.getMessage());
		if (kind == BlockError.Kind.Format || kind == BlockError.Kind.Internal)
			log.error("Failed to read graph " + block.getNumber() + " (" + id + "): " + e.getMessage());
		else
			log.warn("Graph " + id + ": " + e.getMessage());
		if (kind == BlockError.Kind.Internal)
			log.debug("Stack trace", e);
		return error;
	}
}
