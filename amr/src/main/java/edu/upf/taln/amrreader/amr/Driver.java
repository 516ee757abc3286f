package edu.upf.taln.amrreader.amr;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import edu.upf.taln.amrreader.amr.io.AMRReadResult;
import edu.upf.taln.amrreader.amr.io.AMRReader;
import edu.upf.taln.amrreader.amr.io.BlockError;
import edu.upf.taln.amrreader.common.CMLCheckers;
import edu.upf.taln.amrreader.common.ReaderProperties;
import edu.upf.taln.amrreader.core.ReaderOptions;
import edu.upf.taln.amrreader.core.ReaderOptions.GraphSource;
import edu.upf.taln.amrreader.core.ReaderOptions.Notation;
import edu.upf.taln.amrreader.core.io.AlignmentsJSON;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

public class Driver
{
	private final static Logger log = LogManager.getLogger();
	private static final String read_command = "read";
	private static final String check_command = "check";

	private static class ReaderFlags
	{
		@Parameter(names = {"-i", "-input"}, description = "Path to input AMR bank", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		Path inputFile;
		@Parameter(names = {"-strict"}, description = "Discard graphs with alignment errors")
		boolean strict = false;
		@Parameter(names = {"-wiki"}, description = "Remove :wiki relations")
		boolean remove_wiki = false;
		@Parameter(names = {"-notation"}, description = "Notation of ::alignments lines: auto, ldc or jamr", arity = 1,
				converter = CMLCheckers.NotationConverter.class)
		Notation notation = null;
		@Parameter(names = {"-source"}, description = "Read graphs from: auto, parentheses or metadata", arity = 1,
				converter = CMLCheckers.GraphSourceConverter.class)
		GraphSource source = null;
		@Parameter(names = {"-inclusive"}, description = "JAMR token spans include their end offset")
		boolean inclusive = false;
		@Parameter(names = {"-threads"}, description = "Number of threads", arity = 1,
				validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		Integer threads = null;

		// flags override the properties file
		ReaderOptions getOptions(ReaderOptions defaults)
		{
			ReaderOptions options = new ReaderOptions(defaults);
			options.strict |= strict;
			options.remove_wiki |= remove_wiki;
			if (inclusive)
				options.jamr_end_exclusive = false;
			if (notation != null)
				options.notation = notation;
			if (source != null)
				options.graph_source = source;
			if (threads != null)
				options.threads = threads;
			return options;
		}
	}

	@Parameters(commandDescription = "Read an AMR bank and write its normalized alignments")
	private static class ReadCommand extends ReaderFlags
	{
		@Parameter(names = {"-o", "-output"}, description = "Path to output JSON alignments file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		Path outputFile = null;
	}

	@Parameters(commandDescription = "Check that all blocks of an AMR bank can be read")
	private static class CheckCommand extends ReaderFlags {}

	private static AMRReadResult read(Path input, ReaderOptions options)
	{
		log.info(options);
		return new AMRReader(options).read(input);
	}

	/**
	 * @return exit code: 0 on success, 1 if some block failed (check), 2 on usage or I/O errors
	 */
	public static int run(String[] args)
	{
		ReadCommand read = new ReadCommand();
		CheckCommand check = new CheckCommand();

		JCommander jc = new JCommander();
		jc.addCommand(read_command, read);
		jc.addCommand(check_command, check);
		try
		{
			jc.parse(args);
		}
		catch (ParameterException e)
		{
			log.error(e.getMessage());
			jc.usage();
			return 2;
		}

		ReaderOptions defaults = new ReaderProperties().getOptions();
		if (read_command.equals(jc.getParsedCommand()))
		{
			AMRReadResult result = read(read.inputFile, read.getOptions(defaults));
			if (read.outputFile != null)
			{
				try
				{
					AlignmentsJSON.write(result.getAlignmentsById(), read.outputFile);
				}
				catch (IOException e)
				{
					log.error("Cannot write alignments to " + read.outputFile + ": " + e);
					return 2;
				}
			}
			return 0;
		}
		else if (check_command.equals(jc.getParsedCommand()))
		{
			AMRReadResult result = read(check.inputFile, check.getOptions(defaults));
			for (BlockError.Kind kind : BlockError.Kind.values())
				log.info(kind + " errors: " + result.getErrors(kind).size());
			return result.getFailures().isEmpty() ? 0 : 1;
		}

		jc.usage();
		return 2;
	}

	public static void main(String[] args)
	{
		System.exit(run(args));
	}
}
