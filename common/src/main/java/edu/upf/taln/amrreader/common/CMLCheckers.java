package edu.upf.taln.amrreader.common;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import edu.upf.taln.amrreader.core.ReaderOptions.GraphSource;
import edu.upf.taln.amrreader.core.ReaderOptions.Notation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

public class CMLCheckers
{
	// Case-insensitive lookup of enum constants, e.g. "jamr" -> JAMR, "metadata" -> Metadata
	public static <E extends Enum<E>> Optional<E> getEnum(Class<E> type, String value)
	{
		if (value == null)
			return Optional.absent();
		String v = value.trim();
		Optional<E> e = Enums.getIfPresent(type, v);
		if (e.isPresent())
			return e;
		return Optional.fromJavaUtil(Arrays.stream(type.getEnumConstants())
				.filter(c -> c.name().equalsIgnoreCase(v))
				.findFirst());
	}

	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class NotationConverter implements IStringConverter<Notation>
	{
		@Override
		public Notation convert(String value)
		{
			return getEnum(Notation.class, value)
					.toJavaUtil()
					.orElseThrow(() -> new ParameterException("Unknown alignments notation " + value));
		}
	}

	public static class GraphSourceConverter implements IStringConverter<GraphSource>
	{
		@Override
		public GraphSource convert(String value)
		{
			return getEnum(GraphSource.class, value)
					.toJavaUtil()
					.orElseThrow(() -> new ParameterException("Unknown graph source " + value));
		}
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || path.getParent() == null || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class IntegerGreaterThanZero implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				if (Integer.parseInt(value) < 1)
					throw new ParameterException("Value of " + name + " must be greater than 0: " + value);
			}
			catch (NumberFormatException e)
			{
				throw new ParameterException("Value of " + name + " is not an integer: " + value);
			}
		}
	}
}
