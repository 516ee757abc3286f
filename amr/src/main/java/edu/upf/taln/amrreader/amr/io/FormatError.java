package edu.upf.taln.amrreader.amr.io;

/**
 * Malformed AMR block: bad graph syntax, undefined or redefined variables, missing root, unreachable nodes.
 */
public class FormatError extends Exception
{
	private final int line; // absolute line number in the input, 0 if unknown

	public FormatError(String message)
	{
		this(message, 0);
	}

	public FormatError(String message, int line)
	{
		super(message);
		this.line = line;
	}

	/**
	 * Builds an error pointing at an offset of a multi-line text, with the offending line and a caret below it.
	 * @param first_line absolute line number of the first line of text
	 */
	public static FormatError at(String text, int offset, int first_line, String message)
	{
		String[] lines = text.split("\n", -1);
		int line_no = 0, position = 0;
		while (line_no < lines.length - 1 && position + lines[line_no].length() < offset)
		{
			position += lines[line_no].length() + 1;
			line_no += 1;
		}
		String line = lines[line_no];
		int absolute_line = first_line + line_no;
		StringBuilder b = new StringBuilder("Line " + absolute_line + ": " + message + "\n");
		b.append(line).append("\n");
		for (int i = position; i < offset && i - position < line.length(); ++i)
			b.append(" ");
		return new FormatError(b.append("^").toString(), absolute_line);
	}

	public int getLine()
	{
		return line;
	}
}
