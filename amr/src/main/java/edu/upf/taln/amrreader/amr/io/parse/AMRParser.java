package edu.upf.taln.amrreader.amr.io.parse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import edu.upf.taln.amrreader.amr.alignments.ISIAlignmentCollector;
import edu.upf.taln.amrreader.amr.io.FormatError;
import edu.upf.taln.amrreader.amr.io.parse.AMRLexer.Token;
import edu.upf.taln.amrreader.amr.io.parse.AMRLexer.Type;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for parenthesized AMR graphs:
 * <pre>
 * graph    := node EOF
 * node     := '(' variable '/' concept relation* ')'
 * relation := role (node | string | constant | variable)
 * </pre>
 * Variables must be defined before they are referenced. Nodes nested deeper than {@link #MAX_DEPTH} are rejected.
 */
public class AMRParser
{
	public static final int MAX_DEPTH = 1000;
	private static final Pattern number = Pattern.compile("[+-]?\\d[\\d.,/]*");
	private static final ImmutableSet<String> symbolic_constants = ImmutableSet.of("+", "-", "imperative",
			"interrogative", "expressive");

	private final String text;
	private final int first_line;
	private final AMRLexer lexer;
	private final ISIAlignmentCollector isi;
	private final ParsedGraph graph = new ParsedGraph();
	private final Map<String, Integer> variables = new HashMap<>();
	private Token current;

	private AMRParser(String text, int first_line, ISIAlignmentCollector isi)
	{
		this.text = text;
		this.first_line = first_line;
		this.lexer = new AMRLexer(text, first_line);
		this.isi = isi;
	}

	public static ParsedGraph parse(String text) throws FormatError
	{
		return parse(text, 1, new ISIAlignmentCollector());
	}

	/**
	 * @param first_line line number of the first line of text, used in error messages
	 * @param isi receives the inline alignment markers found in the text
	 */
	public static ParsedGraph parse(String text, int first_line, ISIAlignmentCollector isi) throws FormatError
	{
		AMRParser parser = new AMRParser(text, first_line, isi);
		parser.advance();
		if (parser.current.type == Type.EOF)
			throw new FormatError("Empty graph", first_line);
		parser.expect(Type.LPAREN, "expected '(' at the start of the graph");
		int root = parser.parseNode(ImmutableList.of(1));
		if (parser.current.type != Type.EOF)
			throw parser.error("trailing text after top-level node");
		parser.graph.setRoot(root);
		return parser.graph;
	}

	/**
	 * Quoted strings, numbers, polarity and mode values are constants.
	 */
	public static boolean isConstant(String label)
	{
		return (label.length() > 1 && label.startsWith("\"") && label.endsWith("\"")) ||
				symbolic_constants.contains(label) || number.matcher(label).matches();
	}

	// called after '(' has been consumed
	private int parseNode(List<Integer> path) throws FormatError
	{
		if (path.size() > MAX_DEPTH)
			throw error("graph is nested deeper than " + MAX_DEPTH + " levels");
		Token variable = current;
		if (variable.type != Type.SYMBOL)
			throw error("expected a variable");
		if (variables.containsKey(variable.text))
			throw error("variable " + variable.text + " is defined more than once");
		advance();
		expect(Type.SLASH, "missing /concept for variable " + variable.text);
		Token concept = current;
		if (concept.type != Type.SYMBOL && concept.type != Type.STRING)
			throw error("missing concept for variable " + variable.text);
		advance();

		int index = graph.addConcept(variable.text, variable.text, concept.text);
		variables.put(variable.text, index);
		if (variable.marker != null)
			isi.node(path, variable.marker);
		if (concept.marker != null)
			isi.node(path, concept.marker);

		int slot = 0;
		while (current.type == Type.ROLE)
		{
			Token role = current;
			if (role.text.length() < 2)
				throw error("empty role");
			List<Integer> child_path = ImmutableList.<Integer>builder().addAll(path).add(++slot).build();
			if (role.marker != null)
				isi.edge(child_path, role.marker);
			advance();

			Token target = current;
			int target_index;
			switch (target.type)
			{
				case LPAREN:
					advance();
					target_index = parseNode(child_path);
					break;
				case STRING:
					target_index = graph.addConstant(null, target.text);
					advance();
					break;
				case SYMBOL:
					if (variables.containsKey(target.text))
						target_index = variables.get(target.text);
					else if (isConstant(target.text))
						target_index = graph.addConstant(null, target.text);
					else
						throw error("undefined variable " + target.text);
					advance();
					break;
				default:
					throw error("role " + role.text + " has no target");
			}
			if (target.type != Type.LPAREN && target.marker != null)
				isi.node(child_path, target.marker);

			graph.addEdge(index, role.text, target_index, slot);
		}

		expect(Type.RPAREN, "expected ')' or a role");
		return index;
	}

	private void advance() throws FormatError
	{
		current = lexer.next();
	}

	private void expect(Type type, String message) throws FormatError
	{
		if (current.type != type)
			throw error(message);
		advance();
	}

	private FormatError error(String message)
	{
		return FormatError.at(text, current.offset, first_line, message + ", found " + current);
	}
}
