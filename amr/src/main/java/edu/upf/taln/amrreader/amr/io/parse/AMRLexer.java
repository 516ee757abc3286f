package edu.upf.taln.amrreader.amr.io.parse;

import edu.upf.taln.amrreader.amr.io.FormatError;

/**
 * Splits parenthesized AMR text into tokens. Alignment markers (~e.N) are detached from the token they follow.
 * A '/' only separates tokens right after an opening parenthesis, so that constants such as 1/2 stay whole.
 */
class AMRLexer
{
	enum Type {LPAREN, RPAREN, SLASH, ROLE, STRING, SYMBOL, EOF}

	static final class Token
	{
		final Type type;
		final String text;
		final String marker; // text after '~', or null
		final int offset;

		Token(Type type, String text, String marker, int offset)
		{
			this.type = type;
			this.text = text;
			this.marker = marker;
			this.offset = offset;
		}

		@Override
		public String toString()
		{
			return type == Type.EOF ? "end of graph" : "'" + text + "'";
		}
	}

	private final String text;
	private final int first_line;
	private int pos = 0;
	private boolean variable_position = false; // next symbol follows '('

	AMRLexer(String text, int first_line)
	{
		this.text = text;
		this.first_line = first_line;
	}

	Token next() throws FormatError
	{
		while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
			++pos;
		if (pos == text.length())
			return new Token(Type.EOF, "", null, pos);

		int start = pos;
		char c = text.charAt(pos);
		boolean after_paren = variable_position;
		variable_position = false;
		switch (c)
		{
			case '(':
				++pos;
				variable_position = true;
				return new Token(Type.LPAREN, "(", null, start);
			case ')':
				++pos;
				return new Token(Type.RPAREN, ")", null, start);
			case '/':
				++pos;
				return new Token(Type.SLASH, "/", null, start);
			case '"':
				return readString(start);
			case ':':
				return readSymbol(Type.ROLE, start, false);
			default:
				return readSymbol(Type.SYMBOL, start, after_paren);
		}
	}

	private Token readString(int start) throws FormatError
	{
		++pos;
		while (pos < text.length() && text.charAt(pos) != '"')
		{
			if (text.charAt(pos) == '\\')
				++pos;
			++pos;
		}
		if (pos >= text.length())
			throw FormatError.at(text, start, first_line, "unterminated quoted string");
		++pos;
		String value = text.substring(start, pos);

		String marker = null;
		if (pos < text.length() && text.charAt(pos) == '~')
		{
			int marker_start = ++pos;
			while (pos < text.length() && !isDelimiter(text.charAt(pos), false))
				++pos;
			marker = text.substring(marker_start, pos);
		}
		return new Token(Type.STRING, value, marker, start);
	}

	private Token readSymbol(Type type, int start, boolean stop_at_slash)
	{
		while (pos < text.length() && !isDelimiter(text.charAt(pos), stop_at_slash))
			++pos;
		String symbol = text.substring(start, pos);
		int tilde = symbol.indexOf('~');
		if (tilde > 0)
			return new Token(type, symbol.substring(0, tilde), symbol.substring(tilde + 1), start);
		return new Token(type, symbol, null, start);
	}

	private static boolean isDelimiter(char c, boolean slash)
	{
		return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || (slash && c == '/');
	}
}
