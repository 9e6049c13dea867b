package org.jpp.lexer;

/**
 * A single lexeme. Line and column are 1-based.
 */
public record Token(TokenType type, String lexeme, int line, int column)
{
	public boolean is(TokenType kind)
	{
		return type == kind;
	}

	public boolean is(TokenType kind, String text)
	{
		return type == kind && lexeme.equals(text);
	}

	/**
	 * True for an identifier spelled like the given keyword.
	 */
	public boolean isKeyword(String keyword)
	{
		return is(TokenType.ID, keyword);
	}

	@Override
	public String toString()
	{
		return "Token(" + type + ", '" + (type == TokenType.NEWLINE ? "\\n" : lexeme) + "')";
	}
}
