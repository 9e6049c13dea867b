package org.jpp.parser;

import org.jpp.lexer.Token;
import org.jpp.lexer.TokenType;
import org.jpp.util.CompilationException;

public class SyntaxException extends CompilationException
{
	private final TokenType expected; // Null for unexpected-state errors
	private final TokenType found;

	public SyntaxException(TokenType expected, Token found)
	{
		super(Stage.PARSER, "Expected " + expected + ", got " + found.type(), found.line(), found.column());
		this.expected = expected;
		this.found = found.type();
	}

	public SyntaxException(String message, Token at)
	{
		super(Stage.PARSER, message, at.line(), at.column());
		this.expected = null;
		this.found = at.type();
	}

	public TokenType getExpected()
	{
		return expected;
	}

	public TokenType getFound()
	{
		return found;
	}
}
