package org.jpp.lexer;

import java.util.regex.Pattern;

/**
 * Token kinds in the order the lexer tries them. The first pattern that matches at the
 * current position wins, so two-character operators come before their one-character
 * prefixes and FLOAT_LITERAL before INT_LITERAL.
 */
public enum TokenType
{
	COMMENT("#[^\\n]*"),
	FLOAT_LITERAL("\\d+\\.\\d+"),
	INT_LITERAL("\\d+"),
	STRING_LITERAL("\"(?:[^\"\\\\]|\\\\.)*\""),
	ID("[A-Za-z_][A-Za-z0-9_]*"),
	OP("\\?\\.|==|!=|<=|>=|[+\\-*/%<>]=?|="),
	LBRACK("\\["),
	RBRACK("\\]"),
	LPAREN("\\("),
	RPAREN("\\)"),
	COLON(":"),
	COMMA(","),
	SEMICOLON(";"),
	NEWLINE("\\n"),
	SKIP("[ \\t\\r]+"),
	MISMATCH("."),
	EOF(null);

	private final Pattern pattern;

	TokenType(String regex)
	{
		this.pattern = regex == null ? null : Pattern.compile(regex);
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	/**
	 * Kinds that never reach the parser.
	 */
	public boolean isDiscarded()
	{
		return this == COMMENT || this == SKIP;
	}
}
