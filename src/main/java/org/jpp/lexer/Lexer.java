package org.jpp.lexer;

import org.jpp.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Turns source text into a finite token list terminated by {@link TokenType#EOF}.
 * <p>
 * Whitespace and comments are dropped. Newlines are kept: they terminate statements.
 * The first character that matches no pattern aborts with a {@link LexerException}.
 */
public class Lexer
{
	private static final TokenType[] PATTERN_ORDER = TokenType.values();

	private final String source;
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public Lexer(String source)
	{
		this.source = source;
	}

	public static List<Token> tokenize(String source)
	{
		return new Lexer(source).tokenize();
	}

	public List<Token> tokenize()
	{
		List<Token> tokens = new ArrayList<>();

		while (pos < source.length())
		{
			Token token = nextToken();

			if (token.is(TokenType.MISMATCH))
			{
				throw new LexerException(token.lexeme().charAt(0), token.line(), token.column());
			}
			if (!token.type().isDiscarded())
			{
				tokens.add(token);
			}
			advance(token.lexeme());
		}

		tokens.add(new Token(TokenType.EOF, "", line, column));
		Debug.logDebug("Lexer: produced " + tokens.size() + " tokens.");
		return tokens;
	}

	private Token nextToken()
	{
		for (TokenType type : PATTERN_ORDER)
		{
			if (type.getPattern() == null)
			{
				continue;
			}
			Matcher m = type.getPattern().matcher(source);
			m.region(pos, source.length());
			if (m.lookingAt())
			{
				return new Token(type, m.group(), line, column);
			}
		}
		// Unicode line separators are not matched by MISMATCH's '.'
		return new Token(TokenType.MISMATCH, source.substring(pos, pos + 1), line, column);
	}

	private void advance(String lexeme)
	{
		for (int i = 0; i < lexeme.length(); i++)
		{
			if (lexeme.charAt(i) == '\n')
			{
				line++;
				column = 1;
			}
			else
			{
				column++;
			}
		}
		pos += lexeme.length();
	}
}
