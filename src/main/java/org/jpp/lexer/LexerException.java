package org.jpp.lexer;

import org.jpp.util.CompilationException;

public class LexerException extends CompilationException
{
	private final char offendingChar;

	public LexerException(char offendingChar, int line, int column)
	{
		super(Stage.LEXER, "Unexpected character: '" + offendingChar + "'", line, column);
		this.offendingChar = offendingChar;
	}

	public char getOffendingChar()
	{
		return offendingChar;
	}
}
