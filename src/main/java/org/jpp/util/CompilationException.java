package org.jpp.util;

/**
 * Base class of every fatal error raised by the translation pipeline.
 * The first one thrown aborts the compilation; there is no recovery.
 */
public class CompilationException extends RuntimeException
{
	public enum Stage
	{
		LEXER("Lexer Error"),
		PARSER("Syntax Error"),
		CODEGEN("Codegen Error");

		private final String label;

		Stage(String label)
		{
			this.label = label;
		}

		public String getLabel()
		{
			return label;
		}
	}

	private final Stage stage;
	private final int line;   // 1-based, 0 if unknown
	private final int column; // 1-based, 0 if unknown

	public CompilationException(Stage stage, String message, int line, int column)
	{
		super(message);
		this.stage = stage;
		this.line = line;
		this.column = column;
	}

	public CompilationException(Stage stage, String message)
	{
		this(stage, message, 0, 0);
	}

	public Stage getStage()
	{
		return stage;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean hasPosition()
	{
		return line > 0;
	}
}
