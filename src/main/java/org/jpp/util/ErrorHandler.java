package org.jpp.util;

public class ErrorHandler
{
	private boolean hasErrors = false;

	public void report(CompilationException e)
	{
		String err;
		if (e.hasPosition())
		{
			err = String.format("[%s] line %d:%d - %s", e.getStage().getLabel(), e.getLine(), e.getColumn(), e.getMessage());
		}
		else
		{
			err = String.format("[%s] %s", e.getStage().getLabel(), e.getMessage());
		}
		Debug.logError(err);
		hasErrors = true;
	}

	public void report(String msg)
	{
		Debug.logError(msg);
		hasErrors = true;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
