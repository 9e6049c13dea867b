package org.jpp.util;

/**
 * Thrown when an external tool (javac, java) ran but exited with a non-zero status.
 */
public class ToolchainException extends RuntimeException
{
	private final int exitCode;

	public ToolchainException(String message, int exitCode)
	{
		super(message);
		this.exitCode = exitCode;
	}

	public int getExitCode()
	{
		return exitCode;
	}
}
