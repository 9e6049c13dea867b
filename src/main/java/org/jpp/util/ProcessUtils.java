package org.jpp.util;

import java.io.IOException;

public class ProcessUtils
{
	/**
	 * Runs the command with the child's output attached to ours.
	 *
	 * @throws IOException        if the executable cannot be started (usually: not on PATH).
	 * @throws ToolchainException if the command exits with a non-zero status.
	 */
	public static void executeCommand(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		Process process = pb.inheritIO().start();

		int exitCode = process.waitFor();
		if (exitCode != 0)
		{
			throw new ToolchainException("Command failed with exit code " + exitCode + " for: " + String.join(" ", pb.command()), exitCode);
		}
	}
}
