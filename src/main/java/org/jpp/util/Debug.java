package org.jpp.util;

/**
 * Console output of the jppc driver. Errors go to stderr, everything else to stdout.
 */
public class Debug
{
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v/--verbose; only logDebug looks at it
	public static boolean ENABLE_DEBUG = false;

	public static void logInfo(String message)
	{
		System.out.println(colored(ANSI_GREEN, message));
	}

	/**
	 * Pipeline tracing: token and statement counts, vectorization decisions.
	 */
	public static void logDebug(String message)
	{
		if (!ENABLE_DEBUG)
		{
			return;
		}
		System.out.println("[debug] " + message);
	}

	public static void logWarning(String message)
	{
		System.out.println(colored(ANSI_YELLOW, "warning: " + message));
	}

	public static void logError(String message)
	{
		System.err.println(colored(ANSI_RED, message));
	}

	private static String colored(String color, String message)
	{
		return color + message + ANSI_RESET;
	}
}
