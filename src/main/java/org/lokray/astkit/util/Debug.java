package org.lokray.astkit.util;

import java.io.PrintStream;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Controls DEBUG logs, switched on by --verbose.
	public static boolean ENABLE_DEBUG = false;

	private static PrintStream out = System.out;
	private static PrintStream err = System.err;
	private static boolean colors = System.getenv("NO_COLOR") == null;

	/**
	 * Sends regular and error output to other streams, without colors. Used to capture what the checker
	 * prints.
	 */
	public static void redirect(PrintStream newOut, PrintStream newErr)
	{
		out = newOut;
		err = newErr;
		colors = false;
	}

	/**
	 * Back to the console.
	 */
	public static void reset()
	{
		out = System.out;
		err = System.err;
		colors = System.getenv("NO_COLOR") == null;
		ENABLE_DEBUG = false;
	}

	public static void log(String log)
	{
		out.println(log);
	}

	public static void logInfo(String log)
	{
		out.println(color(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		out.println(color(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		err.println(color(ANSI_RED, log));
	}

	private static String color(String ansi, String log)
	{
		return colors ? ansi + log + ANSI_RESET : log;
	}
}
