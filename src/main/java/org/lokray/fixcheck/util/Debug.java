package org.lokray.fixcheck.util;

/**
 * Console logging for the checker. Report lines go through {@link #log}; diagnostics about the
 * checker itself go through the levelled methods.
 */
public class Debug {
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v / --verbose. Controls DEBUG logs only.
	public static boolean ENABLE_DEBUG = false;

	// Cleared by --no-color, e.g. when the report is piped into a file.
	public static boolean ENABLE_COLOR = true;

	public static void log(String log) {
		System.out.println(log);
	}

	public static void logInfo(String log) {
		System.out.println(colorize(ANSI_GREEN, log));
	}

	public static void logDebug(String log) {
		if (ENABLE_DEBUG) {
			System.out.println("[debug] " + log);
		}
	}

	public static void logWarning(String log) {
		System.out.println(colorize(ANSI_YELLOW, log));
	}

	public static void logError(String log) {
		System.err.println(colorize(ANSI_RED, log));
	}

	public static String colorize(String ansi, String text) {
		return ENABLE_COLOR ? ansi + text + ANSI_RESET : text;
	}
}
