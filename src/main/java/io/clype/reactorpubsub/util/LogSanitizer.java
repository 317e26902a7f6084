package io.clype.reactorpubsub.util;

import java.util.regex.Pattern;

/**
 * Sanitizes strings for safe logging by removing all control characters.
 * Prevents log injection attacks including ANSI escape sequences.
 */
public final class LogSanitizer {

    private static final Pattern LOG_SANITIZE_PATTERN = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private LogSanitizer() {
    }

    public static String sanitize(String input) {
        if (input == null) {
            return "null";
        }
        return LOG_SANITIZE_PATTERN.matcher(input).replaceAll("_");
    }
}
