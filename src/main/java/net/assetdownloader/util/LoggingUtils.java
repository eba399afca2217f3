package net.assetdownloader.util;

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Lightweight helpers for consistent logging of warnings and errors with optional causes.
 */
public final class LoggingUtils {

    private static final int MAX_SUMMARY_LENGTH = 300;

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.error(message, withCause(args, throwable));
        }
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        if (logger != null && message != null) {
            logger.warn(message, withCause(args, throwable));
        }
    }

    /**
     * Produces a one-line description of a throwable for job messages: the simple class name
     * when there is no message, otherwise the message truncated to a readable length.
     */
    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        String singleLine = message.replaceAll("\\s+", " ").trim();
        return singleLine.length() > MAX_SUMMARY_LENGTH
            ? singleLine.substring(0, MAX_SUMMARY_LENGTH) + "..."
            : singleLine;
    }

    private static Object[] withCause(Object[] args, Throwable throwable) {
        Object[] base = args == null ? new Object[0] : args;
        if (throwable == null) {
            return base;
        }
        Object[] finalArgs = Arrays.copyOf(base, base.length + 1);
        finalArgs[finalArgs.length - 1] = throwable;
        return finalArgs;
    }
}
