package net.assetdownloader.util;

import java.util.regex.Pattern;

/**
 * Turns part numbers into filesystem-safe file stems.
 */
public final class FilenameSanitizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");

    private FilenameSanitizer() {
    }

    /**
     * Collapses whitespace runs into {@code _}, then strips every character outside {@code [A-Za-z0-9_]}.
     * Idempotent; {@code null} yields an empty string.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String underscored = WHITESPACE_RUN.matcher(raw.trim()).replaceAll("_");
        return DISALLOWED.matcher(underscored).replaceAll("");
    }
}
