package net.assetdownloader.util;

import jakarta.annotation.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether fetched content is an image and sniffs its format.
 *
 * <p>Checks run in order: URL extension, then {@code Content-Type}, then magic bytes.
 * Several asset hosts send wrong or missing content types, so the URL is trusted first.</p>
 */
public final class ImageContentDetector {

    private static final Pattern IMAGE_URL_EXTENSION =
        Pattern.compile("\\.(jpg|jpeg|png|gif|bmp|webp)(?:\\?.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_FILE_EXTENSION =
        Pattern.compile("\\.(jpg|jpeg|png|gif|bmp|webp)$", Pattern.CASE_INSENSITIVE);
    private static final int MIN_SNIFF_LENGTH = 12;

    public static final String FORMAT_PNG = "png";
    public static final String FORMAT_JPEG = "jpeg";
    public static final String FORMAT_WEBP = "webp";
    public static final String FORMAT_GIF = "gif";
    public static final String FORMAT_UNKNOWN = "unknown";

    private ImageContentDetector() {
    }

    public static boolean isImageContent(@Nullable String locator, @Nullable String contentType, @Nullable byte[] bytes) {
        if (hasImageExtension(locator)) {
            return true;
        }
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            return true;
        }
        return !FORMAT_UNKNOWN.equals(detectFormat(bytes));
    }

    /** Matches URL-style locators, tolerating a trailing query string. */
    public static boolean hasImageExtension(@Nullable String locator) {
        return locator != null && IMAGE_URL_EXTENSION.matcher(locator).find();
    }

    /** Matches plain file names. */
    public static boolean isImageFileName(@Nullable String fileName) {
        return fileName != null && IMAGE_FILE_EXTENSION.matcher(fileName).find();
    }

    /**
     * Sniffs PNG, JPEG, WebP and GIF signatures. Buffers shorter than 12 bytes are never recognized.
     */
    public static String detectFormat(@Nullable byte[] bytes) {
        if (bytes == null || bytes.length < MIN_SNIFF_LENGTH) {
            return FORMAT_UNKNOWN;
        }
        if (u(bytes[0]) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
            return FORMAT_PNG;
        }
        if (u(bytes[0]) == 0xFF && u(bytes[1]) == 0xD8) {
            return FORMAT_JPEG;
        }
        if (bytes[0] == 'R' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == 'F'
                && bytes[8] == 'W' && bytes[9] == 'E' && bytes[10] == 'B' && bytes[11] == 'P') {
            return FORMAT_WEBP;
        }
        if (bytes[0] == 'G' && bytes[1] == 'I' && bytes[2] == 'F' && bytes[3] == '8'
                && (bytes[4] == '7' || bytes[4] == '9') && bytes[5] == 'a') {
            return FORMAT_GIF;
        }
        return FORMAT_UNKNOWN;
    }

    private static int u(byte b) {
        return b & 0xFF;
    }
}
