package net.assetdownloader.service.fetch;

import net.assetdownloader.exception.DownloadCancelledException;

import java.util.Arrays;

/**
 * Result of resolving one locator to bytes.
 *
 * @param success whether bytes were obtained
 * @param bytes resolved content; empty unless successful
 * @param contentType response content type, {@code local_file_processed} for local strategies
 * @param httpStatus HTTP status of the final attempt, 200 for local strategies, 0 when unknown
 * @param message human-readable outcome, the final error verbatim on failure
 * @param strategy strategy that produced the outcome
 * @param attempts HTTP attempts made; 0 when no request was sent
 * @param cancelled whether the run was cancelled while resolving
 * @param origin file path or URL the bytes came from; empty when nothing was resolved
 */
public record FetchOutcome(
        boolean success,
        byte[] bytes,
        String contentType,
        int httpStatus,
        String message,
        ResolutionStrategy strategy,
        int attempts,
        boolean cancelled,
        String origin) {

    public static final String LOCAL_CONTENT_TYPE = "local_file_processed";
    public static final int LOCAL_STATUS = 200;

    public FetchOutcome {
        bytes = bytes == null ? new byte[0] : Arrays.copyOf(bytes, bytes.length);
        contentType = contentType == null ? "" : contentType;
        origin = origin == null ? "" : origin;
    }

    public static FetchOutcome local(byte[] bytes, ResolutionStrategy strategy, String message, String origin) {
        return new FetchOutcome(true, bytes, LOCAL_CONTENT_TYPE, LOCAL_STATUS, message, strategy, 0, false, origin);
    }

    public static FetchOutcome http(byte[] bytes, String contentType, int httpStatus, int attempts, String url) {
        return new FetchOutcome(true, bytes, contentType, httpStatus, "Success", ResolutionStrategy.HTTP, attempts, false, url);
    }

    public static FetchOutcome failure(ResolutionStrategy strategy, int httpStatus, String contentType, String message, int attempts) {
        return new FetchOutcome(false, null, contentType, httpStatus, message, strategy, attempts, false, null);
    }

    public static FetchOutcome cancelled(ResolutionStrategy strategy, int attempts) {
        return new FetchOutcome(false, null, "", 0, DownloadCancelledException.MESSAGE, strategy, attempts, true, null);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int size() {
        return bytes.length;
    }
}
