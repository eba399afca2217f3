package net.assetdownloader.exception;

/**
 * Remote fetch failed (connection error, timeout, non-2xx status).
 * RETRYABLE: Yes, every status and transport failure is attempted again until attempts run out
 */
public class AssetFetchException extends AssetDownloadException {

    /** Status reported when no HTTP response was received. */
    public static final int NO_STATUS = 0;

    private final int httpStatus;

    public AssetFetchException(String locator, String message, int httpStatus, Throwable cause) {
        super(message, locator, true, cause);
        this.httpStatus = httpStatus;
    }

    public AssetFetchException(String locator, String message, Throwable cause) {
        this(locator, message, NO_STATUS, cause);
    }

    /** Returns the HTTP status of the failed response, or {@link #NO_STATUS}. */
    public int getHttpStatus() {
        return httpStatus;
    }
}
