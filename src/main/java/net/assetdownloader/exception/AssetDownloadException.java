package net.assetdownloader.exception;

import jakarta.annotation.Nullable;

/**
 * Base exception for failures while acquiring or writing a downloadable asset.
 *
 * <p>Subclasses declare whether a retry of the same operation can succeed. Per-job
 * failures are converted into failed job results at the job boundary; only setup
 * failures escape a run.</p>
 */
public class AssetDownloadException extends RuntimeException {

    @Nullable
    private final String locator;
    private final boolean retryable;

    public AssetDownloadException(String message, @Nullable String locator, boolean retryable, @Nullable Throwable cause) {
        super(message, cause);
        this.locator = locator;
        this.retryable = retryable;
    }

    /** Returns the URL or path that was being processed, if known. */
    @Nullable
    public String getLocator() {
        return locator;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
