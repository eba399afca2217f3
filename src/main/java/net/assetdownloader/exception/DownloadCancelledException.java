package net.assetdownloader.exception;

/**
 * Thrown at a cancellation checkpoint once the active run has been cancelled.
 * RETRYABLE: No
 */
public class DownloadCancelledException extends AssetDownloadException {

    public static final String MESSAGE = "Download cancelled";

    public DownloadCancelledException(String locator) {
        super(MESSAGE, locator, false, null);
    }
}
