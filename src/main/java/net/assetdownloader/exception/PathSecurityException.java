package net.assetdownloader.exception;

/**
 * An untrusted path tried to leave its allowed root or carried forbidden characters.
 * RETRYABLE: No
 */
public class PathSecurityException extends AssetDownloadException {

    private final String attemptedPath;

    public PathSecurityException(String message, String attemptedPath) {
        super(message, attemptedPath, false, null);
        this.attemptedPath = attemptedPath;
    }

    public String getAttemptedPath() {
        return attemptedPath;
    }
}
