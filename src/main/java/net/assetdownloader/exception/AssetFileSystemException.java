package net.assetdownloader.exception;

/**
 * Local read or write failed (permissions, missing file, disk full).
 * RETRYABLE: No
 */
public class AssetFileSystemException extends AssetDownloadException {
    public AssetFileSystemException(String path, String message, Throwable cause) {
        super(message, path, false, cause);
    }
}
