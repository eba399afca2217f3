package net.assetdownloader.exception;

/**
 * Image bytes could not be decoded or re-encoded as JPEG.
 * RETRYABLE: No (same bytes will fail again)
 *
 * <p>Undecodable bytes are never written under a {@code .jpg} name.</p>
 */
public class ImageProcessingException extends AssetDownloadException {
    public ImageProcessingException(String message) {
        super(message, null, false, null);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, null, false, cause);
    }
}
