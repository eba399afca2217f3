package net.assetdownloader.exception;

/**
 * A run was requested while another one is still active.
 */
public class RunAlreadyActiveException extends AssetDownloadException {

    public static final String MESSAGE = "Downloads already in progress";

    public RunAlreadyActiveException() {
        super(MESSAGE, null, false, null);
    }
}
