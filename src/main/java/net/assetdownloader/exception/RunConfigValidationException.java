package net.assetdownloader.exception;

import java.util.List;

/**
 * Run configuration is incomplete or out of range; the run never starts.
 * RETRYABLE: No
 */
public class RunConfigValidationException extends AssetDownloadException {

    private final List<String> errors;

    public RunConfigValidationException(List<String> errors) {
        super("Invalid download configuration: " + String.join("; ", errors), null, false, null);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
