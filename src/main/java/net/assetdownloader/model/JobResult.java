package net.assetdownloader.model;

/**
 * Outcome of one download job.
 *
 * <p>Cancelled results are produced when a job observes cancellation at a checkpoint; they
 * are neither counted as success nor failure and are not written to the audit log.</p>
 */
public record JobResult(
        int rowNumber,
        String partNumber,
        String locator,
        boolean success,
        boolean cancelled,
        String localPath,
        String networkPath,
        int httpStatus,
        String contentType,
        long sizeBytes,
        boolean backgroundProcessed,
        String message) {

    public static final String SUCCESS_MESSAGE = "Success";

    public static JobResult success(DownloadJob job, int httpStatus, String contentType,
                                    long sizeBytes, boolean backgroundProcessed, String message) {
        return new JobResult(job.rowNumber(), job.partNumber(), job.locator(), true, false,
            job.localPath().toString(), job.networkPath(), httpStatus, nullToEmpty(contentType),
            sizeBytes, backgroundProcessed, message == null ? SUCCESS_MESSAGE : message);
    }

    public static JobResult failure(DownloadJob job, int httpStatus, String contentType, String message) {
        return new JobResult(job.rowNumber(), job.partNumber(), job.locator(), false, false,
            "", "", httpStatus, nullToEmpty(contentType), 0L, false, message);
    }

    public static JobResult cancelled(DownloadJob job) {
        return new JobResult(job.rowNumber(), job.partNumber(), job.locator(), false, true,
            "", "", 0, "", 0L, false, "Download cancelled");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
