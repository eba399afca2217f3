package net.assetdownloader.model;

/**
 * Snapshot of run progress, published after every counted job result.
 *
 * @param currentFile file name of the most recently finished job
 * @param successful jobs finished successfully
 * @param failed jobs finished with a failure
 * @param total jobs prepared for the run; fixed once the run starts
 * @param percentage {@code (successful + failed) / total * 100}
 * @param elapsedSeconds whole seconds since the run started
 * @param estimatedRemainingSeconds linear extrapolation from elapsed time and percentage
 * @param backgroundProcessed images whose transparency was flattened
 */
public record RunProgress(
        String currentFile,
        int successful,
        int failed,
        int total,
        double percentage,
        long elapsedSeconds,
        long estimatedRemainingSeconds,
        int backgroundProcessed) {

    public static RunProgress initial(int total) {
        return new RunProgress("", 0, 0, total, 0.0, 0L, 0L, 0);
    }

    public int processed() {
        return successful + failed;
    }
}
