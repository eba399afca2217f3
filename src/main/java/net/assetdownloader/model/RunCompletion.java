package net.assetdownloader.model;

/**
 * Terminal summary of a run, emitted exactly once per run.
 */
public record RunCompletion(
        int successful,
        int failed,
        int total,
        int backgroundProcessed,
        String logFile,
        boolean cancelled) {
}
