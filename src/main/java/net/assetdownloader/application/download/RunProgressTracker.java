package net.assetdownloader.application.download;

import net.assetdownloader.model.JobResult;
import net.assetdownloader.model.RunProgress;

import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Sole owner of a run's counters. Updates are serialized, and each new snapshot is handed
 * to the publisher while the lock is held so observers see counts in order.
 */
final class RunProgressTracker {

    private final int total;
    private final LongSupplier nanoClock;
    private final long startedAt;

    private int successful;
    private int failed;
    private int backgroundProcessed;
    private volatile RunProgress latest;

    RunProgressTracker(int total) {
        this(total, System::nanoTime);
    }

    RunProgressTracker(int total, LongSupplier nanoClock) {
        this.total = total;
        this.nanoClock = nanoClock;
        this.startedAt = nanoClock.getAsLong();
        this.latest = RunProgress.initial(total);
    }

    /**
     * Counts a finished job and publishes the resulting snapshot. Cancelled results are ignored.
     */
    synchronized RunProgress record(JobResult result, String currentFile, Consumer<RunProgress> publisher) {
        if (result.cancelled()) {
            return latest;
        }
        if (result.success()) {
            successful++;
            if (result.backgroundProcessed()) {
                backgroundProcessed++;
            }
        } else {
            failed++;
        }
        RunProgress snapshot = compute(currentFile);
        latest = snapshot;
        publisher.accept(snapshot);
        return snapshot;
    }

    RunProgress snapshot() {
        return latest;
    }

    int total() {
        return total;
    }

    private RunProgress compute(String currentFile) {
        int processed = successful + failed;
        double percentage = total == 0 ? 100.0 : (processed * 100.0) / total;
        long elapsedSeconds = TimeUnit.NANOSECONDS.toSeconds(nanoClock.getAsLong() - startedAt);
        return new RunProgress(currentFile, successful, failed, total, percentage, elapsedSeconds,
            estimateRemaining(elapsedSeconds, percentage), backgroundProcessed);
    }

    static long estimateRemaining(long elapsedSeconds, double percentage) {
        if (percentage <= 0.0 || percentage >= 100.0) {
            return 0L;
        }
        double estimatedTotal = elapsedSeconds * 100.0 / percentage;
        return Math.max(0L, Math.round(estimatedTotal - elapsedSeconds));
    }
}
