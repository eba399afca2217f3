package net.assetdownloader.support.cancel;

import net.assetdownloader.exception.DownloadCancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Cancellation signal shared by every job of one run.
 *
 * <p>Workers poll {@link #isCancelled()} at checkpoints; reactive calls race against
 * {@link #onCancel()} so in-flight HTTP requests are disposed as soon as the run is cancelled.</p>
 */
public final class CancellationToken {

    private final Sinks.One<Boolean> signal = Sinks.one();
    private volatile boolean cancelled;

    /** Marks the token cancelled. Safe to call repeatedly and from any thread. */
    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        signal.tryEmitValue(Boolean.TRUE);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Checkpoint used before retries and file writes.
     *
     * @throws DownloadCancelledException when the token has been cancelled
     */
    public void throwIfCancelled(String locator) {
        if (cancelled) {
            throw new DownloadCancelledException(locator);
        }
    }

    /** Emits once when {@link #cancel()} is called; never completes otherwise. */
    public Mono<Boolean> onCancel() {
        return signal.asMono();
    }
}
