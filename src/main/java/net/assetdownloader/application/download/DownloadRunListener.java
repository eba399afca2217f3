package net.assetdownloader.application.download;

import net.assetdownloader.model.RunCompletion;
import net.assetdownloader.model.RunProgress;

/**
 * Receives lifecycle notifications from {@link DownloadOrchestrator}.
 *
 * <p>Progress callbacks arrive in non-decreasing order of processed jobs. Exactly one of
 * {@link #onComplete} or {@link #onError} is invoked per run.</p>
 */
public interface DownloadRunListener {

    void onProgress(RunProgress progress);

    /** Invoked once at a terminal state; {@link RunCompletion#cancelled()} distinguishes cancellation. */
    void onComplete(RunCompletion completion);

    /** Invoked when the run could not be set up, before any job ran. */
    void onError(String message);
}
