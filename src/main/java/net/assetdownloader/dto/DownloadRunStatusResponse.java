package net.assetdownloader.dto;

import jakarta.annotation.Nullable;
import net.assetdownloader.model.RunCompletion;
import net.assetdownloader.model.RunProgress;
import net.assetdownloader.model.RunState;

/**
 * Polling view of the orchestrator.
 */
public record DownloadRunStatusResponse(
        RunState state,
        boolean running,
        RunProgress progress,
        @Nullable RunCompletion completion,
        @Nullable String error) {
}
