package net.assetdownloader.model;

/** Lifecycle of the download orchestrator. */
public enum RunState {
    IDLE,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
