package com.intelscan.orchestrator.poller;

/**
 * Receives snapshot updates from a {@link ReconciliationPoller}.
 * Callbacks run on the poller's threads and should return quickly.
 */
public interface SnapshotObserver {

    /** A poll succeeded; {@code snapshot} replaces whatever was shown before. */
    void onSnapshot(ClientSnapshot snapshot);

    /**
     * A poll failed. {@code snapshot} holds the previous entries with the
     * stale flag set; it must not be treated as empty.
     */
    default void onFetchFailed(ClientSnapshot snapshot, Throwable cause) {
    }
}
