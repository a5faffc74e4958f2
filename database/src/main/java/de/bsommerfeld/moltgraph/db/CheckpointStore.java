package de.bsommerfeld.moltgraph.db;

/**
 * Per-crawl pagination offsets, keyed by view. This is the only part of the
 * store the view scanner needs.
 */
public interface CheckpointStore {

    /**
     * Stored offset for the view, {@code 0} if none was saved yet.
     */
    int loadCheckpoint(String crawlId, String viewKey);

    /**
     * Persists an offset. The stored value never decreases: saving a value
     * lower than the current one is a no-op.
     */
    void saveCheckpoint(String crawlId, String viewKey, int offset);
}
