package de.bsommerfeld.moltgraph.crawler.scan;

import de.bsommerfeld.moltgraph.db.CheckpointStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map-backed checkpoints with the same never-decrease rule as the store.
 */
class InMemoryCheckpoints implements CheckpointStore {

    private final Map<String, Integer> offsets = new HashMap<>();
    final List<Integer> saved = new ArrayList<>();

    @Override
    public int loadCheckpoint(String crawlId, String viewKey) {
        return offsets.getOrDefault(crawlId + "|" + viewKey, 0);
    }

    @Override
    public void saveCheckpoint(String crawlId, String viewKey, int offset) {
        saved.add(offset);
        offsets.merge(crawlId + "|" + viewKey, offset, Math::max);
    }
}
