package de.bsommerfeld.moltgraph.crawler;

import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What one crawl run has come across so far. Feeds the enrichment stages.
 * Not thread-safe; a run is single-threaded.
 */
public class DiscoveredEntities {

    private final Map<String, SubmoltRow> submolts = new LinkedHashMap<>();
    private final Set<String> agentNames = new LinkedHashSet<>();
    private final Set<String> seenPostIds = new HashSet<>();
    private final Set<String> commentedPostIds = new HashSet<>();

    /** Keeps the richest representation per name. */
    void addSubmolt(SubmoltRow submolt) {
        submolts.merge(submolt.name(), submolt, EntityExtractor::mergeSubmolts);
    }

    void addAgentName(String name) {
        if (name != null && !name.isBlank()) {
            agentNames.add(name);
        }
    }

    public Collection<SubmoltRow> submolts() {
        return Collections.unmodifiableCollection(submolts.values());
    }

    public Set<String> submoltNames() {
        return Collections.unmodifiableSet(submolts.keySet());
    }

    public Set<String> agentNames() {
        return Collections.unmodifiableSet(agentNames);
    }

    /** Seen set shared by every view scan of the run; mutable on purpose. */
    Set<String> seenPostIds() {
        return seenPostIds;
    }

    /** @return {@code false} if the post's comments were already handled */
    boolean markCommented(String postId) {
        return commentedPostIds.add(postId);
    }

    boolean isCommented(String postId) {
        return commentedPostIds.contains(postId);
    }
}
