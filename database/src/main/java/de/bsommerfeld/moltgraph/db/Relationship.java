package de.bsommerfeld.moltgraph.db;

import java.time.Instant;

/**
 * A stored edge.
 *
 * @param source  discovery source, empty for untagged types
 * @param role    {@code MODERATES} role, otherwise {@code null}
 * @param rank    {@code CONTAINS} rank, otherwise {@code null}
 * @param endedAt set once the edge was absent from a reconciliation,
 *                {@code null} while the edge is current
 */
public record Relationship(
        RelType type,
        NodeLabel fromLabel,
        String fromKey,
        NodeLabel toLabel,
        String toKey,
        String source,
        String role,
        Integer rank,
        Instant firstSeenAt,
        Instant lastSeenAt,
        Instant endedAt) {

    public boolean isOpen() {
        return endedAt == null;
    }
}
