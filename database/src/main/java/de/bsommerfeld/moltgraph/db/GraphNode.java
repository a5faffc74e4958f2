package de.bsommerfeld.moltgraph.db;

import java.time.Instant;
import java.util.Map;

/**
 * A stored node as a column map. Used for verification and tooling; the crawl
 * path never reads nodes back.
 *
 * @param label      node label
 * @param key        natural key
 * @param properties every column of the row, {@code null} values included
 */
public record GraphNode(NodeLabel label, String key, Map<String, Object> properties) {

    public String text(String column) {
        Object value = properties.get(column);
        return value == null ? null : value.toString();
    }

    public Long longValue(String column) {
        Object value = properties.get(column);
        return value instanceof Number n ? n.longValue() : null;
    }

    public Double doubleValue(String column) {
        Object value = properties.get(column);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    /** SQLite has no boolean type; flags are stored as 0/1. */
    public Boolean bool(String column) {
        Long value = longValue(column);
        return value == null ? null : value != 0;
    }

    /** Timestamp columns hold epoch milliseconds. */
    public Instant instant(String column) {
        Long value = longValue(column);
        return value == null ? null : Instant.ofEpochMilli(value);
    }

    public Instant firstSeenAt() {
        return instant("first_seen_at");
    }

    public Instant lastSeenAt() {
        return instant("last_seen_at");
    }
}
