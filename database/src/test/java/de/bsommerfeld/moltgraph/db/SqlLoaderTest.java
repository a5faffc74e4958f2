package de.bsommerfeld.moltgraph.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests SqlLoader's ability to load SQL files from classpath resources.
 * schema.sql lives at the root classpath level and is not loaded through
 * SqlLoader.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnUpsertAgent() {
        String sql = SqlLoader.load("upsert-agent");
        assertNotNull(sql);
        assertFalse(sql.isBlank());
        assertTrue(sql.toLowerCase().contains("insert"));
    }

    @Test
    void load_shouldReturnSelectOpenRelationships() {
        String sql = SqlLoader.load("select-open-relationships-to");
        assertTrue(sql.toLowerCase().contains("select"));
        assertTrue(sql.contains("ended_at IS NULL"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("upsert-post");
        String second = SqlLoader.load("upsert-post");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }

    // -- Node templates --

    @Test
    void loadFor_shouldFillTableAndKeyColumn() {
        String sql = SqlLoader.loadFor("select-node", NodeLabel.POST);
        assertTrue(sql.contains("posts"));
        assertTrue(sql.contains("id = ?"));
        assertFalse(sql.contains("{table}"));
        assertFalse(sql.contains("{key}"));
    }

    @Test
    void loadFor_shouldNotPolluteCachedTemplate() {
        SqlLoader.loadFor("count-nodes", NodeLabel.AGENT);
        assertTrue(SqlLoader.load("count-nodes").contains("{table}"));
    }
}
