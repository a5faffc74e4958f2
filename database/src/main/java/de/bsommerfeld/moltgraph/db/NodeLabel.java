package de.bsommerfeld.moltgraph.db;

/**
 * Node labels of the graph and the table each one lives in.
 */
public enum NodeLabel {

    AGENT("Agent", "agents", "name"),
    SUBMOLT("Submolt", "submolts", "name"),
    POST("Post", "posts", "id"),
    COMMENT("Comment", "comments", "id"),
    X_ACCOUNT("XAccount", "x_accounts", "handle"),
    CRAWL("Crawl", "crawls", "id"),
    FEED_SNAPSHOT("FeedSnapshot", "feed_snapshots", "id");

    private final String label;
    private final String table;
    private final String keyColumn;

    NodeLabel(String label, String table, String keyColumn) {
        this.label = label;
        this.table = table;
        this.keyColumn = keyColumn;
    }

    /** Label as stored in the {@code relationships} table. */
    public String label() {
        return label;
    }

    public String table() {
        return table;
    }

    public String keyColumn() {
        return keyColumn;
    }

    public static NodeLabel fromLabel(String label) {
        for (NodeLabel value : values()) {
            if (value.label.equals(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node label: " + label);
    }
}
