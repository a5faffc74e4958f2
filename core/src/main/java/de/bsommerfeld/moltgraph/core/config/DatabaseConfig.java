package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Location of the graph database. An empty path resolves to
 * {@code moltgraph.db} inside the platform data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("path")
    private String path = "";

    @JsonProperty("batch-size")
    private int batchSize = 500;

    @JsonProperty("post-batch-size")
    private int postBatchSize = 300;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getPostBatchSize() {
        return postBatchSize;
    }
}
