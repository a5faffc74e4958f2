package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the MoltGraph configuration tree, bound from {@code config.toml}.
 *
 * <p>
 * Every section is pre-populated with defaults, so a missing file or a file
 * that only sets a handful of keys still yields a complete configuration.
 * Unknown keys are ignored to keep older config files loadable.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("api")
    private ApiConfig api = new ApiConfig();

    @JsonProperty("crawl")
    private CrawlConfig crawl = new CrawlConfig();

    @JsonProperty("enrichment")
    private EnrichmentConfig enrichment = new EnrichmentConfig();

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    public ApiConfig getApi() {
        return api;
    }

    public CrawlConfig getCrawl() {
        return crawl;
    }

    public EnrichmentConfig getEnrichment() {
        return enrichment;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }
}
