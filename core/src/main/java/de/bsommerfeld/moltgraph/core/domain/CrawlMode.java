package de.bsommerfeld.moltgraph.core.domain;

import java.util.Locale;

/**
 * The two parameterizations of a crawl run.
 */
public enum CrawlMode {

    /** Unbounded scan of every configured view. */
    FULL,

    /**
     * Scan bounded by the cutoff of the previous completed run. Only
     * reverse-chronological views honour the cutoff.
     */
    INCREMENTAL;

    /** Prefix of crawl ids and the value stored in the crawl record. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a CLI argument. {@code weekly} is accepted as an alias of
     * {@link #INCREMENTAL}.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static CrawlMode parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "full":
                return FULL;
            case "incremental":
            case "weekly":
                return INCREMENTAL;
            default:
                throw new IllegalArgumentException("Unknown crawl mode: " + value);
        }
    }
}
