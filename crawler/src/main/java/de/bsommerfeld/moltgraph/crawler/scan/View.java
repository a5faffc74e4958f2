package de.bsommerfeld.moltgraph.crawler.scan;

import java.util.Locale;

/**
 * A listing order of {@code /posts}: sort plus optional time window. Written
 * in config as {@code "sort:time"}, e.g. {@code "top:week"} or {@code "new:"}.
 *
 * @param sort listing order
 * @param time time window, {@code null} when unbounded
 */
public record View(String sort, String time) {

    private static final String REVERSE_CHRONOLOGICAL = "new";

    public View {
        if (sort == null || sort.isBlank()) {
            throw new IllegalArgumentException("View sort must not be empty");
        }
        if (time != null && time.isBlank()) {
            time = null;
        }
    }

    /**
     * @throws IllegalArgumentException on an empty sort
     */
    public static View parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("View must not be null");
        }
        int colon = raw.indexOf(':');
        String sort = (colon < 0 ? raw : raw.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        String time = colon < 0 ? null : raw.substring(colon + 1).trim().toLowerCase(Locale.ROOT);
        return new View(sort, time);
    }

    /** Key under which this view's offset is checkpointed. */
    public String checkpointKey() {
        return "posts_offset_" + sort + "_" + (time == null ? "na" : time);
    }

    /** Only the {@code new} order can stop at a time cutoff. */
    public boolean isReverseChronological() {
        return REVERSE_CHRONOLOGICAL.equals(sort);
    }

    @Override
    public String toString() {
        return sort + ":" + (time == null ? "-" : time);
    }
}
