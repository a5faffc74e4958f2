package de.bsommerfeld.moltgraph.db;

/**
 * Relationship types. {@link #MODERATES} and {@link #SIMILAR_TO} are
 * time-varying: membership is reconciled per observation and removals set
 * {@code ended_at} instead of deleting the edge.
 */
public enum RelType {
    /** Agent → Post | Comment */
    AUTHORED,
    /** Post → Submolt */
    IN_SUBMOLT,
    /** Comment → Post */
    ON_POST,
    /** Comment → Comment */
    REPLY_TO,
    /** Agent → Submolt, carries {@code role} */
    MODERATES,
    /** Agent → Agent, tagged by discovery {@code source} */
    SIMILAR_TO,
    /** Agent → XAccount */
    HAS_OWNER_X,
    /** FeedSnapshot → Post, carries {@code rank} */
    CONTAINS
}
