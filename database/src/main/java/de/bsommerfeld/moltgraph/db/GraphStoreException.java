package de.bsommerfeld.moltgraph.db;

/**
 * A persistence failure. Unchecked: callers isolate it at stage level, and
 * writes committed before the failure stay committed.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
