package de.bsommerfeld.moltgraph.moltbook;

/**
 * A request to the Moltbook API failed for good: retries, if any applied,
 * are exhausted.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
