package de.bsommerfeld.moltgraph.moltbook;

/**
 * A 5xx that persisted through every retry.
 */
public class ServerUnavailableException extends HttpStatusException {

    public ServerUnavailableException(int statusCode, String path) {
        super(statusCode, path, "Server unavailable (HTTP " + statusCode + ") for " + path);
    }
}
