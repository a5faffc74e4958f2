package de.bsommerfeld.moltgraph.moltbook;

/**
 * The API answered with a non-success status that is not retried further.
 */
public class HttpStatusException extends TransportException {

    private final int statusCode;
    private final String path;

    public HttpStatusException(int statusCode, String path) {
        this(statusCode, path, "HTTP " + statusCode + " for " + path);
    }

    public HttpStatusException(int statusCode, String path, String message) {
        super(message);
        this.statusCode = statusCode;
        this.path = path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getPath() {
        return path;
    }
}
