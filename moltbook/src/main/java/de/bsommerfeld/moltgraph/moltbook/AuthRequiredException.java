package de.bsommerfeld.moltgraph.moltbook;

/**
 * HTTP 401. Never retried by the transport; {@link MoltbookClient} repeats a
 * public request once with the bearer token.
 */
public class AuthRequiredException extends HttpStatusException {

    public AuthRequiredException(String path) {
        super(401, path, "Authentication required for " + path);
    }
}
