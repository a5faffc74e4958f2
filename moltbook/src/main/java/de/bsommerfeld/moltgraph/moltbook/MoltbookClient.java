package de.bsommerfeld.moltgraph.moltbook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.json.ApiResponse;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the Moltbook endpoints the crawler uses.
 *
 * <h3>Public first</h3>
 * Listing and detail endpoints are requested without the bearer token first:
 * anonymous requests avoid the personalized, aggressively cached first page the
 * API hands to authenticated callers. Some deployments still demand auth for
 * individual endpoints; a 401 is answered by repeating the request once with
 * the token. {@code /agents/me}, {@code /agents/profile} and {@code /feed} are
 * always authenticated.
 *
 * <h3>Shapes</h3>
 * Every response goes through {@link ApiResponse} with the wrapper keys that
 * have been observed for that endpoint, so callers never see the envelope.
 */
@Singleton
public class MoltbookClient {

    private static final Logger LOG = LoggerFactory.getLogger(MoltbookClient.class);

    private final HttpTransport transport;

    @Inject
    public MoltbookClient(HttpTransport transport) {
        this.transport = transport;
    }

    // =====================================================================
    // Agents
    // =====================================================================

    /** The agent that owns the API key. */
    public ObjectNode getMe() throws TransportException {
        return transport.get("/agents/me", Map.of(), true).extractObjectOrSelf("agent");
    }

    /**
     * Full profile of {@code name}. The returned agent object may carry an
     * {@code owner} object with the owner's X account.
     */
    public ObjectNode getAgentProfile(String name) throws TransportException {
        return transport.get("/agents/profile", params("name", name), true).extractObjectOrSelf("agent");
    }

    // =====================================================================
    // Submolts
    // =====================================================================

    public List<JsonNode> listSubmolts(String sort, int limit, int offset) throws TransportException {
        return getPublicFirst("/submolts", params("limit", limit, "offset", offset, "sort", sort))
                .extractList("submolts", "data");
    }

    public ObjectNode getSubmolt(String name) throws TransportException {
        return getPublicFirst("/submolts/" + HttpTransport.segment(name), Map.of())
                .extractObjectOrSelf("submolt");
    }

    public List<JsonNode> getModerators(String name) throws TransportException {
        return getPublicFirst("/submolts/" + HttpTransport.segment(name) + "/moderators", Map.of())
                .extractList("moderators", "data");
    }

    public ListingPage getSubmoltFeed(String name, String sort, int limit, int offset) throws TransportException {
        ApiResponse response = getPublicFirst("/submolts/" + HttpTransport.segment(name) + "/feed",
                params("sort", sort, "limit", limit, "offset", offset));
        return ListingPage.of(response, "posts", "data");
    }

    // =====================================================================
    // Posts & comments
    // =====================================================================

    /**
     * One page of {@code /posts}.
     *
     * @param time    time window for {@code top}-style sorts, {@code null} for
     *                none
     * @param submolt restricts to one submolt, {@code null} for all
     */
    public ListingPage listPosts(String sort, String time, int limit, int offset, String submolt)
            throws TransportException {
        Map<String, Object> params = params("sort", sort, "limit", limit, "offset", offset);
        params.put("time", time);
        params.put("submolt", submolt);
        return ListingPage.of(getPublicFirst("/posts", params), "posts", "data");
    }

    /**
     * {@code /posts/{id}}. The comment tree may sit inside the post object or
     * next to it.
     */
    public PostDetail getPost(String id) throws TransportException {
        ApiResponse response = getPublicFirst("/posts/" + HttpTransport.segment(id), Map.of());
        ObjectNode post = response.extractObject("post");
        List<JsonNode> comments = ApiResponse.of(post).extractList("comments");
        if (comments.isEmpty()) {
            comments = response.extractList("comments");
        }
        if (post.isEmpty() && response.body().isObject() && response.body().has("id")) {
            post = (ObjectNode) response.body();
        }
        return new PostDetail(post, comments);
    }

    public List<JsonNode> getComments(String postId, String sort, int limit) throws TransportException {
        return getPublicFirst("/posts/" + HttpTransport.segment(postId) + "/comments",
                params("sort", sort, "limit", limit))
                .extractList("comments", "data");
    }

    // =====================================================================
    // Feed
    // =====================================================================

    /** The personalized feed of the key's agent. */
    public List<JsonNode> getFeed(String sort, int limit, int offset) throws TransportException {
        return transport.get("/feed", params("sort", sort, "limit", limit, "offset", offset), true)
                .extractList("posts", "data");
    }

    private ApiResponse getPublicFirst(String path, Map<String, ?> params) throws TransportException {
        try {
            return transport.get(path, params, false);
        } catch (AuthRequiredException e) {
            LOG.debug("{} requires auth, retrying with token", path);
            return transport.get(path, params, true);
        }
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
