package de.bsommerfeld.moltgraph.moltbook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Response of {@code /posts/{id}}.
 *
 * @param post     the post object, empty when the response carried none
 * @param comments the embedded comment tree, empty when absent
 */
public record PostDetail(ObjectNode post, List<JsonNode> comments) {

    public boolean hasPost() {
        return !post.isEmpty();
    }
}
