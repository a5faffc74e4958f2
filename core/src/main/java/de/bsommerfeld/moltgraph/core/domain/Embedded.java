package de.bsommerfeld.moltgraph.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

import static de.bsommerfeld.moltgraph.core.json.JsonFields.textOrNull;

/**
 * Reads the author and submolt references that posts and comments carry
 * either as an embedded object or as a bare name.
 */
public final class Embedded {

    private Embedded() {
    }

    /**
     * {@code author: {...}}, {@code author: "name"} or {@code author_name}.
     */
    public static Optional<AgentRow> author(JsonNode item) {
        if (item == null) {
            return Optional.empty();
        }
        JsonNode author = item.get("author");
        if (author instanceof ObjectNode embedded) {
            Optional<AgentRow> row = AgentRow.from(embedded);
            if (row.isPresent()) {
                return row;
            }
        } else if (author != null && author.isTextual() && !author.asText().isBlank()) {
            return Optional.of(AgentRow.named(author.asText()));
        }
        String name = textOrNull(item, "author_name", "authorName");
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(AgentRow.named(name));
    }

    /**
     * {@code submolt: {...}}, {@code submolt: "name"} or {@code submolt_name}.
     */
    public static Optional<SubmoltRow> submolt(JsonNode item) {
        if (item == null) {
            return Optional.empty();
        }
        JsonNode submolt = item.get("submolt");
        if (submolt instanceof ObjectNode embedded) {
            Optional<SubmoltRow> row = SubmoltRow.from(embedded);
            if (row.isPresent()) {
                return row;
            }
        } else if (submolt != null && submolt.isTextual() && !submolt.asText().isBlank()) {
            return Optional.of(SubmoltRow.named(submolt.asText()));
        }
        String name = textOrNull(item, "submolt_name", "submoltName");
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(SubmoltRow.named(name));
    }
}
