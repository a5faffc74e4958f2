package de.bsommerfeld.moltgraph.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A decoded API body. The upstream answers either with a bare array or with an
 * object that wraps the payload under one of several keys that changed over
 * the API's lifetime, so every call site passes its own ordered list of
 * candidate keys.
 *
 * <h3>Contract</h3>
 * None of the extraction methods throw. A shape that does not match any
 * candidate yields an empty list or an empty object, never {@code null}.
 */
public sealed interface ApiResponse permits ApiResponse.ArrayResponse, ApiResponse.ObjectResponse {

    /**
     * Wraps a decoded body. Scalars and {@code null} become an empty object,
     * which is what an empty HTTP body normalizes to as well.
     */
    static ApiResponse of(JsonNode node) {
        if (node instanceof ArrayNode array) {
            return new ArrayResponse(array);
        }
        if (node instanceof ObjectNode object) {
            return new ObjectResponse(object);
        }
        return new ObjectResponse(JsonNodeFactory.instance.objectNode());
    }

    /**
     * The first array found under {@code candidateKeys}, in order. A bare array
     * body is returned as-is.
     */
    List<JsonNode> extractList(String... candidateKeys);

    /**
     * The first object found under {@code candidateKeys}, in order, else an
     * empty object.
     */
    ObjectNode extractObject(String... candidateKeys);

    /**
     * Like {@link #extractObject} but falls back to the body itself when it is
     * an object. For endpoints that sometimes wrap the entity and sometimes do
     * not.
     */
    ObjectNode extractObjectOrSelf(String... candidateKeys);

    /** {@code has_more}/{@code hasMore}, when present and interpretable. */
    Optional<Boolean> hasMore();

    /** {@code next_offset}/{@code nextOffset}, when present and numeric. */
    OptionalInt nextOffset();

    /** The raw body. */
    JsonNode body();

    record ArrayResponse(ArrayNode body) implements ApiResponse {

        @Override
        public List<JsonNode> extractList(String... candidateKeys) {
            List<JsonNode> items = new ArrayList<>(body.size());
            body.forEach(items::add);
            return items;
        }

        @Override
        public ObjectNode extractObject(String... candidateKeys) {
            return JsonNodeFactory.instance.objectNode();
        }

        @Override
        public ObjectNode extractObjectOrSelf(String... candidateKeys) {
            return JsonNodeFactory.instance.objectNode();
        }

        @Override
        public Optional<Boolean> hasMore() {
            return Optional.empty();
        }

        @Override
        public OptionalInt nextOffset() {
            return OptionalInt.empty();
        }
    }

    record ObjectResponse(ObjectNode body) implements ApiResponse {

        @Override
        public List<JsonNode> extractList(String... candidateKeys) {
            for (String key : candidateKeys) {
                JsonNode value = body.get(key);
                if (value instanceof ArrayNode array) {
                    List<JsonNode> items = new ArrayList<>(array.size());
                    array.forEach(items::add);
                    return items;
                }
            }
            return List.of();
        }

        @Override
        public ObjectNode extractObject(String... candidateKeys) {
            for (String key : candidateKeys) {
                JsonNode value = body.get(key);
                if (value instanceof ObjectNode object) {
                    return object;
                }
            }
            return JsonNodeFactory.instance.objectNode();
        }

        @Override
        public ObjectNode extractObjectOrSelf(String... candidateKeys) {
            for (String key : candidateKeys) {
                JsonNode value = body.get(key);
                if (value instanceof ObjectNode object) {
                    return object;
                }
            }
            return body;
        }

        @Override
        public Optional<Boolean> hasMore() {
            return JsonFields.bool(body, "has_more", "hasMore");
        }

        @Override
        public OptionalInt nextOffset() {
            Optional<Long> value = JsonFields.longValue(body, "next_offset", "nextOffset");
            if (value.isEmpty() || value.get() < 0 || value.get() > Integer.MAX_VALUE) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(value.get().intValue());
        }
    }
}
