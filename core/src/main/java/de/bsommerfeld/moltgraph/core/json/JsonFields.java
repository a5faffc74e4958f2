package de.bsommerfeld.moltgraph.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.bsommerfeld.moltgraph.core.util.Timestamps;

import java.time.Instant;
import java.util.Optional;

/**
 * Field readers tolerant of naming drift. Each reader takes the spellings a
 * field has been seen under (typically camelCase and snake_case) and returns
 * the first one that is present and not JSON {@code null}. An explicit
 * {@code false} or {@code 0} counts as present.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static Optional<String> text(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null || value.isContainerNode()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    public static Optional<Long> longValue(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isIntegralNumber()) {
            return Optional.of(value.longValue());
        }
        if (value.isNumber()) {
            return Optional.of((long) value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> doubleValue(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.doubleValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Boolean> bool(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isIntegralNumber()) {
            return Optional.of(value.longValue() != 0);
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a value the crawler stores without interpreting it. Scalars keep
     * their JSON text ({@code true}, {@code 1}, {@code "suspected"}),
     * containers are kept as compact JSON.
     */
    public static Optional<String> tag(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(value.isContainerNode() ? value.toString() : value.asText());
    }

    /**
     * Timestamps arrive as ISO strings or as epoch numbers. Unparseable values
     * are treated as absent.
     */
    public static Optional<Instant> instant(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        if (value == null) {
            return Optional.empty();
        }
        if (value.isIntegralNumber()) {
            return Optional.of(Timestamps.fromEpochNumber(value.longValue()));
        }
        return value.isTextual() ? Timestamps.parse(value.asText()) : Optional.empty();
    }

    public static Optional<ObjectNode> object(JsonNode node, String... names) {
        JsonNode value = first(node, names);
        return value instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
    }

    /**
     * Nullable convenience for record factories, which store absent values as
     * {@code null}.
     */
    public static String textOrNull(JsonNode node, String... names) {
        return text(node, names).orElse(null);
    }

    public static Long longOrNull(JsonNode node, String... names) {
        return longValue(node, names).orElse(null);
    }

    public static Double doubleOrNull(JsonNode node, String... names) {
        return doubleValue(node, names).orElse(null);
    }

    public static Boolean boolOrNull(JsonNode node, String... names) {
        return bool(node, names).orElse(null);
    }

    public static String tagOrNull(JsonNode node, String... names) {
        return tag(node, names).orElse(null);
    }

    public static Instant instantOrNull(JsonNode node, String... names) {
        return instant(node, names).orElse(null);
    }

    private static JsonNode first(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return value;
            }
        }
        return null;
    }
}
