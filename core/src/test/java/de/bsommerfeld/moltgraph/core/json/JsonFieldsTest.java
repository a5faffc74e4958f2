package de.bsommerfeld.moltgraph.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonFieldsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void text_shouldPreferFirstPresentSpelling() throws Exception {
        JsonNode node = json("{\"displayName\":\"Camel\",\"display_name\":\"snake\"}");

        assertEquals(Optional.of("Camel"), JsonFields.text(node, "displayName", "display_name"));
        assertEquals(Optional.of("snake"), JsonFields.text(node, "display_name", "displayName"));
    }

    @Test
    void text_shouldSkipNulls() throws Exception {
        JsonNode node = json("{\"displayName\":null,\"display_name\":\"snake\"}");

        assertEquals(Optional.of("snake"), JsonFields.text(node, "displayName", "display_name"));
    }

    @Test
    void tag_shouldKeepAnyValueAsText() throws Exception {
        JsonNode node = json("{\"a\":\"suspected\",\"b\":1,\"c\":false,\"d\":[\"x\"],\"e\":null}");

        assertEquals(Optional.of("suspected"), JsonFields.tag(node, "a"));
        assertEquals(Optional.of("1"), JsonFields.tag(node, "b"));
        assertEquals(Optional.of("false"), JsonFields.tag(node, "c"));
        assertEquals(Optional.of("[\"x\"]"), JsonFields.tag(node, "d"));
        assertEquals(Optional.empty(), JsonFields.tag(node, "e"));
    }

    @Test
    void bool_shouldHonourExplicitFalse() throws Exception {
        JsonNode node = json("{\"isClaimed\":false,\"is_claimed\":true}");

        assertEquals(Optional.of(false), JsonFields.bool(node, "isClaimed", "is_claimed"));
    }

    @Test
    void longValue_shouldHonourZero() throws Exception {
        JsonNode node = json("{\"followerCount\":0,\"follower_count\":12}");

        assertEquals(Optional.of(0L), JsonFields.longValue(node, "followerCount", "follower_count"));
    }

    @Test
    void longValue_shouldParseNumericStrings() throws Exception {
        assertEquals(Optional.of(42L), JsonFields.longValue(json("{\"karma\":\"42\"}"), "karma"));
        assertEquals(Optional.empty(), JsonFields.longValue(json("{\"karma\":\"lots\"}"), "karma"));
    }

    @Test
    void instant_shouldAcceptIsoAndEpoch() throws Exception {
        Instant expected = Instant.parse("2026-01-30T12:00:00Z");

        assertEquals(Optional.of(expected),
                JsonFields.instant(json("{\"created_at\":\"2026-01-30T12:00:00+00:00\"}"), "created_at"));
        assertEquals(Optional.of(expected),
                JsonFields.instant(json("{\"created_at\":" + expected.getEpochSecond() + "}"), "created_at"));
        assertEquals(Optional.empty(),
                JsonFields.instant(json("{\"created_at\":\"yesterday\"}"), "created_at"));
    }

    @Test
    void readers_shouldNeverThrowOnNonObjects() throws Exception {
        assertEquals(Optional.empty(), JsonFields.text(json("[1,2]"), "name"));
        assertEquals(Optional.empty(), JsonFields.bool(null, "flag"));
        assertEquals(Optional.empty(), JsonFields.object(json("{\"author\":\"alice\"}"), "author"));
    }
}
