package de.bsommerfeld.moltgraph.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ApiResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ApiResponse parse(String json) throws Exception {
        return ApiResponse.of(mapper.readTree(json));
    }

    private static List<String> ids(List<JsonNode> items) {
        return items.stream().map(n -> n.get("id").asText()).toList();
    }

    // -- extractList --

    @Test
    void extractList_shouldReturnBareArray() throws Exception {
        ApiResponse response = parse("[{\"id\":\"a\"},{\"id\":\"b\"}]");

        assertInstanceOf(ApiResponse.ArrayResponse.class, response);
        assertEquals(List.of("a", "b"), ids(response.extractList("posts")));
    }

    @Test
    void extractList_shouldTryCandidatesInOrder() throws Exception {
        ApiResponse response = parse("{\"data\":[{\"id\":\"d\"}],\"posts\":[{\"id\":\"p\"}]}");

        assertEquals(List.of("p"), ids(response.extractList("posts", "data")));
        assertEquals(List.of("d"), ids(response.extractList("data", "posts")));
    }

    @Test
    void extractList_shouldSkipCandidatesThatAreNotArrays() throws Exception {
        ApiResponse response = parse("{\"posts\":{\"id\":\"x\"},\"data\":[{\"id\":\"d\"}]}");

        assertEquals(List.of("d"), ids(response.extractList("posts", "data")));
    }

    @Test
    void extractList_shouldReturnEmptyForUnexpectedShapes() throws Exception {
        assertTrue(parse("{\"success\":true}").extractList("posts", "data").isEmpty());
        assertTrue(parse("{\"posts\":\"oops\"}").extractList("posts").isEmpty());
        assertTrue(ApiResponse.of(NullNode.getInstance()).extractList("posts").isEmpty());
        assertTrue(ApiResponse.of(TextNode.valueOf("hello")).extractList("posts").isEmpty());
        assertTrue(ApiResponse.of(null).extractList("posts").isEmpty());
    }

    // -- extractObject --

    @Test
    void extractObject_shouldUnwrapFirstMatchingCandidate() throws Exception {
        ApiResponse response = parse("{\"agent\":{\"name\":\"alice\"}}");

        assertEquals("alice", response.extractObject("agent").get("name").asText());
    }

    @Test
    void extractObject_shouldReturnEmptyObjectWhenNothingMatches() throws Exception {
        assertTrue(parse("{\"agent\":[1,2]}").extractObject("agent").isEmpty());
        assertTrue(parse("[1,2,3]").extractObject("agent").isEmpty());
    }

    @Test
    void extractObjectOrSelf_shouldFallBackToBody() throws Exception {
        ApiResponse wrapped = parse("{\"post\":{\"id\":\"p1\"}}");
        ApiResponse bare = parse("{\"id\":\"p2\",\"title\":\"t\"}");

        assertEquals("p1", wrapped.extractObjectOrSelf("post").get("id").asText());
        assertEquals("p2", bare.extractObjectOrSelf("post").get("id").asText());
        assertTrue(parse("[]").extractObjectOrSelf("post").isEmpty());
    }

    // -- Paging envelope --

    @Test
    void hasMore_shouldReadEitherSpelling() throws Exception {
        assertEquals(Optional.of(true), parse("{\"has_more\":true}").hasMore());
        assertEquals(Optional.of(false), parse("{\"hasMore\":false}").hasMore());
        assertEquals(Optional.empty(), parse("{}").hasMore());
        assertEquals(Optional.empty(), parse("[]").hasMore());
    }

    @Test
    void nextOffset_shouldTolerateStringsAndGarbage() throws Exception {
        assertEquals(OptionalInt.of(50), parse("{\"next_offset\":50}").nextOffset());
        assertEquals(OptionalInt.of(75), parse("{\"nextOffset\":\"75\"}").nextOffset());
        assertEquals(OptionalInt.empty(), parse("{\"next_offset\":\"soon\"}").nextOffset());
        assertEquals(OptionalInt.empty(), parse("{\"next_offset\":null}").nextOffset());
        assertEquals(OptionalInt.empty(), parse("{\"next_offset\":-5}").nextOffset());
        assertEquals(OptionalInt.empty(), parse("{}").nextOffset());
    }
}
