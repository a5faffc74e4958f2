package de.bsommerfeld.moltgraph.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.PostRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EntityExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EntityExtractor extractor = new EntityExtractor();

    private List<JsonNode> items(String raw) throws Exception {
        List<JsonNode> items = new ArrayList<>();
        mapper.readTree(raw).forEach(items::add);
        return items;
    }

    // -- Posts --

    @Test
    void posts_shouldSkipItemsWithoutId() throws Exception {
        List<PostRow> rows = extractor.posts(items("""
                [{"id": "p1", "title": "a"}, {"title": "no id"}, {"id": "p2"}]
                """));

        assertEquals(List.of("p1", "p2"), rows.stream().map(PostRow::id).collect(Collectors.toList()));
    }

    @Test
    void collectFromPosts_shouldRecordAuthorsAndSubmolts() throws Exception {
        DiscoveredEntities discovered = new DiscoveredEntities();

        extractor.collectFromPosts(items("""
                [
                  {"id": "p1", "author": {"name": "alice"}, "submolt": "general"},
                  {"id": "p2", "author_name": "bob", "submolt": {"name": "tech", "display_name": "Tech"}},
                  {"id": "p3"}
                ]
                """), discovered);

        assertEquals(List.of("alice", "bob"), new ArrayList<>(discovered.agentNames()));
        assertEquals(List.of("general", "tech"), new ArrayList<>(discovered.submoltNames()));
    }

    @Test
    void collectFromPosts_shouldKeepRichestSubmolt() throws Exception {
        DiscoveredEntities discovered = new DiscoveredEntities();

        extractor.collectFromPosts(items("""
                [
                  {"id": "p1", "submolt": {"name": "tech", "display_name": "Tech", "subscriber_count": 10}},
                  {"id": "p2", "submolt": "tech"},
                  {"id": "p3", "submolt": {"name": "tech", "description": "all things tech"}}
                ]
                """), discovered);

        SubmoltRow tech = discovered.submolts().iterator().next();
        assertEquals(1, discovered.submolts().size());
        assertEquals("Tech", tech.displayName());
        assertEquals("all things tech", tech.description());
        assertEquals(10L, tech.subscriberCount());
    }

    // -- Comments --

    @Test
    void collectFromComments_shouldWalkNestedReplies() throws Exception {
        DiscoveredEntities discovered = new DiscoveredEntities();

        extractor.collectFromComments(items("""
                [{"id": "c1", "author": {"name": "carol"}, "replies": [
                  {"id": "c2", "author_name": "dave", "replies": [{"id": "c3", "author": "erin"}]}
                ]}]
                """), discovered);

        assertEquals(List.of("carol", "dave", "erin"), new ArrayList<>(discovered.agentNames()));
    }

    // -- Moderators --

    @Test
    void moderators_shouldAcceptEveryWrapperShape() throws Exception {
        List<ModeratorRow> rows = extractor.moderators(items("""
                [
                  {"name": "alice", "role": "owner"},
                  {"agent_name": "bob"},
                  {"agent": "carol"},
                  {"agent": {"name": "dave", "karma": 3}, "role": "moderator"},
                  {"role": "moderator"},
                  "junk"
                ]
                """));

        assertEquals(List.of("alice", "bob", "carol", "dave"),
                rows.stream().map(ModeratorRow::name).collect(Collectors.toList()));
        assertEquals("owner", rows.get(0).role());
        assertEquals(ModeratorRow.DEFAULT_ROLE, rows.get(1).role());
        assertEquals(3L, rows.get(3).agent().karma());
    }
}
