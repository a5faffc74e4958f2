package de.bsommerfeld.moltgraph.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.moltgraph.core.domain.AgentRow;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.PostRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;
import de.bsommerfeld.moltgraph.core.domain.XAccountRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SqlGraphStore against a real temporary SQLite
 * database: node merge rules, edge reconciliation, comment trees and crawl
 * bookkeeping.
 */
class SqlGraphStoreTest {

    private static final Instant T1 = Instant.parse("2026-02-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-02-01T11:00:00Z");
    private static final Instant T3 = Instant.parse("2026-02-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private SqlGraphStore store;

    @BeforeEach
    void setUp() {
        // small batches so chunking is exercised
        store = new SqlGraphStore(tempDir.resolve("graph.db"), 3, 2, Clock.fixed(T3, ZoneOffset.UTC));
    }

    // -- Schema --

    @Test
    void constructor_shouldBeIdempotentOnExistingDatabase() {
        store.upsertAgents(List.of(AgentRow.named("alice")), T1, false);

        SqlGraphStore reopened = new SqlGraphStore(tempDir.resolve("graph.db"), 3, 2, Clock.systemUTC());
        assertEquals(1, reopened.countNodes(NodeLabel.AGENT));
    }

    @Test
    void constructor_shouldCreateMissingParentDirectories() {
        SqlGraphStore nested = new SqlGraphStore(tempDir.resolve("a/b/graph.db"), 3, 2, Clock.systemUTC());
        assertEquals(0, nested.countNodes(NodeLabel.POST));
        assertTrue(tempDir.resolve("a/b/graph.db").toFile().exists());
    }

    // -- Agent merge rules --

    @Test
    void upsertAgents_shouldBeIdempotentExceptLastSeen() {
        store.upsertAgents(List.of(agent("alice", 5L)), T1, false);
        store.upsertAgents(List.of(agent("alice", 5L)), T2, false);

        GraphNode alice = store.findNode(NodeLabel.AGENT, "alice").orElseThrow();
        assertEquals(1, store.countNodes(NodeLabel.AGENT));
        assertEquals(5L, alice.longValue("karma"));
        assertEquals(T1, alice.firstSeenAt());
        assertEquals(T2, alice.lastSeenAt());
    }

    @Test
    void upsertAgents_shouldKeepStoredValueWhenFieldIsNull() {
        store.upsertAgents(List.of(agent("alice", 5L)), T1, false);
        store.upsertAgents(List.of(agent("alice", null)), T2, false);

        assertEquals(5L, store.findNode(NodeLabel.AGENT, "alice").orElseThrow().longValue("karma"));
    }

    @Test
    void upsertAgents_shouldOverwriteWithNewNonNullValue() {
        store.upsertAgents(List.of(agent("alice", 5L)), T1, false);
        store.upsertAgents(List.of(agent("alice", 9L)), T2, false);

        assertEquals(9L, store.findNode(NodeLabel.AGENT, "alice").orElseThrow().longValue("karma"));
    }

    @Test
    void upsertAgents_shouldNotMoveLastSeenBackwards() {
        store.upsertAgents(List.of(AgentRow.named("alice")), T2, false);
        store.upsertAgents(List.of(AgentRow.named("alice")), T1, false);

        assertEquals(T2, store.findNode(NodeLabel.AGENT, "alice").orElseThrow().lastSeenAt());
    }

    @Test
    void upsertAgents_shouldMarkProfileFetchOnlyWhenRequested() {
        store.upsertAgents(List.of(AgentRow.named("alice")), T1, false);
        assertNull(store.findNode(NodeLabel.AGENT, "alice").orElseThrow().instant("profile_last_fetched_at"));

        store.upsertAgents(List.of(AgentRow.named("alice")), T2, true);
        assertEquals(T2, store.findNode(NodeLabel.AGENT, "alice").orElseThrow().instant("profile_last_fetched_at"));

        store.upsertAgents(List.of(AgentRow.named("alice")), T3, false);
        assertEquals(T2, store.findNode(NodeLabel.AGENT, "alice").orElseThrow().instant("profile_last_fetched_at"));
    }

    @Test
    void upsertAgents_shouldChunkLargeCollections() {
        List<AgentRow> agents = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            agents.add(AgentRow.named("agent" + i));
        }
        assertEquals(10, store.upsertAgents(agents, T1, false));
        assertEquals(10, store.countNodes(NodeLabel.AGENT));
    }

    @Test
    void upsertAgents_shouldReturnZeroForEmptyInput() {
        assertEquals(0, store.upsertAgents(List.of(), T1, false));
    }

    // -- Posts --

    @Test
    void upsertPosts_shouldCreateAuthorSubmoltAndEdges() {
        store.upsertPosts(List.of(post("p1", "alice", "general", null)), T1);

        assertTrue(store.findNode(NodeLabel.AGENT, "alice").isPresent());
        assertTrue(store.findNode(NodeLabel.SUBMOLT, "general").isPresent());
        assertEquals(1, store.findRelationships(RelType.AUTHORED, "alice", "p1").size());
        assertEquals(1, store.findRelationships(RelType.IN_SUBMOLT, "p1", "general").size());
    }

    @Test
    void upsertPosts_shouldSkipEdgesForMissingAuthorAndSubmolt() {
        store.upsertPosts(List.of(post("p1", null, null, null)), T1);

        assertTrue(store.findNode(NodeLabel.POST, "p1").isPresent());
        assertTrue(store.findRelationships(RelType.AUTHORED, null, "p1").isEmpty());
        assertTrue(store.findRelationships(RelType.IN_SUBMOLT, "p1", null).isEmpty());
    }

    @Test
    void upsertPosts_shouldReplaceObservationTimeFallbackWithSourceCreatedAt() {
        Instant source = Instant.parse("2026-01-15T08:00:00Z");

        store.upsertPosts(List.of(post("p1", "alice", "general", null)), T1);
        assertEquals(T1, store.findNode(NodeLabel.POST, "p1").orElseThrow().instant("created_at"));

        store.upsertPosts(List.of(post("p1", "alice", "general", source)), T2);
        assertEquals(source, store.findNode(NodeLabel.POST, "p1").orElseThrow().instant("created_at"));

        store.upsertPosts(List.of(post("p1", "alice", "general", null)), T3);
        assertEquals(source, store.findNode(NodeLabel.POST, "p1").orElseThrow().instant("created_at"));
    }

    @Test
    void upsertPosts_shouldBeIdempotentAcrossRepeatedCalls() {
        List<PostRow> posts = List.of(
                post("p1", "alice", "general", null),
                post("p2", "bob", "general", null),
                post("p3", "alice", "memes", null));
        store.upsertPosts(posts, T1);
        store.upsertPosts(posts, T2);

        assertEquals(3, store.countNodes(NodeLabel.POST));
        assertEquals(2, store.countNodes(NodeLabel.AGENT));
        assertEquals(2, store.countNodes(NodeLabel.SUBMOLT));
        assertEquals(2, store.findRelationships(RelType.AUTHORED, "alice", null).size());
        GraphNode p1 = store.findNode(NodeLabel.POST, "p1").orElseThrow();
        assertEquals(T1, p1.firstSeenAt());
        assertEquals(T2, p1.lastSeenAt());
    }

    @Test
    void upsertPosts_shouldStoreModerationTagsVerbatim() throws Exception {
        PostRow tagged = PostRow.from(mapper.readTree(
                "{\"id\": \"p1\", \"is_spam\": \"suspected\", \"is_deleted\": 1, \"verification_status\": \"pending\"}"))
                .orElseThrow();

        store.upsertPosts(List.of(tagged), T1);
        store.upsertPosts(List.of(post("p1", null, null, null)), T2);

        GraphNode p1 = store.findNode(NodeLabel.POST, "p1").orElseThrow();
        assertEquals("suspected", p1.text("is_spam"));
        assertEquals("1", p1.text("is_deleted"));
        assertEquals("pending", p1.text("verification_status"));
    }

    // -- Comments --

    @Test
    void upsertComments_shouldStoreModerationTagsVerbatim() throws Exception {
        List<JsonNode> roots = List.of(mapper.readTree(
                "{\"id\": \"c1\", \"is_spam\": \"flagged\", \"is_deleted\": true}"));

        store.upsertComments("p1", roots, T1);

        GraphNode c1 = store.findNode(NodeLabel.COMMENT, "c1").orElseThrow();
        assertEquals("flagged", c1.text("is_spam"));
        assertEquals("true", c1.text("is_deleted"));
    }

    @Test
    void upsertComments_shouldLinkRepliesToParentsInLaterBatches() throws Exception {
        store.upsertPosts(List.of(post("p1", "alice", "general", null)), T1);
        // flat listing, replies before their parent; batch size is 3
        List<JsonNode> flat = new ArrayList<>();
        mapper.readTree("""
                [
                  {"id": "r1", "parent_id": "top"},
                  {"id": "r2", "parent_id": "top"},
                  {"id": "r3", "parent_id": "top"},
                  {"id": "r4", "parent_id": "r1"},
                  {"id": "top"}
                ]
                """).forEach(flat::add);

        assertEquals(5, store.upsertComments("p1", flat, T2));

        assertEquals(3, store.findRelationships(RelType.REPLY_TO, null, "top").size());
        assertEquals(1, store.findRelationships(RelType.REPLY_TO, "r4", "r1").size());
        assertEquals(5, store.findRelationships(RelType.ON_POST, null, "p1").size());
    }

    @Test
    void upsertComments_shouldFlattenThreeLevelTree() throws Exception {
        store.upsertPosts(List.of(post("p1", "alice", "general", null)), T1);

        JsonNode tree = mapper.readTree("""
                [
                  {"id": "c1", "content": "root one", "author": {"name": "bob"}, "replies": [
                    {"id": "c2", "content": "reply", "author": {"name": "carol"}, "replies": [
                      {"id": "c3", "content": "deep", "author": {"name": "bob"}}
                    ]},
                    {"id": "c4", "content": "sibling", "author_name": "dave"}
                  ]},
                  {"id": "c5", "content": "root two", "author": {"name": "erin"}, "replies": [
                    {"id": "c6", "content": "answer", "author": {"name": "alice"}}
                  ]},
                  {"id": "c7", "content": "lonely"}
                ]
                """);
        List<JsonNode> roots = new ArrayList<>();
        tree.forEach(roots::add);

        assertEquals(7, store.upsertComments("p1", roots, T2));
        assertEquals(7, store.countNodes(NodeLabel.COMMENT));

        Map<String, String> parents = new HashMap<>();
        for (String id : List.of("c1", "c2", "c3", "c4", "c5", "c6", "c7")) {
            GraphNode node = store.findNode(NodeLabel.COMMENT, id).orElseThrow();
            parents.put(id, node.text("parent_id"));
            assertEquals("p1", node.text("post_id"));
        }
        assertNull(parents.get("c1"));
        assertEquals("c1", parents.get("c2"));
        assertEquals("c2", parents.get("c3"));
        assertEquals("c1", parents.get("c4"));
        assertNull(parents.get("c5"));
        assertEquals("c5", parents.get("c6"));
        assertNull(parents.get("c7"));
        assertEquals("deep", store.findNode(NodeLabel.COMMENT, "c3").orElseThrow().text("content"));

        assertEquals(1, store.findRelationships(RelType.REPLY_TO, "c3", "c2").size());
        assertEquals(4, store.findRelationships(RelType.REPLY_TO, null, null).size());
        assertEquals(7, store.findRelationships(RelType.ON_POST, null, "p1").size());
        // c7 has no author
        assertEquals(6, store.findRelationships(RelType.AUTHORED, null, null).stream()
                .filter(r -> r.toLabel() == NodeLabel.COMMENT).count());
    }

    @Test
    void upsertComments_shouldSkipOnPostWhenPostUnknown() throws Exception {
        List<JsonNode> roots = List.of(mapper.readTree("{\"id\": \"c1\", \"content\": \"orphan\"}"));

        store.upsertComments("missing", roots, T1);

        assertTrue(store.findNode(NodeLabel.COMMENT, "c1").isPresent());
        assertTrue(store.findRelationships(RelType.ON_POST, "c1", null).isEmpty());
    }

    // -- Moderator reconciliation --

    @Test
    void reconcileModerators_shouldCloseRemovedAndOpenAdded() {
        store.reconcileModerators("general", mods("alice", "bob"), T1);
        store.reconcileModerators("general", mods("bob", "carol"), T2);

        Map<String, Relationship> edges = moderatesOf("general");
        assertEquals(3, edges.size());
        assertFalse(edges.get("alice").isOpen());
        assertEquals(T2, edges.get("alice").endedAt());
        assertTrue(edges.get("bob").isOpen());
        assertEquals(T1, edges.get("bob").firstSeenAt());
        assertEquals(T2, edges.get("bob").lastSeenAt());
        assertTrue(edges.get("carol").isOpen());
        assertEquals(T2, edges.get("carol").firstSeenAt());
    }

    @Test
    void reconcileModerators_shouldReopenReaddedMember() {
        store.reconcileModerators("general", mods("alice", "bob"), T1);
        store.reconcileModerators("general", mods("bob"), T2);
        store.reconcileModerators("general", mods("alice", "bob"), T3);

        Relationship alice = moderatesOf("general").get("alice");
        assertTrue(alice.isOpen());
        assertEquals(T1, alice.firstSeenAt());
        assertEquals(T3, alice.lastSeenAt());
    }

    @Test
    void reconcileModerators_shouldStoreRoleAndUpsertAgents() {
        store.reconcileModerators("general",
                List.of(new ModeratorRow("alice", "owner", AgentRow.named("alice"))), T1);

        assertEquals("owner", moderatesOf("general").get("alice").role());
        assertTrue(store.findNode(NodeLabel.AGENT, "alice").isPresent());
        assertTrue(store.findNode(NodeLabel.SUBMOLT, "general").isPresent());
    }

    @Test
    void reconcileModerators_shouldNotTouchOtherSubmolts() {
        store.reconcileModerators("general", mods("alice"), T1);
        store.reconcileModerators("memes", mods("bob"), T2);

        assertTrue(moderatesOf("general").get("alice").isOpen());
    }

    // -- Similar agents --

    @Test
    void reconcileSimilarAgents_shouldKeepSourcesIndependent() {
        store.reconcileSimilarAgents("alice", List.of("bob", "carol"), "html_profile", T1);
        store.reconcileSimilarAgents("alice", List.of("bob"), "api", T1);
        store.reconcileSimilarAgents("alice", List.of("dave"), "html_profile", T2);

        List<Relationship> edges = store.findRelationships(RelType.SIMILAR_TO, "alice", null);
        assertEquals(4, edges.size());
        Relationship apiBob = edges.stream()
                .filter(r -> r.source().equals("api") && r.toKey().equals("bob"))
                .findFirst().orElseThrow();
        assertTrue(apiBob.isOpen());
        Relationship htmlBob = edges.stream()
                .filter(r -> r.source().equals("html_profile") && r.toKey().equals("bob"))
                .findFirst().orElseThrow();
        assertFalse(htmlBob.isOpen());
    }

    @Test
    void reconcileSimilarAgents_shouldIgnoreSelfAndBlankNames() {
        store.reconcileSimilarAgents("alice", List.of("alice", " ", "bob", "bob"), "html_profile", T1);

        List<Relationship> edges = store.findRelationships(RelType.SIMILAR_TO, "alice", null);
        assertEquals(1, edges.size());
        assertEquals("bob", edges.get(0).toKey());
    }

    // -- X owner --

    @Test
    void upsertXOwner_shouldLinkAgentToAccount() {
        XAccountRow account = XAccountRow.ofHandle("@alice_owner", "https://x.com/alice_owner").orElseThrow();

        store.upsertXOwner("alice", account, T1);

        GraphNode node = store.findNode(NodeLabel.X_ACCOUNT, "alice_owner").orElseThrow();
        assertEquals("https://x.com/alice_owner", node.text("url"));
        assertEquals(1, store.findRelationships(RelType.HAS_OWNER_X, "alice", "alice_owner").size());
    }

    // -- Feed snapshots --

    @Test
    void writeFeedSnapshot_shouldRankPostsFromOne() {
        List<PostRow> posts = List.of(
                post("p1", "alice", "general", null),
                post("p2", "bob", "general", null),
                post("p3", "carol", "memes", null));

        assertEquals(3, store.writeFeedSnapshot("full:abc", "hot", posts, T1));

        GraphNode snapshot = store.findNode(NodeLabel.FEED_SNAPSHOT, "full:abc:hot").orElseThrow();
        assertEquals("hot", snapshot.text("sort"));
        Map<String, Integer> ranks = store.findRelationships(RelType.CONTAINS, "full:abc:hot", null).stream()
                .collect(Collectors.toMap(Relationship::toKey, Relationship::rank));
        assertEquals(Map.of("p1", 1, "p2", 2, "p3", 3), ranks);
        assertEquals(3, store.countNodes(NodeLabel.POST));
    }

    // -- Crawl bookkeeping --

    @Test
    void latestCompletedCutoff_shouldIgnoreUnfinishedCrawls() {
        assertTrue(store.latestCompletedCutoff().isEmpty());

        store.beginCrawl("incremental:1", CrawlMode.INCREMENTAL, T1, T1);
        store.endCrawl("incremental:1", T2);
        store.beginCrawl("incremental:2", CrawlMode.INCREMENTAL, T2, T2);

        assertEquals(Optional.of(T1), store.latestCompletedCutoff());
    }

    @Test
    void findUnfinishedCrawl_shouldReturnMostRecentOfSameMode() {
        store.beginCrawl("full:old", CrawlMode.FULL, T1, T1);
        store.beginCrawl("full:new", CrawlMode.FULL, T2, T2);
        store.beginCrawl("incremental:x", CrawlMode.INCREMENTAL, T3, T3);

        CrawlRecord record = store.findUnfinishedCrawl(CrawlMode.FULL).orElseThrow();
        assertEquals("full:new", record.id());
        assertEquals(CrawlMode.FULL, record.mode());
        assertNull(record.endedAt());

        store.endCrawl("full:new", T3);
        assertEquals("full:old", store.findUnfinishedCrawl(CrawlMode.FULL).orElseThrow().id());
    }

    @Test
    void endCrawl_shouldSetEndedAt() {
        store.beginCrawl("full:1", CrawlMode.FULL, null, T1);
        store.endCrawl("full:1", T2);

        GraphNode crawl = store.findNode(NodeLabel.CRAWL, "full:1").orElseThrow();
        assertEquals(T2, crawl.instant("ended_at"));
        assertNull(crawl.instant("cutoff"));
    }

    // -- Checkpoints --

    @Test
    void loadCheckpoint_shouldDefaultToZero() {
        assertEquals(0, store.loadCheckpoint("full:1", "posts_offset_new_na"));
    }

    @Test
    void saveCheckpoint_shouldNeverDecrease() {
        store.beginCrawl("full:1", CrawlMode.FULL, null, T1);
        store.saveCheckpoint("full:1", "posts_offset_new_na", 100);
        store.saveCheckpoint("full:1", "posts_offset_new_na", 50);

        assertEquals(100, store.loadCheckpoint("full:1", "posts_offset_new_na"));

        store.saveCheckpoint("full:1", "posts_offset_new_na", 150);
        assertEquals(150, store.loadCheckpoint("full:1", "posts_offset_new_na"));
    }

    @Test
    void saveCheckpoint_shouldKeepViewsAndCrawlsApart() {
        store.saveCheckpoint("full:1", "posts_offset_new_na", 100);
        store.saveCheckpoint("full:1", "posts_offset_top_day", 40);
        store.saveCheckpoint("full:2", "posts_offset_new_na", 10);

        assertEquals(100, store.loadCheckpoint("full:1", "posts_offset_new_na"));
        assertEquals(40, store.loadCheckpoint("full:1", "posts_offset_top_day"));
        assertEquals(10, store.loadCheckpoint("full:2", "posts_offset_new_na"));
    }

    @Test
    void saveCheckpoint_shouldTouchCrawl() {
        store.beginCrawl("full:1", CrawlMode.FULL, null, T1);
        store.saveCheckpoint("full:1", "posts_offset_new_na", 50);

        assertEquals(T3, store.findNode(NodeLabel.CRAWL, "full:1").orElseThrow().instant("last_updated_at"));
    }

    // -- Profile staleness --

    @Test
    void agentsNeedingProfileRefresh_shouldReturnNeverFetchedAndStale() {
        Instant now = Instant.parse("2026-02-20T00:00:00Z");
        store.upsertAgents(List.of(AgentRow.named("never")), T1, false);
        store.upsertAgents(List.of(AgentRow.named("stale")), T1, true);
        store.upsertAgents(List.of(AgentRow.named("fresh")), now.minus(Duration.ofDays(1)), true);

        List<String> names = store.agentsNeedingProfileRefresh(Duration.ofDays(7), 0, now);

        assertEquals(List.of("never", "stale"), names);
    }

    @Test
    void agentsNeedingProfileRefresh_shouldHonourLimit() {
        store.upsertAgents(List.of(AgentRow.named("a"), AgentRow.named("b"), AgentRow.named("c")), T1, false);

        assertEquals(2, store.agentsNeedingProfileRefresh(Duration.ofDays(7), 2, T3).size());
    }

    // -- Helpers --

    private Map<String, Relationship> moderatesOf(String submolt) {
        return store.findRelationships(RelType.MODERATES, null, submolt).stream()
                .collect(Collectors.toMap(Relationship::fromKey, Function.identity()));
    }

    private static List<ModeratorRow> mods(String... names) {
        List<ModeratorRow> rows = new ArrayList<>();
        for (String name : names) {
            rows.add(new ModeratorRow(name, ModeratorRow.DEFAULT_ROLE, AgentRow.named(name)));
        }
        return rows;
    }

    private static AgentRow agent(String name, Long karma) {
        return new AgentRow(name, null, null, null, null, null, karma, null, null,
                null, null, null, null, null, null, null, null);
    }

    private static PostRow post(String id, String author, String submolt, Instant createdAt) {
        return new PostRow(id, "Title " + id, "content", null,
                submolt, null, "text", 1L, 1L, 0L, 0L, null,
                false, false, null, null, null, createdAt, null,
                author != null ? AgentRow.named(author) : null,
                submolt != null ? SubmoltRow.named(submolt) : null);
    }
}
