package de.bsommerfeld.moltgraph.db;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.moltgraph.core.domain.AgentRow;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.PostRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;
import de.bsommerfeld.moltgraph.core.domain.XAccountRow;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the temporal graph.
 *
 * <h3>Write semantics</h3>
 * <ul>
 * <li>Nodes merge on their natural key. {@code first_seen_at} is set once,
 * {@code last_seen_at} advances with every observation.</li>
 * <li>Per-field last-write-wins: a {@code null} field in a row never
 * overwrites a stored value.</li>
 * <li>{@code created_at} is the source-declared creation time, else the
 * first observation time. A later row that does carry a creation time
 * replaces the fallback.</li>
 * <li>Nothing is ever deleted. Time-varying edges are closed by setting
 * {@code ended_at} and reopened by clearing it.</li>
 * </ul>
 *
 * Every write method commits in bounded batches, each batch one transaction.
 * Failures surface as {@link GraphStoreException}; batches committed before
 * the failure stay committed.
 */
public interface GraphStore extends CheckpointStore {

    // =====================================================================
    // Node upserts
    // =====================================================================

    /**
     * @param markProfile set {@code profile_last_fetched_at} to
     *                    {@code observedAt}, for rows that came from the
     *                    profile endpoint
     * @return rows written
     */
    int upsertAgents(Collection<AgentRow> agents, Instant observedAt, boolean markProfile);

    int upsertSubmolts(Collection<SubmoltRow> submolts, Instant observedAt);

    /**
     * Writes the posts plus their embedded author (as Agent) and submolt, and
     * the {@code AUTHORED} and {@code IN_SUBMOLT} edges. A post without author
     * or submolt is still stored, just without the corresponding edge.
     */
    int upsertPosts(Collection<PostRow> posts, Instant observedAt);

    /**
     * Flattens a reply tree of arbitrary depth and writes every comment, its
     * author and the {@code AUTHORED}, {@code ON_POST} (when the post is
     * stored) and {@code REPLY_TO} (when the parent comment is stored) edges.
     *
     * @param postId post the tree belongs to
     * @param tree   top-level comments with nested {@code replies}
     * @return comments written
     */
    int upsertComments(String postId, List<JsonNode> tree, Instant observedAt);

    // =====================================================================
    // Reconciled edge sets
    // =====================================================================

    /**
     * Replaces the current moderator set of a submolt. Open {@code MODERATES}
     * edges whose agent is not in {@code moderators} are closed; listed
     * moderators are merged (agent node included) and reopened. One
     * transaction.
     */
    void reconcileModerators(String submoltName, List<ModeratorRow> moderators, Instant observedAt);

    /**
     * Replaces the current {@code SIMILAR_TO} set of an agent for one
     * discovery source. Other sources are untouched. Self-references and
     * duplicates are dropped. One transaction.
     */
    void reconcileSimilarAgents(String agentName, Collection<String> similarNames, String source,
            Instant observedAt);

    /**
     * Merges the X account and the {@code HAS_OWNER_X} edge from the agent.
     */
    void upsertXOwner(String agentName, XAccountRow account, Instant observedAt);

    /**
     * Records a ranked feed listing as {@code FeedSnapshot {crawlId:sort}} with
     * {@code CONTAINS} edges carrying the 1-based rank. Posts are merged like
     * {@link #upsertPosts}.
     *
     * @return posts in the snapshot
     */
    int writeFeedSnapshot(String crawlId, String sort, List<PostRow> posts, Instant observedAt);

    // =====================================================================
    // Crawl bookkeeping
    // =====================================================================

    /**
     * Creates the crawl record, or touches it when resuming an existing id.
     */
    void beginCrawl(String crawlId, CrawlMode mode, Instant cutoff, Instant startedAt);

    void endCrawl(String crawlId, Instant endedAt);

    /**
     * Cutoff of the most recent completed crawl of any mode.
     */
    Optional<Instant> latestCompletedCutoff();

    /**
     * The most recently started crawl of {@code mode} that never ended.
     */
    Optional<CrawlRecord> findUnfinishedCrawl(CrawlMode mode);

    /**
     * Agents never profiled, or profiled longer than {@code staleness} before
     * {@code now}, least recently profiled first.
     *
     * @param limit maximum names, {@code 0} for no cap
     */
    List<String> agentsNeedingProfileRefresh(Duration staleness, int limit, Instant now);

    // =====================================================================
    // Reads
    // =====================================================================

    Optional<GraphNode> findNode(NodeLabel label, String key);

    /**
     * Edges of {@code type}, optionally filtered by endpoint key.
     *
     * @param fromKey {@code null} for any
     * @param toKey   {@code null} for any
     */
    List<Relationship> findRelationships(RelType type, String fromKey, String toKey);

    long countNodes(NodeLabel label);
}
