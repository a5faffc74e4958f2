package de.bsommerfeld.moltgraph.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.config.DatabaseConfig;
import de.bsommerfeld.moltgraph.core.domain.AgentRow;
import de.bsommerfeld.moltgraph.core.domain.CommentRow;
import de.bsommerfeld.moltgraph.core.domain.CommentTree;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.PostRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;
import de.bsommerfeld.moltgraph.core.domain.XAccountRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed {@link GraphStore}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Graph layout</h3>
 * One table per {@link NodeLabel} and a single {@code relationships} table
 * keyed by {@code (type, from, to, source)}. Timestamps are stored as epoch
 * milliseconds so ordering comparisons are numeric.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level anyway, and a crawl run is
 * single-threaded.
 *
 * <h3>Transaction boundaries</h3>
 * Bulk upserts are split into batches of {@link DatabaseConfig#getBatchSize()}
 * rows ({@link DatabaseConfig#getPostBatchSize()} for posts, which fan out into
 * agents, submolts and edges), each batch one transaction with
 * rollback-on-failure. Reconciliations and feed snapshots are a single
 * transaction each.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlGraphStore implements GraphStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlGraphStore.class);

    private static final String NO_SOURCE = "";

    private final String dbUrl;
    private final int batchSize;
    private final int postBatchSize;
    private final Clock clock;

    public SqlGraphStore(Path databaseFile, DatabaseConfig config) {
        this(databaseFile, config.getBatchSize(), config.getPostBatchSize(), Clock.systemUTC());
    }

    SqlGraphStore(Path databaseFile, int batchSize, int postBatchSize, Clock clock) {
        this.batchSize = Math.max(1, batchSize);
        this.postBatchSize = Math.max(1, postBatchSize);
        this.clock = clock;
        Path absolute = databaseFile.toAbsolutePath();
        try {
            if (absolute.getParent() != null && !Files.exists(absolute.getParent())) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new GraphStoreException("Failed to create database directory " + absolute.getParent(), e);
        }
        this.dbUrl = "jdbc:sqlite:" + absolute;
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    private void initialize() {
        LOG.info("Initializing graph database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new GraphStoreException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}, one statement at a time.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new SQLException("schema.sql not found on classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (sql.trim().isEmpty())
                    continue;
                stmt.execute(sql.trim());
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to " + operation, e);
        }
    }

    private <T> T query(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.run(conn);
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to " + operation, e);
        }
    }

    // =====================================================================
    // Node upserts
    // =====================================================================

    @Override
    public int upsertAgents(Collection<AgentRow> agents, Instant observedAt, boolean markProfile) {
        if (agents == null || agents.isEmpty())
            return 0;

        for (List<AgentRow> chunk : Lists.partition(new ArrayList<>(agents), batchSize)) {
            inTransaction("upsert agents", conn -> {
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-agent"))) {
                    for (AgentRow agent : chunk) {
                        bindAgent(ps, agent, observedAt, markProfile);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return null;
            });
        }
        LOG.debug("[DB] Upserted {} agents (profile={})", agents.size(), markProfile);
        return agents.size();
    }

    @Override
    public int upsertSubmolts(Collection<SubmoltRow> submolts, Instant observedAt) {
        if (submolts == null || submolts.isEmpty())
            return 0;

        for (List<SubmoltRow> chunk : Lists.partition(new ArrayList<>(submolts), batchSize)) {
            inTransaction("upsert submolts", conn -> {
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-submolt"))) {
                    for (SubmoltRow submolt : chunk) {
                        bindSubmolt(ps, submolt, observedAt);
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return null;
            });
        }
        LOG.debug("[DB] Upserted {} submolts", submolts.size());
        return submolts.size();
    }

    @Override
    public int upsertPosts(Collection<PostRow> posts, Instant observedAt) {
        if (posts == null || posts.isEmpty())
            return 0;

        for (List<PostRow> chunk : Lists.partition(new ArrayList<>(posts), postBatchSize)) {
            inTransaction("upsert posts", conn -> {
                writePosts(conn, chunk, observedAt);
                return null;
            });
        }
        LOG.debug("[DB] Upserted {} posts", posts.size());
        return posts.size();
    }

    /**
     * Writes posts with their embedded author and submolt and the
     * {@code AUTHORED}/{@code IN_SUBMOLT} edges on an open connection.
     */
    private void writePosts(Connection conn, List<PostRow> posts, Instant obs) throws SQLException {
        try (PreparedStatement psAgent = conn.prepareStatement(SqlLoader.load("upsert-agent"));
                PreparedStatement psSubmolt = conn.prepareStatement(SqlLoader.load("upsert-submolt"));
                PreparedStatement psPost = conn.prepareStatement(SqlLoader.load("upsert-post"));
                PreparedStatement psRel = conn.prepareStatement(SqlLoader.load("upsert-relationship"))) {

            for (PostRow post : posts) {
                if (post.author() != null) {
                    bindAgent(psAgent, post.author(), obs, false);
                    psAgent.addBatch();
                    bindRelationship(psRel, RelType.AUTHORED, NodeLabel.AGENT, post.author().name(),
                            NodeLabel.POST, post.id(), NO_SOURCE, null, null, obs);
                    psRel.addBatch();
                }
                if (post.submolt() != null) {
                    bindSubmolt(psSubmolt, post.submolt(), obs);
                    psSubmolt.addBatch();
                    bindRelationship(psRel, RelType.IN_SUBMOLT, NodeLabel.POST, post.id(),
                            NodeLabel.SUBMOLT, post.submolt().name(), NO_SOURCE, null, null, obs);
                    psRel.addBatch();
                }
                bindPost(psPost, post, obs);
                psPost.addBatch();
            }

            psAgent.executeBatch();
            psSubmolt.executeBatch();
            psPost.executeBatch();
            psRel.executeBatch();
        }
    }

    @Override
    public int upsertComments(String postId, List<JsonNode> tree, Instant observedAt) {
        if (tree == null || tree.isEmpty())
            return 0;

        List<CommentRow> rows = CommentTree.flatten(tree, postId, null);
        List<List<CommentRow>> chunks = Lists.partition(rows, batchSize);
        for (List<CommentRow> chunk : chunks) {
            inTransaction("upsert comments", conn -> {
                writeCommentNodes(conn, chunk, observedAt);
                return null;
            });
        }
        // edges last: a flat list may name a parent that sits in a later chunk
        for (List<CommentRow> chunk : chunks) {
            inTransaction("link comments", conn -> {
                writeCommentEdges(conn, chunk, observedAt);
                return null;
            });
        }
        LOG.debug("[DB] Upserted {} comments for post {}", rows.size(), postId);
        return rows.size();
    }

    private void writeCommentNodes(Connection conn, List<CommentRow> comments, Instant obs) throws SQLException {
        try (PreparedStatement psAgent = conn.prepareStatement(SqlLoader.load("upsert-agent"));
                PreparedStatement psComment = conn.prepareStatement(SqlLoader.load("upsert-comment"))) {
            for (CommentRow comment : comments) {
                if (comment.author() != null) {
                    bindAgent(psAgent, comment.author(), obs, false);
                    psAgent.addBatch();
                }
                bindComment(psComment, comment, obs);
                psComment.addBatch();
            }
            psAgent.executeBatch();
            psComment.executeBatch();
        }
    }

    private void writeCommentEdges(Connection conn, List<CommentRow> comments, Instant obs) throws SQLException {
        Map<String, Boolean> postExists = new HashMap<>();
        try (PreparedStatement psRel = conn.prepareStatement(SqlLoader.load("upsert-relationship"))) {
            for (CommentRow comment : comments) {
                if (comment.author() != null) {
                    bindRelationship(psRel, RelType.AUTHORED, NodeLabel.AGENT, comment.author().name(),
                            NodeLabel.COMMENT, comment.id(), NO_SOURCE, null, null, obs);
                    psRel.addBatch();
                }
                String postId = comment.postId();
                if (postId != null && postExists.computeIfAbsent(postId, id -> exists(conn, "exists-post", id))) {
                    bindRelationship(psRel, RelType.ON_POST, NodeLabel.COMMENT, comment.id(),
                            NodeLabel.POST, postId, NO_SOURCE, null, null, obs);
                    psRel.addBatch();
                }
                String parentId = comment.parentId();
                if (parentId != null && !parentId.equals(comment.id()) && exists(conn, "exists-comment", parentId)) {
                    bindRelationship(psRel, RelType.REPLY_TO, NodeLabel.COMMENT, comment.id(),
                            NodeLabel.COMMENT, parentId, NO_SOURCE, null, null, obs);
                    psRel.addBatch();
                }
            }
            psRel.executeBatch();
        }
    }

    private boolean exists(Connection conn, String statement, String key) {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to check " + statement + " for " + key, e);
        }
    }

    // =====================================================================
    // Reconciled edge sets
    // =====================================================================

    @Override
    public void reconcileModerators(String submoltName, List<ModeratorRow> moderators, Instant observedAt) {
        Map<String, String> roles = new LinkedHashMap<>();
        List<AgentRow> agents = new ArrayList<>();
        for (ModeratorRow moderator : moderators) {
            roles.put(moderator.name(), moderator.role());
            agents.add(moderator.agent());
        }

        inTransaction("reconcile moderators of " + submoltName, conn -> {
            try (PreparedStatement psSubmolt = conn.prepareStatement(SqlLoader.load("upsert-submolt"));
                    PreparedStatement psAgent = conn.prepareStatement(SqlLoader.load("upsert-agent"))) {
                bindSubmolt(psSubmolt, SubmoltRow.named(submoltName), observedAt);
                psSubmolt.executeUpdate();
                for (AgentRow agent : agents) {
                    bindAgent(psAgent, agent, observedAt, false);
                    psAgent.addBatch();
                }
                psAgent.executeBatch();
            }
            reconcile(conn, RelType.MODERATES, NodeLabel.SUBMOLT, submoltName, false,
                    NodeLabel.AGENT, NO_SOURCE, roles, observedAt);
            return null;
        });
        LOG.debug("[DB] Reconciled {} moderators for submolt {}", roles.size(), submoltName);
    }

    @Override
    public void reconcileSimilarAgents(String agentName, Collection<String> similarNames, String source,
            Instant observedAt) {
        Set<String> members = new LinkedHashSet<>();
        for (String name : similarNames) {
            if (name != null && !name.isBlank() && !name.equals(agentName)) {
                members.add(name);
            }
        }
        Map<String, String> noRoles = new LinkedHashMap<>();
        members.forEach(name -> noRoles.put(name, null));

        inTransaction("reconcile similar agents of " + agentName, conn -> {
            try (PreparedStatement psAgent = conn.prepareStatement(SqlLoader.load("upsert-agent"))) {
                bindAgent(psAgent, AgentRow.named(agentName), observedAt, false);
                psAgent.addBatch();
                for (String member : members) {
                    bindAgent(psAgent, AgentRow.named(member), observedAt, false);
                    psAgent.addBatch();
                }
                psAgent.executeBatch();
            }
            reconcile(conn, RelType.SIMILAR_TO, NodeLabel.AGENT, agentName, true,
                    NodeLabel.AGENT, source, noRoles, observedAt);
            return null;
        });
        LOG.debug("[DB] Reconciled {} similar agents ({}) for {}", members.size(), source, agentName);
    }

    /**
     * Two-phase reconciliation of the edge set hanging off one anchor node.
     * Phase 1 closes open edges whose member is no longer listed, phase 2
     * merges and reopens every listed member. Runs on the caller's
     * transaction.
     *
     * @param anchorIsFrom whether the anchor is the edge's start node
     * @param members      member key to edge role ({@code null} for none)
     */
    private void reconcile(Connection conn, RelType type, NodeLabel anchorLabel, String anchorKey,
            boolean anchorIsFrom, NodeLabel memberLabel, String source, Map<String, String> members,
            Instant obs) throws SQLException {

        Set<String> open = new HashSet<>();
        String selectOpen = SqlLoader.load(anchorIsFrom
                ? "select-open-relationships-from"
                : "select-open-relationships-to");
        try (PreparedStatement ps = conn.prepareStatement(selectOpen)) {
            ps.setString(1, type.name());
            ps.setString(2, anchorLabel.label());
            ps.setString(3, anchorKey);
            ps.setString(4, memberLabel.label());
            ps.setString(5, source);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    open.add(rs.getString(1));
                }
            }
        }

        int closed = 0;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("close-relationship"))) {
            for (String member : open) {
                if (members.containsKey(member))
                    continue;
                ps.setLong(1, obs.toEpochMilli());
                ps.setString(2, type.name());
                if (anchorIsFrom) {
                    ps.setString(3, anchorLabel.label());
                    ps.setString(4, anchorKey);
                    ps.setString(5, memberLabel.label());
                    ps.setString(6, member);
                } else {
                    ps.setString(3, memberLabel.label());
                    ps.setString(4, member);
                    ps.setString(5, anchorLabel.label());
                    ps.setString(6, anchorKey);
                }
                ps.setString(7, source);
                ps.addBatch();
                closed++;
            }
            ps.executeBatch();
        }

        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-relationship"))) {
            for (Map.Entry<String, String> member : members.entrySet()) {
                if (anchorIsFrom) {
                    bindRelationship(ps, type, anchorLabel, anchorKey, memberLabel, member.getKey(),
                            source, member.getValue(), null, obs);
                } else {
                    bindRelationship(ps, type, memberLabel, member.getKey(), anchorLabel, anchorKey,
                            source, member.getValue(), null, obs);
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }

        if (closed > 0) {
            LOG.debug("[DB] Closed {} {} edges at {} {}", closed, type, anchorLabel.label(), anchorKey);
        }
    }

    @Override
    public void upsertXOwner(String agentName, XAccountRow account, Instant observedAt) {
        inTransaction("upsert X owner of " + agentName, conn -> {
            try (PreparedStatement psAgent = conn.prepareStatement(SqlLoader.load("upsert-agent"));
                    PreparedStatement psAccount = conn.prepareStatement(SqlLoader.load("upsert-x-account"));
                    PreparedStatement psRel = conn.prepareStatement(SqlLoader.load("upsert-relationship"))) {
                bindAgent(psAgent, AgentRow.named(agentName), observedAt, false);
                psAgent.executeUpdate();

                psAccount.setString(1, account.handle());
                psAccount.setString(2, account.url());
                psAccount.setString(3, account.name());
                psAccount.setString(4, account.bio());
                psAccount.setString(5, account.avatarUrl());
                setLong(psAccount, 6, account.followerCount());
                setLong(psAccount, 7, account.followingCount());
                setBool(psAccount, 8, account.verified());
                psAccount.setLong(9, observedAt.toEpochMilli());
                psAccount.setLong(10, observedAt.toEpochMilli());
                psAccount.executeUpdate();

                bindRelationship(psRel, RelType.HAS_OWNER_X, NodeLabel.AGENT, agentName,
                        NodeLabel.X_ACCOUNT, account.handle(), NO_SOURCE, null, null, observedAt);
                psRel.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public int writeFeedSnapshot(String crawlId, String sort, List<PostRow> posts, Instant observedAt) {
        String snapshotId = crawlId + ":" + sort;
        inTransaction("write feed snapshot " + snapshotId, conn -> {
            if (!posts.isEmpty()) {
                writePosts(conn, posts, observedAt);
            }
            try (PreparedStatement psSnapshot = conn.prepareStatement(SqlLoader.load("upsert-feed-snapshot"));
                    PreparedStatement psRel = conn.prepareStatement(SqlLoader.load("upsert-relationship"))) {
                psSnapshot.setString(1, snapshotId);
                psSnapshot.setString(2, crawlId);
                psSnapshot.setString(3, sort);
                psSnapshot.setLong(4, observedAt.toEpochMilli());
                psSnapshot.setLong(5, observedAt.toEpochMilli());
                psSnapshot.setLong(6, observedAt.toEpochMilli());
                psSnapshot.executeUpdate();

                for (int i = 0; i < posts.size(); i++) {
                    bindRelationship(psRel, RelType.CONTAINS, NodeLabel.FEED_SNAPSHOT, snapshotId,
                            NodeLabel.POST, posts.get(i).id(), NO_SOURCE, null, i + 1, observedAt);
                    psRel.addBatch();
                }
                psRel.executeBatch();
            }
            return null;
        });
        LOG.debug("[DB] Wrote feed snapshot {} with {} posts", snapshotId, posts.size());
        return posts.size();
    }

    // =====================================================================
    // Crawl bookkeeping
    // =====================================================================

    @Override
    public void beginCrawl(String crawlId, CrawlMode mode, Instant cutoff, Instant startedAt) {
        inTransaction("begin crawl " + crawlId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-crawl"))) {
                ps.setString(1, crawlId);
                ps.setString(2, mode.id());
                setInstant(ps, 3, cutoff);
                ps.setLong(4, startedAt.toEpochMilli());
                ps.setLong(5, startedAt.toEpochMilli());
                ps.setLong(6, startedAt.toEpochMilli());
                ps.setLong(7, startedAt.toEpochMilli());
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public void endCrawl(String crawlId, Instant endedAt) {
        inTransaction("end crawl " + crawlId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("end-crawl"))) {
                ps.setLong(1, endedAt.toEpochMilli());
                ps.setLong(2, endedAt.toEpochMilli());
                ps.setLong(3, endedAt.toEpochMilli());
                ps.setString(4, crawlId);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<Instant> latestCompletedCutoff() {
        return query("read latest crawl cutoff", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-latest-completed-cutoff"));
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(getInstant(rs, "cutoff")) : Optional.<Instant>empty();
            }
        });
    }

    @Override
    public Optional<CrawlRecord> findUnfinishedCrawl(CrawlMode mode) {
        return query("find unfinished crawl", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-unfinished-crawl"))) {
                ps.setString(1, mode.id());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        return Optional.<CrawlRecord>empty();
                    return Optional.of(new CrawlRecord(
                            rs.getString("id"),
                            CrawlMode.parse(rs.getString("mode")),
                            getInstant(rs, "cutoff"),
                            getInstant(rs, "started_at"),
                            getInstant(rs, "ended_at"),
                            getInstant(rs, "last_updated_at")));
                }
            }
        });
    }

    @Override
    public int loadCheckpoint(String crawlId, String viewKey) {
        return query("load checkpoint " + viewKey, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-checkpoint"))) {
                ps.setString(1, crawlId);
                ps.setString(2, viewKey);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    @Override
    public void saveCheckpoint(String crawlId, String viewKey, int offset) {
        if (offset < 0)
            return;
        long now = clock.millis();
        inTransaction("save checkpoint " + viewKey, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-checkpoint"));
                    PreparedStatement touch = conn.prepareStatement(SqlLoader.load("touch-crawl"))) {
                ps.setString(1, crawlId);
                ps.setString(2, viewKey);
                ps.setInt(3, offset);
                ps.setLong(4, now);
                ps.executeUpdate();

                touch.setLong(1, now);
                touch.setString(2, crawlId);
                touch.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public List<String> agentsNeedingProfileRefresh(Duration staleness, int limit, Instant now) {
        long threshold = now.minus(staleness).toEpochMilli();
        return query("select agents needing profile refresh", conn -> {
            List<String> names = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-agents-needing-profile"))) {
                ps.setLong(1, threshold);
                // SQLite treats a negative LIMIT as unbounded
                ps.setInt(2, limit > 0 ? limit : -1);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
            }
            return names;
        });
    }

    // =====================================================================
    // Reads
    // =====================================================================

    @Override
    public Optional<GraphNode> findNode(NodeLabel label, String key) {
        return query("find " + label.label() + " " + key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.loadFor("select-node", label))) {
                ps.setString(1, key);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        return Optional.<GraphNode>empty();
                    ResultSetMetaData meta = rs.getMetaData();
                    Map<String, Object> properties = new LinkedHashMap<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        properties.put(meta.getColumnName(i), rs.getObject(i));
                    }
                    return Optional.of(new GraphNode(label, key, Collections.unmodifiableMap(properties)));
                }
            }
        });
    }

    @Override
    public List<Relationship> findRelationships(RelType type, String fromKey, String toKey) {
        return query("find " + type + " relationships", conn -> {
            List<Relationship> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-relationships"))) {
                ps.setString(1, type.name());
                ps.setString(2, fromKey);
                ps.setString(3, fromKey);
                ps.setString(4, toKey);
                ps.setString(5, toKey);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int rank = rs.getInt("feed_rank");
                        Integer feedRank = rs.wasNull() ? null : rank;
                        result.add(new Relationship(
                                RelType.valueOf(rs.getString("type")),
                                NodeLabel.fromLabel(rs.getString("from_label")),
                                rs.getString("from_key"),
                                NodeLabel.fromLabel(rs.getString("to_label")),
                                rs.getString("to_key"),
                                rs.getString("source"),
                                rs.getString("role"),
                                feedRank,
                                getInstant(rs, "first_seen_at"),
                                getInstant(rs, "last_seen_at"),
                                getInstant(rs, "ended_at")));
                    }
                }
            }
            return result;
        });
    }

    @Override
    public long countNodes(NodeLabel label) {
        return query("count " + label.label(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.loadFor("count-nodes", label));
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    // =====================================================================
    // Binding
    // =====================================================================

    private void bindAgent(PreparedStatement ps, AgentRow a, Instant obs, boolean markProfile)
            throws SQLException {
        ps.setString(1, a.name());
        ps.setString(2, a.agentId());
        ps.setString(3, a.displayName());
        ps.setString(4, a.description());
        ps.setString(5, a.avatarUrl());
        ps.setString(6, a.status());
        setLong(ps, 7, a.karma());
        setLong(ps, 8, a.followerCount());
        setLong(ps, 9, a.followingCount());
        setBool(ps, 10, a.claimed());
        setBool(ps, 11, a.active());
        ps.setString(12, a.ownerTwitterId());
        ps.setString(13, a.ownerTwitterHandle());
        setInstant(ps, 14, a.createdAt() != null ? a.createdAt() : obs);
        setInstant(ps, 15, a.claimedAt());
        setInstant(ps, 16, a.lastActive());
        setInstant(ps, 17, a.updatedAt());
        setInstant(ps, 18, markProfile ? obs : null);
        ps.setLong(19, obs.toEpochMilli());
        ps.setLong(20, obs.toEpochMilli());
        setInstant(ps, 21, a.createdAt());
    }

    private void bindSubmolt(PreparedStatement ps, SubmoltRow s, Instant obs) throws SQLException {
        ps.setString(1, s.name());
        ps.setString(2, s.submoltId());
        ps.setString(3, s.displayName());
        ps.setString(4, s.description());
        ps.setString(5, s.avatarUrl());
        ps.setString(6, s.bannerUrl());
        ps.setString(7, s.bannerColor());
        ps.setString(8, s.themeColor());
        setLong(ps, 9, s.subscriberCount());
        setLong(ps, 10, s.postCount());
        setInstant(ps, 11, s.createdAt() != null ? s.createdAt() : obs);
        setInstant(ps, 12, s.updatedAt());
        ps.setLong(13, obs.toEpochMilli());
        ps.setLong(14, obs.toEpochMilli());
        setInstant(ps, 15, s.createdAt());
    }

    private void bindPost(PreparedStatement ps, PostRow p, Instant obs) throws SQLException {
        ps.setString(1, p.id());
        ps.setString(2, p.title());
        ps.setString(3, p.content());
        ps.setString(4, p.url());
        ps.setString(5, p.submoltName());
        ps.setString(6, p.submoltId());
        ps.setString(7, p.type());
        setLong(ps, 8, p.score());
        setLong(ps, 9, p.upvotes());
        setLong(ps, 10, p.downvotes());
        setLong(ps, 11, p.commentCount());
        setDouble(ps, 12, p.hotScore());
        setBool(ps, 13, p.pinned());
        setBool(ps, 14, p.locked());
        ps.setString(15, p.deleted());
        ps.setString(16, p.spam());
        ps.setString(17, p.verificationStatus());
        setInstant(ps, 18, p.createdAt() != null ? p.createdAt() : obs);
        setInstant(ps, 19, p.updatedAt());
        ps.setLong(20, obs.toEpochMilli());
        ps.setLong(21, obs.toEpochMilli());
        setInstant(ps, 22, p.createdAt());
    }

    private void bindComment(PreparedStatement ps, CommentRow c, Instant obs) throws SQLException {
        ps.setString(1, c.id());
        ps.setString(2, c.postId());
        ps.setString(3, c.parentId());
        ps.setString(4, c.content());
        setLong(ps, 5, c.score());
        setLong(ps, 6, c.upvotes());
        setLong(ps, 7, c.downvotes());
        setLong(ps, 8, c.replyCount());
        setLong(ps, 9, c.depth());
        ps.setString(10, c.deleted());
        ps.setString(11, c.spam());
        ps.setString(12, c.verificationStatus());
        setInstant(ps, 13, c.createdAt() != null ? c.createdAt() : obs);
        setInstant(ps, 14, c.updatedAt());
        ps.setLong(15, obs.toEpochMilli());
        ps.setLong(16, obs.toEpochMilli());
        setInstant(ps, 17, c.createdAt());
    }

    private void bindRelationship(PreparedStatement ps, RelType type, NodeLabel fromLabel, String fromKey,
            NodeLabel toLabel, String toKey, String source, String role, Integer rank, Instant obs)
            throws SQLException {
        ps.setString(1, type.name());
        ps.setString(2, fromLabel.label());
        ps.setString(3, fromKey);
        ps.setString(4, toLabel.label());
        ps.setString(5, toKey);
        ps.setString(6, source);
        ps.setString(7, role);
        if (rank == null) {
            ps.setNull(8, Types.INTEGER);
        } else {
            ps.setInt(8, rank);
        }
        ps.setLong(9, obs.toEpochMilli());
        ps.setLong(10, obs.toEpochMilli());
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setBool(PreparedStatement ps, int index, Boolean value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value ? 1 : 0);
        }
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        setLong(ps, index, value == null ? null : value.toEpochMilli());
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }
}
