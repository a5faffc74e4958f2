package de.bsommerfeld.moltgraph.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.config.CrawlConfig;
import de.bsommerfeld.moltgraph.core.config.EnrichmentConfig;
import de.bsommerfeld.moltgraph.core.config.GlobalConfig;
import de.bsommerfeld.moltgraph.core.domain.AgentRow;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.core.domain.ModeratorRow;
import de.bsommerfeld.moltgraph.core.domain.SubmoltRow;
import de.bsommerfeld.moltgraph.core.domain.XAccountRow;
import de.bsommerfeld.moltgraph.core.event.CrawlEventBus;
import de.bsommerfeld.moltgraph.core.event.CrawlEvents;
import de.bsommerfeld.moltgraph.core.json.JsonFields;
import de.bsommerfeld.moltgraph.crawler.scan.ScanResult;
import de.bsommerfeld.moltgraph.crawler.scan.ScanSettings;
import de.bsommerfeld.moltgraph.crawler.scan.View;
import de.bsommerfeld.moltgraph.crawler.scan.ViewScanner;
import de.bsommerfeld.moltgraph.db.CrawlRecord;
import de.bsommerfeld.moltgraph.db.GraphStore;
import de.bsommerfeld.moltgraph.moltbook.MoltbookClient;
import de.bsommerfeld.moltgraph.moltbook.PostDetail;
import de.bsommerfeld.moltgraph.moltbook.TransportException;
import de.bsommerfeld.moltgraph.moltbook.html.ProfilePageInfo;
import de.bsommerfeld.moltgraph.moltbook.html.ProfilePageScraper;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Runs one crawl from opening the crawl record to closing it.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li>{@code open-crawl}: resume the latest unfinished crawl of the mode, or
 * start {@code <mode>:<uuid>}</li>
 * <li>{@code me}: the key's own agent (full runs only)</li>
 * <li>{@code submolt-seed}: the popular submolts, optionally with detail</li>
 * <li>{@code posts}: every configured view through the {@link ViewScanner},
 * posts and comments written page by page</li>
 * <li>{@code submolts}: submolts discovered in posts</li>
 * <li>{@code submolt-feeds}: per-submolt feed scans</li>
 * <li>{@code moderators}: MODERATES reconciliation</li>
 * <li>{@code profiles}: agent profiles plus owner X accounts</li>
 * <li>{@code html}: profile page scraping</li>
 * <li>{@code feed-snapshot}: the ranked personal feed</li>
 * <li>{@code close-crawl}</li>
 * </ol>
 *
 * Every stage is isolated: an exception is logged, counted in the
 * {@link CrawlReport}, published as {@link CrawlEvents.StageFailed} and the
 * next stage runs. Single items inside a stage (one profile, one comment
 * tree) fail on their own without failing the stage.
 *
 * <p>
 * Incremental runs only cut the reverse-chronological views at the cutoff of
 * the last completed crawl; every other view is scanned in full.
 */
@Singleton
public class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);

    static final String STAGE_OPEN = "open-crawl";
    static final String STAGE_ME = "me";
    static final String STAGE_SUBMOLT_SEED = "submolt-seed";
    static final String STAGE_POSTS = "posts";
    static final String STAGE_SUBMOLTS = "submolts";
    static final String STAGE_SUBMOLT_FEEDS = "submolt-feeds";
    static final String STAGE_MODERATORS = "moderators";
    static final String STAGE_PROFILES = "profiles";
    static final String STAGE_HTML = "html";
    static final String STAGE_FEED_SNAPSHOT = "feed-snapshot";
    static final String STAGE_CLOSE = "close-crawl";

    private static final String SEED_SORT = "popular";
    private static final String COMMENT_SORT = "new";

    private final CrawlConfig crawlConfig;
    private final EnrichmentConfig enrichment;
    private final MoltbookClient client;
    private final GraphStore store;
    private final ViewScanner scanner;
    private final EntityExtractor extractor;
    private final ProfilePageScraper scraper;
    private final CrawlEventBus eventBus;
    private final Clock clock;

    @Inject
    public CrawlOrchestrator(GlobalConfig config, MoltbookClient client, GraphStore store, ViewScanner scanner,
            EntityExtractor extractor, ProfilePageScraper scraper, CrawlEventBus eventBus, Clock clock) {
        this.crawlConfig = config.getCrawl();
        this.enrichment = config.getEnrichment();
        this.client = client;
        this.store = store;
        this.scanner = scanner;
        this.extractor = extractor;
        this.scraper = scraper;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public CrawlReport run(CrawlMode mode) {
        Instant startedAt = clock.instant();
        Run run = new Run(mode, mode.id() + ":" + UUID.randomUUID(), startedAt);
        run.report = new CrawlReport(run.crawlId, mode);

        stage(run, STAGE_OPEN, () -> openCrawl(run));
        eventBus.post(new CrawlEvents.CrawlStarted(run.crawlId, mode, run.scanCutoff, run.resumed));
        LOG.info("Crawl {} started (mode={}, cutoff={}, resumed={})",
                run.crawlId, mode.id(), run.scanCutoff, run.resumed);

        if (mode == CrawlMode.FULL) {
            stage(run, STAGE_ME, () -> saveMe(run));
        }
        stage(run, STAGE_SUBMOLT_SEED, () -> seedSubmolts(run));
        stage(run, STAGE_POSTS, () -> scanViews(run));
        stage(run, STAGE_SUBMOLTS, () -> store.upsertSubmolts(run.discovered.submolts(), clock.instant()));
        stage(run, STAGE_SUBMOLT_FEEDS, () -> scanSubmoltFeeds(run));
        stage(run, STAGE_MODERATORS, () -> refreshModerators(run));
        stage(run, STAGE_PROFILES, () -> refreshProfiles(run));
        stage(run, STAGE_HTML, () -> scrapeProfilePages(run));
        stage(run, STAGE_FEED_SNAPSHOT, () -> snapshotFeed(run));
        stage(run, STAGE_CLOSE, () -> {
            store.endCrawl(run.crawlId, clock.instant());
            return 1;
        });

        Duration elapsed = Duration.between(startedAt, clock.instant());
        eventBus.post(new CrawlEvents.CrawlFinished(run.crawlId, run.report.stagesFailed(), elapsed));
        LOG.info("Crawl {} done in {} s, {} stage(s) failed", run.crawlId, elapsed.toSeconds(),
                run.report.stagesFailed());
        return run.report;
    }

    private void stage(Run run, String name, Stage stage) {
        Instant start = clock.instant();
        try {
            int records = stage.run();
            run.report.recordStage(name, records);
            eventBus.post(new CrawlEvents.StageFinished(run.crawlId, name, records,
                    Duration.between(start, clock.instant())));
        } catch (Exception e) {
            LOG.error("Stage {} failed: {}", name, e.getMessage(), e);
            run.report.recordFailure(name, e);
            eventBus.post(new CrawlEvents.StageFailed(run.crawlId, name, String.valueOf(e.getMessage())));
        }
    }

    // =====================================================================
    // Stages
    // =====================================================================

    private int openCrawl(Run run) {
        if (run.mode == CrawlMode.INCREMENTAL) {
            run.scanCutoff = store.latestCompletedCutoff().orElse(null);
        }
        Optional<CrawlRecord> unfinished = crawlConfig.isResumeUnfinished()
                ? store.findUnfinishedCrawl(run.mode)
                : Optional.empty();
        Instant cutoff = run.startedAt;
        if (unfinished.isPresent()) {
            run.crawlId = unfinished.get().id();
            run.resumed = true;
            run.report = new CrawlReport(run.crawlId, run.mode);
            if (unfinished.get().cutoff() != null) {
                cutoff = unfinished.get().cutoff();
            }
            LOG.info("Resuming unfinished crawl {}", run.crawlId);
        }
        store.beginCrawl(run.crawlId, run.mode, cutoff, run.startedAt);
        return 1;
    }

    private int saveMe(Run run) throws TransportException {
        ObjectNode me = client.getMe();
        Optional<AgentRow> row = AgentRow.from(me);
        if (row.isEmpty()) {
            LOG.warn("/agents/me returned no agent");
            return 0;
        }
        return store.upsertAgents(List.of(row.get()), clock.instant(), false);
    }

    private int seedSubmolts(Run run) throws TransportException {
        int limit = crawlConfig.getSubmoltTopLimit();
        if (limit <= 0) {
            return 0;
        }
        List<SubmoltRow> seed = new ArrayList<>();
        for (JsonNode node : client.listSubmolts(SEED_SORT, limit, 0)) {
            SubmoltRow.from(node).ifPresent(seed::add);
        }
        if (seed.isEmpty()) {
            return 0;
        }
        store.upsertSubmolts(seed, clock.instant());
        seed.forEach(s -> run.seedSubmolts.add(s.name()));
        LOG.info("Seeded {} top submolts", seed.size());

        if (enrichment.isEnrichSubmolts()) {
            List<SubmoltRow> enriched = new ArrayList<>();
            for (SubmoltRow row : capped(seed, enrichment.getEnrichSubmoltsLimit())) {
                try {
                    enriched.add(SubmoltRow.from(client.getSubmolt(row.name())).orElse(row));
                } catch (TransportException e) {
                    LOG.debug("Submolt detail for {} failed: {}", row.name(), e.getMessage());
                    enriched.add(row);
                }
            }
            store.upsertSubmolts(enriched, clock.instant());
            LOG.info("Enriched {} submolts with detail", enriched.size());
        }
        return seed.size();
    }

    private int scanViews(Run run) {
        List<String> configured = run.mode == CrawlMode.FULL
                ? crawlConfig.getViews()
                : crawlConfig.getIncrementalViews();
        ScanSettings base = ScanSettings.from(crawlConfig);
        int items = 0;
        for (String raw : configured) {
            Optional<View> parsed = parseView(raw);
            if (parsed.isEmpty()) {
                continue;
            }
            View view = parsed.get();
            ScanSettings settings = view.isReverseChronological() ? base.withCutoff(run.scanCutoff) : base;
            try {
                ScanResult result = scanner.scan(run.crawlId, view.checkpointKey(), settings,
                        run.discovered.seenPostIds(),
                        (offset, limit) -> client.listPosts(view.sort(), view.time(), limit, offset, null),
                        batch -> processPosts(run, batch));
                run.report.addScan(result);
                items += result.items();
            } catch (RuntimeException e) {
                // a store failure ends this view only
                LOG.error("View {} aborted: {}", view, e.getMessage(), e);
                run.report.recordFailure(STAGE_POSTS + ":" + view, e);
            }
        }
        return items;
    }

    private int scanSubmoltFeeds(Run run) {
        int maxPages = crawlConfig.getSubmoltFeedMaxPages();
        if (!crawlConfig.isCrawlSubmoltFeeds() || maxPages <= 0) {
            return 0;
        }
        List<String> names = capped(new ArrayList<>(run.discovered.submoltNames()),
                crawlConfig.getSubmoltFeedLimit());
        String sort = crawlConfig.getSubmoltFeedSort();
        ScanSettings settings = ScanSettings.from(crawlConfig).withMaxPages(maxPages);
        LOG.info("Scanning feeds of {} submolts (pages={}, sort={})", names.size(), maxPages, sort);

        int items = 0;
        for (String name : names) {
            try {
                ScanResult result = scanner.scan(run.crawlId, "submolt_feed_offset_" + name, settings,
                        run.discovered.seenPostIds(),
                        (offset, limit) -> client.getSubmoltFeed(name, sort, limit, offset),
                        batch -> processPosts(run, batch));
                run.report.addScan(result);
                items += result.items();
            } catch (RuntimeException e) {
                LOG.error("Feed scan of {} aborted: {}", name, e.getMessage(), e);
                run.report.recordFailure(STAGE_SUBMOLT_FEEDS + ":" + name, e);
            }
        }
        return items;
    }

    private int refreshModerators(Run run) {
        if (!enrichment.isRefreshModerators()) {
            return 0;
        }
        Set<String> targets = new LinkedHashSet<>(run.discovered.submoltNames());
        targets.addAll(run.seedSubmolts);
        List<String> names = capped(new ArrayList<>(targets), enrichment.getModeratorSubmoltsLimit());
        LOG.info("Refreshing moderators of {} submolts", names.size());

        int reconciled = 0;
        for (String name : names) {
            List<JsonNode> entries;
            try {
                entries = client.getModerators(name);
            } catch (TransportException e) {
                LOG.debug("Moderators of {} unavailable: {}", name, e.getMessage());
                continue;
            }
            List<ModeratorRow> moderators = extractor.moderators(entries);
            if (moderators.isEmpty()) {
                // an empty answer says nothing about who stopped moderating
                continue;
            }
            store.reconcileModerators(name, moderators, clock.instant());
            moderators.forEach(m -> run.discovered.addAgentName(m.name()));
            reconciled++;
        }
        return reconciled;
    }

    private int refreshProfiles(Run run) {
        if (!enrichment.isFetchAgentProfiles()) {
            return 0;
        }
        Instant now = clock.instant();
        // discovery order; a cap keeps the agents seen first in this run
        Set<String> names = new LinkedHashSet<>(
                capped(new ArrayList<>(run.discovered.agentNames()), enrichment.getProfileLimit()));
        names.addAll(store.agentsNeedingProfileRefresh(enrichment.getProfileStaleness(),
                enrichment.getProfileRefreshLimit(), now));
        LOG.info("Refreshing {} agent profiles", names.size());

        int written = 0;
        for (String name : names) {
            ObjectNode profile;
            try {
                profile = client.getAgentProfile(name);
            } catch (TransportException e) {
                LOG.debug("Profile of {} unavailable: {}", name, e.getMessage());
                continue;
            }
            Optional<AgentRow> row = AgentRow.from(profile);
            if (row.isEmpty()) {
                continue;
            }
            Instant observed = clock.instant();
            store.upsertAgents(List.of(row.get()), observed, true);
            Optional<XAccountRow> owner = XAccountRow.fromOwner(profile.get("owner"));
            owner.ifPresent(account -> store.upsertXOwner(row.get().name(), account, observed));
            written++;
            if (written % 100 == 0) {
                LOG.info("Profiles {}/{}", written, names.size());
            }
        }
        return written;
    }

    private int scrapeProfilePages(Run run) {
        if (!enrichment.isScrapeAgentHtml()) {
            return 0;
        }
        Set<String> names = new TreeSet<>(run.discovered.agentNames());
        LOG.info("Scraping {} agent pages", names.size());

        int scraped = 0;
        for (String name : names) {
            ProfilePageInfo info;
            try {
                info = scraper.scrape(name);
            } catch (TransportException e) {
                LOG.debug("Profile page of {} unavailable: {}", name, e.getMessage());
                continue;
            }
            Instant observed = clock.instant();
            info.ownerAccount().ifPresent(account -> store.upsertXOwner(name, account, observed));
            if (!info.similarAgents().isEmpty()) {
                store.reconcileSimilarAgents(name, info.similarAgents(), ProfilePageScraper.SOURCE, observed);
            }
            scraped++;
        }
        return scraped;
    }

    private int snapshotFeed(Run run) throws TransportException {
        if (!enrichment.isFeedSnapshot()) {
            return 0;
        }
        String sort = enrichment.getFeedSnapshotSort();
        List<JsonNode> feed = client.getFeed(sort, enrichment.getFeedSnapshotLimit(), 0);
        return store.writeFeedSnapshot(run.crawlId, sort, extractor.posts(feed), clock.instant());
    }

    // =====================================================================
    // Page processing
    // =====================================================================

    private void processPosts(Run run, List<JsonNode> batch) {
        List<JsonNode> posts = batch;
        Map<String, List<JsonNode>> detailTrees = new HashMap<>();
        if (crawlConfig.isFetchPostDetails()) {
            posts = new ArrayList<>(batch.size());
            for (JsonNode item : batch) {
                String id = JsonFields.textOrNull(item, "id");
                if (id == null) {
                    continue;
                }
                try {
                    PostDetail detail = client.getPost(id);
                    posts.add(detail.hasPost() ? detail.post() : item);
                    if (crawlConfig.isCommentsFromPostDetails() && !detail.comments().isEmpty()) {
                        detailTrees.put(id, detail.comments());
                    }
                } catch (TransportException e) {
                    LOG.debug("Post detail for {} failed: {}", id, e.getMessage());
                    posts.add(item);
                }
            }
        }

        extractor.collectFromPosts(posts, run.discovered);
        store.upsertPosts(extractor.posts(posts), clock.instant());

        if (crawlConfig.isCrawlComments()) {
            for (JsonNode item : posts) {
                String id = JsonFields.textOrNull(item, "id");
                if (id != null && run.discovered.markCommented(id)) {
                    writeComments(run, id, detailTrees.get(id));
                }
            }
        }
    }

    private void writeComments(Run run, String postId, List<JsonNode> detailTree) {
        List<JsonNode> tree = detailTree;
        if (tree == null) {
            try {
                tree = client.getComments(postId, COMMENT_SORT, crawlConfig.getCommentsLimitPerPost());
            } catch (TransportException e) {
                LOG.debug("Comments of {} unavailable: {}", postId, e.getMessage());
                return;
            }
        }
        if (tree.isEmpty()) {
            return;
        }
        store.upsertComments(postId, tree, clock.instant());
        extractor.collectFromComments(tree, run.discovered);
    }

    private static Optional<View> parseView(String raw) {
        try {
            return Optional.of(View.parse(raw));
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping invalid view '{}': {}", raw, e.getMessage());
            return Optional.empty();
        }
    }

    private static <T> List<T> capped(List<T> items, int limit) {
        return limit > 0 && items.size() > limit ? items.subList(0, limit) : items;
    }

    @FunctionalInterface
    private interface Stage {
        int run() throws Exception;
    }

    /** Mutable state of one run. */
    private static final class Run {
        final CrawlMode mode;
        final Instant startedAt;
        final DiscoveredEntities discovered = new DiscoveredEntities();
        final Set<String> seedSubmolts = new LinkedHashSet<>();
        String crawlId;
        Instant scanCutoff;
        boolean resumed;
        CrawlReport report;

        Run(CrawlMode mode, String crawlId, Instant startedAt) {
            this.mode = mode;
            this.crawlId = crawlId;
            this.startedAt = startedAt;
        }
    }
}
