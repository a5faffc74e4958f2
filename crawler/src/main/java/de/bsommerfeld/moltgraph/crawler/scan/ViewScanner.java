package de.bsommerfeld.moltgraph.crawler.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.json.JsonFields;
import de.bsommerfeld.moltgraph.db.CheckpointStore;
import de.bsommerfeld.moltgraph.moltbook.ListingPage;
import de.bsommerfeld.moltgraph.moltbook.TransportException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Pages through one listing until it stops yielding anything useful.
 *
 * <h3>Page cycle</h3>
 *
 * <pre>
 * offset = checkpoint(crawlId, viewKey)
 * loop
 *   fetch(offset)            failure → FAILED
 *   empty page               → EXHAUSTED
 *   signature, unseen ids, cutoff filter
 *   handler(kept items)
 *   advance offset, save checkpoint
 *   stop checks: CUTOFF_REACHED, PAGE_CAP_REACHED, REPEAT_DETECTED,
 *                STALE_DETECTED, EXHAUSTED (has_more == false)
 * </pre>
 *
 * <h3>Why stall detection</h3>
 * The upstream is known to ignore {@code offset} at times and serve the same
 * page forever. Two independent signals catch that: the leading ids of a page
 * repeating, and pages that contribute no id the run has not already seen
 * (the seen set is shared by every view of the run).
 *
 * <h3>Cutoff</h3>
 * Items whose timestamp is at or before the cutoff are dropped. A page whose
 * timestamped items are all that old ends the scan; items without a readable
 * timestamp are kept and never end it on their own.
 */
@Singleton
public class ViewScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ViewScanner.class);

    private final CheckpointStore checkpoints;

    @Inject
    public ViewScanner(CheckpointStore checkpoints) {
        this.checkpoints = checkpoints;
    }

    /**
     * Scans until a terminal state.
     *
     * @param seenIds ids already seen in this run; updated in place
     */
    public ScanResult scan(String crawlId, String viewKey, ScanSettings settings, Set<String> seenIds,
            PageFetcher fetcher, PageHandler handler) {
        int offset = checkpoints.loadCheckpoint(crawlId, viewKey);
        LOG.info("[SCAN] {} starting at offset {} (page size {})", viewKey, offset, settings.pageSize());

        List<String> previousSignature = null;
        int repeatPages = 0;
        int stalePages = 0;
        int pages = 0;
        int handled = 0;
        int newIds = 0;

        while (true) {
            ListingPage page;
            try {
                page = fetcher.fetch(offset, settings.pageSize());
            } catch (TransportException e) {
                LOG.warn("[SCAN] {} failed at offset {}: {}", viewKey, offset, e.getMessage());
                return new ScanResult(viewKey, ScanState.FAILED, pages, handled, newIds, offset);
            }
            if (page.isEmpty()) {
                LOG.info("[SCAN] {} empty page at offset {}", viewKey, offset);
                return new ScanResult(viewKey, ScanState.EXHAUSTED, pages, handled, newIds, offset);
            }

            List<JsonNode> batch = page.items();
            List<String> signature = signature(batch, settings.signatureSize());
            repeatPages = signature.equals(previousSignature) ? repeatPages + 1 : 0;
            previousSignature = signature;

            int unseen = 0;
            for (JsonNode item : batch) {
                String id = JsonFields.textOrNull(item, "id");
                if (id != null && seenIds.add(id)) {
                    unseen++;
                }
            }
            stalePages = unseen == 0 ? stalePages + 1 : 0;

            CutoffSplit split = applyCutoff(batch, settings.cutoff());
            if (!split.kept().isEmpty()) {
                handler.handle(split.kept());
            }

            int previousOffset = offset;
            offset = advance(offset, page.nextOffset(), batch.size());
            checkpoints.saveCheckpoint(crawlId, viewKey, offset);

            pages++;
            handled += split.kept().size();
            newIds += unseen;
            LOG.info("[SCAN] {} page={} batch={} kept={} new_ids={} offset:{}->{} repeat={} stale={}",
                    viewKey, pages, batch.size(), split.kept().size(), unseen, previousOffset, offset,
                    repeatPages, stalePages);

            ScanState state = stopState(settings, split, pages, repeatPages, stalePages, page.hasMore());
            if (state.isTerminal()) {
                LOG.info("[SCAN] {} stopped: {} after {} pages", viewKey, state, pages);
                return new ScanResult(viewKey, state, pages, handled, newIds, offset);
            }
        }
    }

    private static ScanState stopState(ScanSettings settings, CutoffSplit split, int pages, int repeatPages,
            int stalePages, Optional<Boolean> hasMore) {
        if (split.cutoffReached()) {
            return ScanState.CUTOFF_REACHED;
        }
        if (settings.maxPages() > 0 && pages >= settings.maxPages()) {
            return ScanState.PAGE_CAP_REACHED;
        }
        if (settings.maxRepeatPages() > 0 && repeatPages >= settings.maxRepeatPages()) {
            LOG.warn("[SCAN] same page signature {} times in a row, offset is likely ignored", repeatPages + 1);
            return ScanState.REPEAT_DETECTED;
        }
        if (settings.maxStalePages() > 0 && stalePages >= settings.maxStalePages()) {
            LOG.warn("[SCAN] no unseen ids for {} pages, offset is likely ignored", stalePages);
            return ScanState.STALE_DETECTED;
        }
        // absent has_more means keep going
        if (hasMore.isPresent() && !hasMore.get()) {
            return ScanState.EXHAUSTED;
        }
        return ScanState.SCANNING;
    }

    static int advance(int offset, OptionalInt nextOffset, int batchSize) {
        if (nextOffset.isPresent() && nextOffset.getAsInt() > offset) {
            return nextOffset.getAsInt();
        }
        return offset + batchSize;
    }

    private static List<String> signature(List<JsonNode> batch, int size) {
        List<String> ids = new ArrayList<>(Math.min(size, batch.size()));
        for (int i = 0; i < batch.size() && i < size; i++) {
            ids.add(JsonFields.textOrNull(batch.get(i), "id"));
        }
        return ids;
    }

    private static CutoffSplit applyCutoff(List<JsonNode> batch, Instant cutoff) {
        if (cutoff == null) {
            return new CutoffSplit(batch, false);
        }
        List<JsonNode> kept = new ArrayList<>(batch.size());
        int timestamped = 0;
        int newer = 0;
        for (JsonNode item : batch) {
            Optional<Instant> created = JsonFields.instant(item, "created_at", "createdAt");
            if (created.isEmpty()) {
                kept.add(item);
                continue;
            }
            timestamped++;
            if (created.get().isAfter(cutoff)) {
                newer++;
                kept.add(item);
            }
        }
        return new CutoffSplit(kept, timestamped > 0 && newer == 0);
    }

    private record CutoffSplit(List<JsonNode> kept, boolean cutoffReached) {
    }
}
