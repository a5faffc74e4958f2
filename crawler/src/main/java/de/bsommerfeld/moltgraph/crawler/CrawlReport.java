package de.bsommerfeld.moltgraph.crawler;

import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.crawler.scan.ScanResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tally of one crawl run: records per stage, failed stages and the outcome of
 * every view scan.
 */
public class CrawlReport {

    private final String crawlId;
    private final CrawlMode mode;
    private final Map<String, Integer> stageRecords = new LinkedHashMap<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final List<ScanResult> scans = new ArrayList<>();

    public CrawlReport(String crawlId, CrawlMode mode) {
        this.crawlId = crawlId;
        this.mode = mode;
    }

    void recordStage(String stage, int records) {
        stageRecords.put(stage, records);
    }

    void recordFailure(String stage, Throwable error) {
        failures.put(stage, error.getClass().getSimpleName() + ": " + error.getMessage());
    }

    void addScan(ScanResult result) {
        scans.add(result);
    }

    public String getCrawlId() {
        return crawlId;
    }

    public CrawlMode getMode() {
        return mode;
    }

    public Map<String, Integer> getStageRecords() {
        return Collections.unmodifiableMap(stageRecords);
    }

    public Map<String, String> getFailures() {
        return Collections.unmodifiableMap(failures);
    }

    public List<ScanResult> getScans() {
        return Collections.unmodifiableList(scans);
    }

    public int stagesFailed() {
        return failures.size();
    }

    public int records(String stage) {
        return stageRecords.getOrDefault(stage, 0);
    }

    @Override
    public String toString() {
        return "CrawlReport{" + crawlId + ", stages=" + stageRecords + ", failed=" + failures.keySet() + "}";
    }
}
