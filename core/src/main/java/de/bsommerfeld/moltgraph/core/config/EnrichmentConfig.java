package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Follow-up fetches triggered by what the post scan discovered. A limit of
 * {@code 0} means "no cap".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentConfig {

    @JsonProperty("enrich-submolts")
    private boolean enrichSubmolts = false;

    @JsonProperty("enrich-submolts-limit")
    private int enrichSubmoltsLimit = 0;

    @JsonProperty("refresh-moderators")
    private boolean refreshModerators = true;

    @JsonProperty("moderator-submolts-limit")
    private int moderatorSubmoltsLimit = 500;

    @JsonProperty("fetch-agent-profiles")
    private boolean fetchAgentProfiles = true;

    @JsonProperty("profile-limit")
    private int profileLimit = 0;

    @JsonProperty("profile-refresh-days")
    private int profileRefreshDays = 7;

    @JsonProperty("profile-refresh-limit")
    private int profileRefreshLimit = 500;

    @JsonProperty("scrape-agent-html")
    private boolean scrapeAgentHtml = false;

    @JsonProperty("feed-snapshot")
    private boolean feedSnapshot = true;

    @JsonProperty("feed-snapshot-sort")
    private String feedSnapshotSort = "hot";

    @JsonProperty("feed-snapshot-limit")
    private int feedSnapshotLimit = 100;

    public boolean isEnrichSubmolts() {
        return enrichSubmolts;
    }

    public void setEnrichSubmolts(boolean enrichSubmolts) {
        this.enrichSubmolts = enrichSubmolts;
    }

    public int getEnrichSubmoltsLimit() {
        return enrichSubmoltsLimit;
    }

    public boolean isRefreshModerators() {
        return refreshModerators;
    }

    public void setRefreshModerators(boolean refreshModerators) {
        this.refreshModerators = refreshModerators;
    }

    public int getModeratorSubmoltsLimit() {
        return moderatorSubmoltsLimit;
    }

    public void setModeratorSubmoltsLimit(int moderatorSubmoltsLimit) {
        this.moderatorSubmoltsLimit = moderatorSubmoltsLimit;
    }

    public boolean isFetchAgentProfiles() {
        return fetchAgentProfiles;
    }

    public void setFetchAgentProfiles(boolean fetchAgentProfiles) {
        this.fetchAgentProfiles = fetchAgentProfiles;
    }

    public int getProfileLimit() {
        return profileLimit;
    }

    public void setProfileLimit(int profileLimit) {
        this.profileLimit = profileLimit;
    }

    public Duration getProfileStaleness() {
        return Duration.ofDays(profileRefreshDays);
    }

    public int getProfileRefreshLimit() {
        return profileRefreshLimit;
    }

    public void setProfileRefreshLimit(int profileRefreshLimit) {
        this.profileRefreshLimit = profileRefreshLimit;
    }

    public boolean isScrapeAgentHtml() {
        return scrapeAgentHtml;
    }

    public void setScrapeAgentHtml(boolean scrapeAgentHtml) {
        this.scrapeAgentHtml = scrapeAgentHtml;
    }

    public boolean isFeedSnapshot() {
        return feedSnapshot;
    }

    public void setFeedSnapshot(boolean feedSnapshot) {
        this.feedSnapshot = feedSnapshot;
    }

    public String getFeedSnapshotSort() {
        return feedSnapshotSort;
    }

    public int getFeedSnapshotLimit() {
        return feedSnapshotLimit;
    }
}
