package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Post scanning parameters. Views are written as {@code "sort:time"}, with an
 * empty time window for unbounded sorts (e.g. {@code "new:"}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlConfig {

    @JsonProperty("page-size")
    private int pageSize = 50;

    @JsonProperty("max-pages-per-view")
    private int maxPagesPerView = 0;

    @JsonProperty("max-stale-pages")
    private int maxStalePages = 4;

    @JsonProperty("max-repeat-pages")
    private int maxRepeatPages = 2;

    @JsonProperty("signature-size")
    private int signatureSize = 10;

    @JsonProperty("views")
    private List<String> views = List.of(
            "new:", "top:day", "top:week", "top:month", "top:year", "top:all", "hot:day", "hot:week");

    @JsonProperty("incremental-views")
    private List<String> incrementalViews = List.of("new:");

    @JsonProperty("resume-unfinished")
    private boolean resumeUnfinished = true;

    @JsonProperty("fetch-post-details")
    private boolean fetchPostDetails = false;

    @JsonProperty("crawl-comments")
    private boolean crawlComments = true;

    @JsonProperty("comments-limit-per-post")
    private int commentsLimitPerPost = 200;

    @JsonProperty("comments-from-post-details")
    private boolean commentsFromPostDetails = true;

    @JsonProperty("submolt-top-limit")
    private int submoltTopLimit = 100;

    @JsonProperty("crawl-submolt-feeds")
    private boolean crawlSubmoltFeeds = false;

    @JsonProperty("submolt-feed-max-pages")
    private int submoltFeedMaxPages = 0;

    @JsonProperty("submolt-feed-sort")
    private String submoltFeedSort = "new";

    @JsonProperty("submolt-feed-limit")
    private int submoltFeedLimit = 0;

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxPagesPerView() {
        return maxPagesPerView;
    }

    public void setMaxPagesPerView(int maxPagesPerView) {
        this.maxPagesPerView = maxPagesPerView;
    }

    public int getMaxStalePages() {
        return maxStalePages;
    }

    public void setMaxStalePages(int maxStalePages) {
        this.maxStalePages = maxStalePages;
    }

    public int getMaxRepeatPages() {
        return maxRepeatPages;
    }

    public void setMaxRepeatPages(int maxRepeatPages) {
        this.maxRepeatPages = maxRepeatPages;
    }

    public int getSignatureSize() {
        return signatureSize;
    }

    public List<String> getViews() {
        return views;
    }

    public void setViews(List<String> views) {
        this.views = views;
    }

    public List<String> getIncrementalViews() {
        return incrementalViews;
    }

    public void setIncrementalViews(List<String> incrementalViews) {
        this.incrementalViews = incrementalViews;
    }

    public boolean isResumeUnfinished() {
        return resumeUnfinished;
    }

    public void setResumeUnfinished(boolean resumeUnfinished) {
        this.resumeUnfinished = resumeUnfinished;
    }

    public boolean isFetchPostDetails() {
        return fetchPostDetails;
    }

    public void setFetchPostDetails(boolean fetchPostDetails) {
        this.fetchPostDetails = fetchPostDetails;
    }

    public boolean isCrawlComments() {
        return crawlComments;
    }

    public void setCrawlComments(boolean crawlComments) {
        this.crawlComments = crawlComments;
    }

    public int getCommentsLimitPerPost() {
        return commentsLimitPerPost;
    }

    public boolean isCommentsFromPostDetails() {
        return commentsFromPostDetails;
    }

    public int getSubmoltTopLimit() {
        return submoltTopLimit;
    }

    public void setSubmoltTopLimit(int submoltTopLimit) {
        this.submoltTopLimit = submoltTopLimit;
    }

    public boolean isCrawlSubmoltFeeds() {
        return crawlSubmoltFeeds;
    }

    public void setCrawlSubmoltFeeds(boolean crawlSubmoltFeeds) {
        this.crawlSubmoltFeeds = crawlSubmoltFeeds;
    }

    public int getSubmoltFeedMaxPages() {
        return submoltFeedMaxPages;
    }

    public void setSubmoltFeedMaxPages(int submoltFeedMaxPages) {
        this.submoltFeedMaxPages = submoltFeedMaxPages;
    }

    public String getSubmoltFeedSort() {
        return submoltFeedSort;
    }

    public int getSubmoltFeedLimit() {
        return submoltFeedLimit;
    }
}
