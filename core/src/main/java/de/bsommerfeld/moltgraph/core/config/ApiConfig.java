package de.bsommerfeld.moltgraph.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Upstream API access and transport pacing. The API key is usually supplied
 * through {@code MOLTBOOK_API_KEY} rather than written into the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://www.moltbook.com/api/v1";

    @JsonProperty("web-base-url")
    private String webBaseUrl = "https://www.moltbook.com";

    @JsonProperty("api-key")
    private String apiKey;

    @JsonProperty("user-agent")
    private String userAgent = "MoltGraphCrawler/0.1";

    @JsonProperty("requests-per-minute")
    private int requestsPerMinute = 80;

    @JsonProperty("max-retries")
    private int maxRetries = 8;

    @JsonProperty("backoff-seed-millis")
    private long backoffSeedMillis = 1500;

    @JsonProperty("backoff-ceiling-millis")
    private long backoffCeilingMillis = 60_000;

    @JsonProperty("rate-limit-cooldown-millis")
    private long rateLimitCooldownMillis = 30_000;

    @JsonProperty("request-timeout-seconds")
    private long requestTimeoutSeconds = 60;

    @JsonProperty("cache-buster")
    private boolean cacheBuster = true;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getWebBaseUrl() {
        return webBaseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public void setRequestsPerMinute(int requestsPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBackoffSeed() {
        return Duration.ofMillis(backoffSeedMillis);
    }

    public void setBackoffSeedMillis(long backoffSeedMillis) {
        this.backoffSeedMillis = backoffSeedMillis;
    }

    public Duration getBackoffCeiling() {
        return Duration.ofMillis(backoffCeilingMillis);
    }

    public void setBackoffCeilingMillis(long backoffCeilingMillis) {
        this.backoffCeilingMillis = backoffCeilingMillis;
    }

    public Duration getRateLimitCooldown() {
        return Duration.ofMillis(rateLimitCooldownMillis);
    }

    public void setRateLimitCooldownMillis(long rateLimitCooldownMillis) {
        this.rateLimitCooldownMillis = rateLimitCooldownMillis;
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public boolean isCacheBuster() {
        return cacheBuster;
    }

    public void setCacheBuster(boolean cacheBuster) {
        this.cacheBuster = cacheBuster;
    }
}
