package de.bsommerfeld.moltgraph.moltbook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.config.ApiConfig;
import de.bsommerfeld.moltgraph.core.json.ApiResponse;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Paced, retrying HTTP executor for the Moltbook REST API.
 *
 * <h3>Request lifecycle</h3>
 *
 * <pre>
 * send()
 *   └ loop per attempt
 *       ├ RateLimiter.acquire()       spacing before every exchange
 *       ├ HttpClient.send()           redirects disabled on the client
 *       │   └ 3xx → one manual follow, same headers (Authorization included)
 *       ├ 2xx → JSON ({} for an empty body)
 *       ├ 401 → AuthRequiredException, never retried
 *       └ else RetryPolicy.decide() → Wait (sleep, next attempt) | GiveUp (throw)
 * </pre>
 *
 * <h3>Why redirects are followed by hand</h3>
 * The upstream redirects between host spellings. The JDK client, like most
 * clients, strips {@code Authorization} when following a redirect itself, which
 * turns an authenticated request into an anonymous one. Following exactly once
 * with the original request's headers keeps the token; a second redirect in a
 * row is reported as an error instead of risking a loop.
 *
 * <h3>Public requests</h3>
 * Requests without the bearer token carry {@code Cache-Control: no-cache},
 * {@code Pragma: no-cache} and, when enabled, a millisecond {@code shuffle}
 * parameter. The CDN in front of the API otherwise serves the same cached page
 * regardless of {@code offset}.
 */
@Singleton
public class HttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    static final String CACHE_BUSTER_PARAM = "shuffle";

    private final ApiConfig config;
    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ObjectMapper mapper;

    @Inject
    public HttpTransport(ApiConfig config, HttpClient httpClient, RateLimiter rateLimiter,
            RetryPolicy retryPolicy, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.mapper = new ObjectMapper();
    }

    /**
     * The client this transport expects: automatic redirects off, connect
     * timeout from the config.
     */
    public static HttpClient newHttpClient(ApiConfig config) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getRequestTimeout())
                .build();
    }

    /**
     * GET convenience wrapping the body as an {@link ApiResponse}.
     */
    public ApiResponse get(String path, Map<String, ?> params, boolean useAuth) throws TransportException {
        return ApiResponse.of(send("GET", path, params, useAuth));
    }

    /**
     * Executes one logical request, retrying per {@link RetryPolicy}.
     *
     * @param method  HTTP method
     * @param path    path below the API base URL, starting with {@code /}
     * @param params  query parameters; {@code null} values are skipped
     * @param useAuth whether to send the bearer token
     * @return the decoded body, an empty object for an empty body
     * @throws AuthRequiredException       on 401
     * @throws ServerUnavailableException  when a 5xx outlasts the retries
     * @throws HttpStatusException         on any other non-success status
     * @throws TransportException          when network failures outlast the
     *                                     retries, or the body is not JSON
     */
    public JsonNode send(String method, String path, Map<String, ?> params, boolean useAuth)
            throws TransportException {
        for (int attempt = 0;; attempt++) {
            URI uri = buildUri(path, params, useAuth);
            HttpResponse<String> response;
            try {
                response = exchange(method, uri, path, useAuth);
            } catch (IOException e) {
                RetryDecision decision = retryPolicy.decideOnError(attempt);
                if (decision instanceof RetryDecision.Wait wait) {
                    LOG.warn("[HTTP] {} {} failed ({}), retrying in {} ms",
                            method, path, e.getMessage(), wait.delay().toMillis());
                    pause(wait.delay());
                    continue;
                }
                throw new TransportException(method + " " + path + " failed: "
                        + ((RetryDecision.GiveUp) decision).reason(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted during " + method + " " + path, e);
            }

            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return parseBody(response.body(), path);
            }
            if (status == 401) {
                throw new AuthRequiredException(path);
            }

            RetryDecision decision = retryPolicy.decide(status, response.headers(), attempt);
            if (decision instanceof RetryDecision.Wait wait) {
                LOG.warn("[HTTP] {} {} -> {} ({}), retrying in {} ms (attempt {})",
                        method, path, status, wait.reason(), wait.delay().toMillis(), attempt + 1);
                pause(wait.delay());
                continue;
            }
            throw statusException(status, path);
        }
    }

    private HttpResponse<String> exchange(String method, URI uri, String path, boolean useAuth)
            throws IOException, InterruptedException, TransportException {
        HttpRequest request = buildRequest(method, uri, useAuth);
        rateLimiter.acquire();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (!REDIRECT_STATUSES.contains(response.statusCode())) {
            return response;
        }

        String location = response.headers().firstValue("Location")
                .orElseThrow(() -> new HttpStatusException(response.statusCode(), path,
                        "Redirect without Location header for " + path));
        URI target = uri.resolve(location);
        LOG.debug("[HTTP] {} redirected to {}", uri, target);

        HttpRequest follow = HttpRequest.newBuilder(request, (name, value) -> true)
                .uri(target)
                .build();
        rateLimiter.acquire();
        HttpResponse<String> followed = httpClient.send(follow, HttpResponse.BodyHandlers.ofString());
        if (REDIRECT_STATUSES.contains(followed.statusCode())) {
            throw new HttpStatusException(followed.statusCode(), path,
                    "Second redirect in a row from " + target + " for " + path);
        }
        return followed;
    }

    HttpRequest buildRequest(String method, URI uri, boolean useAuth) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent())
                .header("Accept", "application/json")
                .method(method, HttpRequest.BodyPublishers.noBody());
        if (useAuth) {
            builder.header("Authorization", "Bearer " + config.getApiKey());
        } else {
            builder.header("Cache-Control", "no-cache")
                    .header("Pragma", "no-cache");
        }
        return builder.build();
    }

    URI buildUri(String path, Map<String, ?> params, boolean useAuth) {
        String base = config.getBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        StringJoiner query = new StringJoiner("&");
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    query.add(encode(key) + "=" + encode(String.valueOf(value)));
                }
            });
        }
        if (!useAuth && config.isCacheBuster() && (params == null || !params.containsKey(CACHE_BUSTER_PARAM))) {
            query.add(CACHE_BUSTER_PARAM + "=" + clock.millis());
        }
        String suffix = query.length() == 0 ? "" : "?" + query;
        return URI.create(base + path + suffix);
    }

    private JsonNode parseBody(String body, String path) throws TransportException {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed JSON from " + path, e);
        }
    }

    private void pause(Duration delay) throws TransportException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while backing off", e);
        }
    }

    private static HttpStatusException statusException(int status, String path) {
        if (status >= 500) {
            return new ServerUnavailableException(status, path);
        }
        if (status == 429) {
            return new HttpStatusException(status, path, "Rate limit persisted through every retry for " + path);
        }
        return new HttpStatusException(status, path);
    }

    /**
     * Encodes a single path segment, e.g. a submolt or post id.
     */
    public static String segment(String value) {
        return encode(value).replace("+", "%20");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
