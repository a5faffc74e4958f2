package de.bsommerfeld.moltgraph.moltbook.html;

import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.config.ApiConfig;
import de.bsommerfeld.moltgraph.moltbook.HttpStatusException;
import de.bsommerfeld.moltgraph.moltbook.HttpTransport;
import de.bsommerfeld.moltgraph.moltbook.RateLimiter;
import de.bsommerfeld.moltgraph.moltbook.TransportException;
import jakarta.inject.Inject;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ProfilePageScraper} over {@code {web-base}/u/{name}} using jsoup.
 *
 * <h3>Owner account</h3>
 * The first anchor pointing at x.com or twitter.com. Share and intent links
 * are skipped.
 *
 * <h3>Similar agents</h3>
 * Only read when the page mentions "Similar Agents". The scope is the
 * nearest ancestor of that heading containing {@code /u/<name>} links, or the
 * whole page when no such ancestor exists.
 *
 * <p>
 * Page fetches go through the shared {@link RateLimiter} like API calls.
 */
@Singleton
public class JsoupProfilePageScraper implements ProfilePageScraper {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupProfilePageScraper.class);

    private static final Pattern X_LINK = Pattern.compile("(x\\.com|twitter\\.com)/([^/?#]+)");
    private static final Pattern AGENT_LINK = Pattern.compile("^(?:https?://[^/]+)?/u/([^/?#]+)");
    private static final Set<String> RESERVED_X_PATHS = Set.of("intent", "share", "home", "i", "search");
    private static final String SIMILAR_HEADING = "Similar Agents";

    private final ApiConfig config;
    private final RateLimiter rateLimiter;

    @Inject
    public JsoupProfilePageScraper(ApiConfig config, RateLimiter rateLimiter) {
        this.config = config;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public ProfilePageInfo scrape(String agentName) throws TransportException {
        String base = config.getWebBaseUrl().replaceAll("/+$", "");
        String url = base + "/u/" + HttpTransport.segment(agentName);
        try {
            rateLimiter.acquire();
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(config.getUserAgent())
                    .timeout((int) config.getRequestTimeout().toMillis())
                    .ignoreHttpErrors(true)
                    .execute();
            if (response.statusCode() != 200) {
                throw new HttpStatusException(response.statusCode(), "/u/" + agentName);
            }
            return parse(response.parse(), agentName);
        } catch (IOException e) {
            throw new TransportException("Failed to fetch profile page " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted fetching " + url, e);
        }
    }

    static ProfilePageInfo parse(Document doc, String agentName) {
        String handle = null;
        String xUrl = null;
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            Matcher m = X_LINK.matcher(href);
            if (m.find() && !RESERVED_X_PATHS.contains(m.group(2).toLowerCase(Locale.ROOT))) {
                handle = m.group(2);
                xUrl = a.absUrl("href").isEmpty() ? href : a.absUrl("href");
                break;
            }
        }

        Set<String> similar = new TreeSet<>();
        if (doc.text().contains(SIMILAR_HEADING)) {
            for (Element a : similarScope(doc).select("a[href]")) {
                Matcher m = AGENT_LINK.matcher(a.attr("href"));
                if (m.find()) {
                    String name = m.group(1);
                    if (!name.isBlank() && !name.equalsIgnoreCase(agentName)) {
                        similar.add(name);
                    }
                }
            }
        }
        LOG.debug("[HTML] {}: owner={} similar={}", agentName, handle, similar.size());
        return new ProfilePageInfo(handle, xUrl, List.copyOf(similar));
    }

    private static Element similarScope(Document doc) {
        Elements headings = doc.getElementsContainingOwnText(SIMILAR_HEADING);
        Element scope = headings.isEmpty() ? null : headings.first();
        while (scope != null && scope.select("a[href*=/u/]").isEmpty()) {
            scope = scope.parent();
        }
        return scope != null ? scope : doc;
    }
}
