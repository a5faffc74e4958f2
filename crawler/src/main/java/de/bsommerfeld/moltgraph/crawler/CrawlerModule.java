package de.bsommerfeld.moltgraph.crawler;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.moltgraph.core.config.ApiConfig;
import de.bsommerfeld.moltgraph.core.config.ConfigLoader;
import de.bsommerfeld.moltgraph.core.config.CrawlConfig;
import de.bsommerfeld.moltgraph.core.config.EnrichmentConfig;
import de.bsommerfeld.moltgraph.core.config.GlobalConfig;
import de.bsommerfeld.moltgraph.db.CheckpointStore;
import de.bsommerfeld.moltgraph.db.GraphStore;
import de.bsommerfeld.moltgraph.db.SqlGraphStore;
import de.bsommerfeld.moltgraph.moltbook.HttpTransport;
import de.bsommerfeld.moltgraph.moltbook.RateLimiter;
import de.bsommerfeld.moltgraph.moltbook.RetryPolicy;
import de.bsommerfeld.moltgraph.moltbook.Sleeper;
import de.bsommerfeld.moltgraph.moltbook.html.JsoupProfilePageScraper;
import de.bsommerfeld.moltgraph.moltbook.html.ProfilePageScraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring of the crawler. The configuration is loaded and validated by
 * the caller, so nothing here can fail on missing settings.
 */
public class CrawlerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlerModule.class);

    private final ConfigLoader loader;
    private final GlobalConfig config;

    public CrawlerModule(ConfigLoader loader, GlobalConfig config) {
        this.loader = loader;
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);
        bind(ApiConfig.class).toInstance(config.getApi());
        bind(CrawlConfig.class).toInstance(config.getCrawl());
        bind(EnrichmentConfig.class).toInstance(config.getEnrichment());

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);

        bind(CheckpointStore.class).to(GraphStore.class);
        bind(ProfilePageScraper.class).to(JsoupProfilePageScraper.class);
    }

    @Provides
    @Singleton
    GraphStore provideGraphStore() {
        Path databaseFile = loader.databasePath(config);
        LOG.info("Using graph database: {}", databaseFile.toAbsolutePath());
        return new SqlGraphStore(databaseFile, config.getDatabase());
    }

    @Provides
    @Singleton
    RateLimiter provideRateLimiter(ApiConfig api, Clock clock, Sleeper sleeper) {
        return new RateLimiter(api.getRequestsPerMinute(), clock, sleeper);
    }

    @Provides
    @Singleton
    RetryPolicy provideRetryPolicy(ApiConfig api, Clock clock) {
        return new RetryPolicy(api, clock);
    }

    @Provides
    @Singleton
    HttpClient provideHttpClient(ApiConfig api) {
        return HttpTransport.newHttpClient(api);
    }
}
