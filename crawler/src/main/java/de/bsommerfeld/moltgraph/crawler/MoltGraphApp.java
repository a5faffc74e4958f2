package de.bsommerfeld.moltgraph.crawler;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.moltgraph.core.config.ConfigLoader;
import de.bsommerfeld.moltgraph.core.config.ConfigurationException;
import de.bsommerfeld.moltgraph.core.config.GlobalConfig;
import de.bsommerfeld.moltgraph.core.domain.CrawlMode;
import de.bsommerfeld.moltgraph.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: {@code moltgraph [full|incremental]}.
 *
 * <p>
 * Exit codes: {@code 0} crawl ran (individual stages may have failed),
 * {@code 1} configuration unusable, {@code 2} bad arguments.
 */
public final class MoltGraphApp {

    static {
        // must run before the first logger is created
        Path logDir = StorageUtils.getLogsDir(ConfigLoader.fromSystemEnvironment().dataDir());
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MoltGraphApp.class);

    private MoltGraphApp() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CrawlMode mode;
        try {
            mode = CrawlMode.parse(args.length > 0 ? args[0] : "full");
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: moltgraph [full|incremental]");
            return 2;
        }

        ConfigLoader loader = ConfigLoader.fromSystemEnvironment();
        GlobalConfig config;
        try {
            config = loader.load();
            ConfigLoader.validate(config);
        } catch (ConfigurationException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            return 1;
        }

        CrawlOrchestrator orchestrator;
        try {
            Injector injector = Guice.createInjector(new CrawlerModule(loader, config));
            injector.getInstance(CrawlProgressLogger.class);
            orchestrator = injector.getInstance(CrawlOrchestrator.class);
        } catch (ProvisionException e) {
            // the graph database could not be opened
            LOG.error("Startup failed: {}", e.getMessage(), e);
            return 1;
        }
        CrawlReport report = orchestrator.run(mode);
        LOG.info("{}", report);
        return 0;
    }
}
