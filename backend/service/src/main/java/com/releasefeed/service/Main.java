package com.releasefeed.service;

import com.releasefeed.core.bus.EventBus;
import com.releasefeed.core.model.RunReport;
import com.releasefeed.pipeline.api.PipelineContext;
import com.releasefeed.pipeline.api.PipelineResult;
import com.releasefeed.pipeline.config.DiscoveryMode;
import com.releasefeed.pipeline.config.PipelineConfig;
import com.releasefeed.pipeline.config.PipelineConfigurationException;
import com.releasefeed.pipeline.http.FetchClient;
import com.releasefeed.pipeline.orchestrator.ReleaseFeedPipeline;
import com.releasefeed.service.config.ConfigLoader;
import com.releasefeed.service.config.FeedCatalog;
import com.releasefeed.service.feed.RssFeedWriter;
import com.releasefeed.service.http.HttpClientFactory;
import com.releasefeed.service.logging.PipelineEventLogger;
import com.releasefeed.service.report.RunReportWriter;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_UNREACHABLE = 2;

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(1);

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        int exit = run(args, System.getenv(), Clock.systemUTC(), System.out);
        System.exit(exit);
    }

    static int run(String[] args, Map<String, String> env, Clock clock, PrintStream out) {
        if (args.length > 1 || (args.length == 1 && !"run".equals(args[0]))) {
            out.println("Usage: release-feed [run]");
            out.println("Settings are read from the environment: BASE_URL, BACKFILL_DAYS, LOOKBACK_YEARS, MAX_WORKERS,");
            out.println("REQUEST_TIMEOUT_SECONDS, MAX_ATTEMPTS, DISCOVERY_MODE, CONFIG_DIR, OUTPUT_PATH, REPORT_PATH");
            return EXIT_CONFIG;
        }

        RuntimeSettings settings = resolveSettings(env, LOGGER::warning);
        PipelineConfig config;
        ReleaseFeedPipeline pipeline;
        try {
            FeedCatalog catalog = ConfigLoader.loadCatalog(settings.configDir());
            config = pipelineConfig(settings, catalog);
            HttpClient httpClient = HttpClientFactory.create(settings.requestTimeout());
            EventBus eventBus = new EventBus();
            PipelineEventLogger.attach(eventBus);
            PipelineContext context = new PipelineContext(
                    new FetchClient(httpClient, settings.requestTimeout(), FetchClient.DEFAULT_USER_AGENT, settings.maxAttempts(), RETRY_BACKOFF),
                    eventBus,
                    clock
            );
            pipeline = new ReleaseFeedPipeline(config, context);
        } catch (IllegalStateException | PipelineConfigurationException e) {
            LOGGER.severe("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        PipelineResult result = pipeline.run();
        new RssFeedWriter(config.baseUrl()).write(result.feed(), settings.outputPath());
        new RunReportWriter(settings.reportPath()).write(result.report());

        RunReport report = result.report();
        if (report.unreachable()) {
            LOGGER.severe("All " + report.validation().candidates() + " candidate feeds failed at the transport level; "
                    + "the portal appears unreachable");
            return EXIT_UNREACHABLE;
        }
        return EXIT_OK;
    }

    static PipelineConfig pipelineConfig(RuntimeSettings settings, FeedCatalog catalog) {
        int maxWorkers = settings.maxWorkers() != null
                ? settings.maxWorkers()
                : catalog.maxWorkers() != null ? catalog.maxWorkers() : PipelineConfig.DEFAULT_MAX_WORKERS;
        PipelineConfig config = new PipelineConfig(
                settings.baseUrl(),
                catalog.products(),
                catalog.probeSlugs(),
                maxWorkers,
                settings.backfillDays(),
                settings.lookbackYears(),
                settings.discoveryMode()
        );
        config.validate();
        return config;
    }

    static RuntimeSettings resolveSettings(Map<String, String> env, Consumer<String> warn) {
        String baseUrl = env.getOrDefault("BASE_URL", PipelineConfig.DEFAULT_BASE_URL);
        int backfillDays = intSetting(env, "BACKFILL_DAYS", PipelineConfig.DEFAULT_BACKFILL_DAYS, warn);
        int lookbackYears = intSetting(env, "LOOKBACK_YEARS", PipelineConfig.DEFAULT_LOOKBACK_YEARS, warn);
        int timeoutSeconds = intSetting(env, "REQUEST_TIMEOUT_SECONDS", 15, warn);
        if (timeoutSeconds < 1) {
            warn.accept("REQUEST_TIMEOUT_SECONDS must be positive, defaulting to 15");
            timeoutSeconds = 15;
        }
        int maxAttempts = intSetting(env, "MAX_ATTEMPTS", 1, warn);

        Integer maxWorkers = null;
        if (env.containsKey("MAX_WORKERS")) {
            maxWorkers = intSetting(env, "MAX_WORKERS", PipelineConfig.DEFAULT_MAX_WORKERS, warn);
        }

        String modeRaw = env.getOrDefault("DISCOVERY_MODE", DiscoveryMode.YEAR_PROBE.name());
        DiscoveryMode mode;
        try {
            mode = DiscoveryMode.valueOf(modeRaw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            warn.accept("Unknown DISCOVERY_MODE=" + modeRaw + ", defaulting to YEAR_PROBE");
            mode = DiscoveryMode.YEAR_PROBE;
        }

        return new RuntimeSettings(
                baseUrl,
                backfillDays,
                lookbackYears,
                maxWorkers,
                Duration.ofSeconds(timeoutSeconds),
                Math.max(1, maxAttempts),
                mode,
                Path.of(env.getOrDefault("CONFIG_DIR", "config")),
                Path.of(env.getOrDefault("OUTPUT_PATH", "public/rss.xml")),
                Path.of(env.getOrDefault("REPORT_PATH", "public/report.json"))
        );
    }

    record RuntimeSettings(
            String baseUrl,
            int backfillDays,
            int lookbackYears,
            Integer maxWorkers,
            Duration requestTimeout,
            int maxAttempts,
            DiscoveryMode discoveryMode,
            Path configDir,
            Path outputPath,
            Path reportPath
    ) {
    }

    private static int intSetting(Map<String, String> env, String name, int fallback, Consumer<String> warn) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            warn.accept("Invalid " + name + "=" + raw + ", defaulting to " + fallback);
            return fallback;
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not read bundled logging.properties: " + e.getMessage());
        }
    }
}
