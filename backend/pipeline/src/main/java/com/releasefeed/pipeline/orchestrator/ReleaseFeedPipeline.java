package com.releasefeed.pipeline.orchestrator;

import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.RunCompleted;
import com.releasefeed.core.events.StageCompleted;
import com.releasefeed.core.events.StageStarted;
import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.FailureKind;
import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.FeedItem;
import com.releasefeed.core.model.RunReport;
import com.releasefeed.pipeline.aggregate.AggregationResult;
import com.releasefeed.pipeline.aggregate.FeedAggregator;
import com.releasefeed.pipeline.api.PipelineContext;
import com.releasefeed.pipeline.api.PipelineResult;
import com.releasefeed.pipeline.concurrent.WorkerPool;
import com.releasefeed.pipeline.config.DiscoveryMode;
import com.releasefeed.pipeline.config.PipelineConfig;
import com.releasefeed.pipeline.discovery.DirectoryDiscovery;
import com.releasefeed.pipeline.discovery.DiscoveryResult;
import com.releasefeed.pipeline.discovery.YearDiscovery;
import com.releasefeed.pipeline.parse.FeedParser;
import com.releasefeed.pipeline.parse.ParsedFeed;
import com.releasefeed.pipeline.urls.FeedUrlGenerator;
import com.releasefeed.pipeline.validation.FeedValidator;
import com.releasefeed.pipeline.validation.ValidationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Runs discovery, URL generation, validation, parsing and aggregation as one pass.
 *
 * <p>Every run creates its own {@link WorkerPool} of {@code config.maxWorkers()} threads, shared by the
 * validation and parsing fan-outs, and closes it when the run ends. Per-feed failures end up in the
 * {@link RunReport}; only an invalid configuration stops a run, and it does so before any request is made.
 */
public class ReleaseFeedPipeline {
    private static final Logger LOGGER = Logger.getLogger(ReleaseFeedPipeline.class.getName());

    public enum State {
        IDLE,
        RUNNING,
        DONE
    }

    private final PipelineConfig config;
    private final PipelineContext ctx;
    private final FeedUrlGenerator urlGenerator;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile RunReport lastReport;

    public ReleaseFeedPipeline(PipelineConfig config, PipelineContext ctx) {
        config.validate();
        this.config = config;
        this.ctx = ctx;
        this.urlGenerator = new FeedUrlGenerator(config.baseUrl());
    }

    public State state() {
        return state.get();
    }

    public Optional<RunReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public PipelineResult run() {
        State previous = state.getAndSet(State.RUNNING);
        if (previous == State.RUNNING) {
            throw new IllegalStateException("Pipeline is already running");
        }
        Instant startedAt = ctx.clock().instant();
        try (WorkerPool pool = new WorkerPool(config.maxWorkers())) {
            PipelineResult result = execute(pool, startedAt);
            lastReport = result.report();
            ctx.eventBus().publish(new RunCompleted(ctx.clock().instant(), result.report()));
            return result;
        } finally {
            state.set(State.DONE);
        }
    }

    private PipelineResult execute(WorkerPool pool, Instant startedAt) {
        FeedValidator validator = new FeedValidator(ctx, pool);
        List<FeedFailure> failures = new ArrayList<>();

        Instant stageStart = stageStarted("discovery", config.probeProducts().size());
        DiscoveryResult discovery = discover(validator);
        failures.addAll(discovery.failures());
        stageCompleted("discovery", stageStart, Map.of(
                "probedYears", discovery.probedYears(),
                "discoveredYears", discovery.discoveredYears(),
                "unknownProbes", discovery.unknownProbes()
        ));

        List<CandidateUrl> candidates = discovery.listsCandidates()
                ? discovery.candidates()
                : urlGenerator.candidates(config.products(), discovery.discoveredYears());

        stageStart = stageStarted("validation", candidates.size());
        ValidationResult validation = validator.validate(candidates);
        failures.addAll(validation.failures());
        RunReport.Validation validationCounts = validation.toReport();
        stageCompleted("validation", stageStart, Map.of(
                "candidates", validationCounts.candidates(),
                "valid", validationCounts.valid(),
                "notFound", validationCounts.notFound(),
                "errored", validationCounts.errored()
        ));

        stageStart = stageStarted("parsing", validation.valid().size());
        FeedParser parser = new FeedParser(ctx);
        List<ParsedFeed> parsedFeeds = pool.mapAll(validation.valid(), parser::parse, (feed, error) -> {
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "parsing",
                    "Unexpected parser failure for " + feed.url() + ": " + error,
                    Map.of("url", feed.url())
            ));
            return ParsedFeed.failed(feed.url(), new FeedFailure(feed.url(), FailureKind.MALFORMED_FEED_BODY, String.valueOf(error)));
        });
        List<FeedItem> rawItems = new ArrayList<>();
        int parsedCount = 0;
        int dropped = 0;
        for (ParsedFeed parsed : parsedFeeds) {
            if (parsed.success()) {
                parsedCount++;
            }
            dropped += parsed.droppedEntries();
            rawItems.addAll(parsed.items());
            failures.addAll(parsed.failures());
        }
        RunReport.Parsing parsingCounts = new RunReport.Parsing(parsedCount, parsedFeeds.size() - parsedCount, dropped, rawItems.size());
        stageCompleted("parsing", stageStart, Map.of(
                "parsedFeeds", parsingCounts.parsedFeeds(),
                "failedFeeds", parsingCounts.failedFeeds(),
                "droppedEntries", parsingCounts.droppedEntries(),
                "rawItems", parsingCounts.rawItems()
        ));

        stageStart = stageStarted("aggregation", rawItems.size());
        AggregationResult aggregation = new FeedAggregator(ctx.clock(), config.backfillDays()).aggregate(rawItems);
        stageCompleted("aggregation", stageStart, Map.of(
                "inputItems", aggregation.counts().inputItems(),
                "outsideWindow", aggregation.counts().outsideWindow(),
                "finalItems", aggregation.counts().finalItems()
        ));

        RunReport report = new RunReport(
                startedAt,
                ctx.clock().instant(),
                discovery.toReport(),
                validationCounts,
                parsingCounts,
                aggregation.counts(),
                failures
        );
        LOGGER.info("Run finished: " + report.discovery().discoveredYears().size() + " years, "
                + validationCounts.valid() + "/" + validationCounts.candidates() + " feeds valid, "
                + parsingCounts.parsedFeeds() + " parsed, "
                + aggregation.counts().finalItems() + " items in window");
        return new PipelineResult(aggregation.feed(), report);
    }

    private DiscoveryResult discover(FeedValidator validator) {
        if (config.discoveryMode() == DiscoveryMode.DIRECTORY) {
            Optional<DiscoveryResult> listed = new DirectoryDiscovery(ctx.fetchClient(), urlGenerator, ctx.clock())
                    .discover(config.products(), config.lookbackYears());
            if (listed.isPresent() && listed.get().listsCandidates()) {
                return listed.get();
            }
            LOGGER.warning("RSS directory yielded no feeds; falling back to year probing");
        }
        return new YearDiscovery(validator, urlGenerator, ctx.clock())
                .discover(config.probeProducts(), config.lookbackYears());
    }

    private Instant stageStarted(String stage, int units) {
        Instant now = ctx.clock().instant();
        ctx.eventBus().publish(new StageStarted(now, stage, units));
        return now;
    }

    private void stageCompleted(String stage, Instant startedAt, Map<String, Object> counts) {
        Instant now = ctx.clock().instant();
        ctx.eventBus().publish(new StageCompleted(now, stage, Duration.between(startedAt, now).toMillis(), new HashMap<>(counts)));
    }
}
