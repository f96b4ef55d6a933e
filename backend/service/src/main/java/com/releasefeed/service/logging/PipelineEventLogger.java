package com.releasefeed.service.logging;

import com.releasefeed.core.bus.EventBus;
import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.FeedParsed;
import com.releasefeed.core.events.FeedValidated;
import com.releasefeed.core.events.RunCompleted;
import com.releasefeed.core.events.StageCompleted;
import com.releasefeed.core.events.StageStarted;
import com.releasefeed.core.model.RunReport;

import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Turns pipeline events into log lines. Stage boundaries, parsed feeds and the run summary log at INFO,
 * per-candidate validation at FINE, alerts at WARNING.
 */
public final class PipelineEventLogger {
    private static final Logger LOGGER = Logger.getLogger(PipelineEventLogger.class.getName());

    private PipelineEventLogger() {
    }

    public static void attach(EventBus eventBus) {
        eventBus.subscribe(StageStarted.class, event ->
                LOGGER.info("Stage " + event.stage() + " started (" + event.units() + " units)"));
        eventBus.subscribe(StageCompleted.class, event ->
                LOGGER.info("Stage " + event.stage() + " completed in " + event.durationMillis() + " ms "
                        + new TreeMap<>(event.counts())));
        eventBus.subscribe(FeedValidated.class, event ->
                LOGGER.fine(() -> "Checked " + event.url() + " -> "
                        + (event.status() == 0 ? "no response" : "HTTP " + event.status())
                        + (event.valid() ? " (valid)" : " (invalid)") + " in " + event.durationMillis() + " ms"));
        eventBus.subscribe(FeedParsed.class, event ->
                LOGGER.info("Parsed " + event.format() + " feed " + event.url() + ": "
                        + event.itemCount() + " items, " + event.droppedEntries() + " dropped"));
        eventBus.subscribe(AlertRaised.class, event ->
                LOGGER.warning("[" + event.category() + "] " + event.message()));
        eventBus.subscribe(RunCompleted.class, event -> LOGGER.info(summary(event.report())));
    }

    static String summary(RunReport report) {
        return "Run completed in " + report.durationMillis() + " ms: "
                + "years " + report.discovery().discoveredYears()
                + ", candidates " + report.validation().candidates()
                + ", valid " + report.validation().valid()
                + ", not found " + report.validation().notFound()
                + ", errors " + report.validation().errored()
                + ", parsed " + report.parsing().parsedFeeds()
                + ", failed " + report.parsing().failedFeeds()
                + ", dropped entries " + report.parsing().droppedEntries()
                + ", items " + report.aggregation().finalItems();
    }
}
