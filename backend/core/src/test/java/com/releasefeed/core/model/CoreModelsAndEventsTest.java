package com.releasefeed.core.model;

import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.FeedParsed;
import com.releasefeed.core.events.FeedValidated;
import com.releasefeed.core.events.RunCompleted;
import com.releasefeed.core.events.StageCompleted;
import com.releasefeed.core.events.StageStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Instant NOW = Instant.parse("2025-01-03T12:00:00Z");

    @Test
    void productSpecTrimsAndRejectsBlankFields() {
        ProductSpec product = new ProductSpec(" zia ", " zscaler.net ");

        assertEquals("zia", product.slug());
        assertEquals("zscaler.net", product.domain());
        assertThrows(IllegalArgumentException.class, () -> new ProductSpec(" ", "zscaler.net"));
        assertThrows(IllegalArgumentException.class, () -> new ProductSpec("zia", ""));
        assertThrows(NullPointerException.class, () -> new ProductSpec(null, "zscaler.net"));
    }

    @Test
    void feedItemRequiresLinkAndTimestampAndDefaultsText() {
        FeedItem item = new FeedItem(null, "https://example.com/a", NOW, null, null, null);

        assertEquals("", item.title());
        assertEquals("", item.description());
        assertEquals("", item.sourceFeed());
        assertEquals(null, item.category());
        assertThrows(IllegalArgumentException.class, () -> new FeedItem("t", "  ", NOW, "", null, "f"));
        assertThrows(NullPointerException.class, () -> new FeedItem("t", "https://example.com/a", null, "", null, "f"));
    }

    @Test
    void aggregatedFeedCopiesItemsAndAllowsEmpty() {
        List<FeedItem> source = new ArrayList<>();
        source.add(new FeedItem("t", "https://example.com/a", NOW, "", null, "f"));
        AggregatedFeed feed = new AggregatedFeed(source, NOW, NOW.minusSeconds(60), NOW);
        source.clear();

        assertEquals(1, feed.items().size());
        assertTrue(AggregatedFeed.empty(NOW, NOW, NOW).isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> feed.items().add(null));
    }

    @Test
    void runReportDetectsUnreachablePortal() {
        RunReport unreachable = report(new RunReport.Validation(4, 0, 0, 4));
        RunReport allMissing = report(new RunReport.Validation(4, 0, 4, 0));
        RunReport nothingToValidate = report(new RunReport.Validation(0, 0, 0, 0));

        assertTrue(unreachable.unreachable());
        assertFalse(allMissing.unreachable());
        assertFalse(nothingToValidate.unreachable());
        assertEquals(4, allMissing.validation().invalid());
        assertEquals(60_000, unreachable.durationMillis());
    }

    @Test
    void eventsExposeTypeAndPayload() {
        RunReport report = report(new RunReport.Validation(1, 1, 0, 0));

        StageStarted started = new StageStarted(NOW, "discovery", 5);
        StageCompleted completed = new StageCompleted(NOW, "discovery", 100, Map.of("years", 2));
        FeedValidated validated = new FeedValidated(NOW, "https://example.com/feed", 200, true, 10);
        FeedParsed parsed = new FeedParsed(NOW, "https://example.com/feed", "RSS", 3, 1);
        AlertRaised alert = new AlertRaised(NOW, "parsing", "malformed", Map.of("url", "https://example.com/feed"));
        RunCompleted run = new RunCompleted(NOW, report);

        assertEquals("StageStarted", started.type());
        assertEquals("StageCompleted", completed.type());
        assertEquals("FeedValidated", validated.type());
        assertEquals("FeedParsed", parsed.type());
        assertEquals("AlertRaised", alert.type());
        assertEquals("RunCompleted", run.type());
        assertEquals(2, completed.counts().get("years"));
        assertEquals(1, run.report().validation().valid());
    }

    private static RunReport report(RunReport.Validation validation) {
        return new RunReport(
                NOW.minusSeconds(60),
                NOW,
                RunReport.Discovery.none(),
                validation,
                new RunReport.Parsing(0, 0, 0, 0),
                new RunReport.Aggregation(0, 0, 0, 0),
                null
        );
    }
}
