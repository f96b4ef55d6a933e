package com.releasefeed.pipeline.parse;

import com.releasefeed.core.bus.EventBus;
import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.FeedParsed;
import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.FailureKind;
import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.FeedItem;
import com.releasefeed.core.model.ProductSpec;
import com.releasefeed.core.model.ValidatedFeed;
import com.releasefeed.pipeline.api.PipelineContext;
import com.releasefeed.pipeline.http.FetchClient;
import com.releasefeed.pipeline.support.EventCapture;
import com.releasefeed.pipeline.support.FixtureUtils;
import com.releasefeed.pipeline.support.StubPortal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedParserTest {
    private static final String FEED_PATH = "/rss-feed/zia/release-upgrade-summary-2024/zscaler.net";

    private StubPortal portal;
    private EventCapture capture;
    private FeedParser parser;

    @BeforeEach
    void setUp() throws Exception {
        portal = StubPortal.start();
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        capture = new EventCapture(bus);
        parser = new FeedParser(new PipelineContext(
                new FetchClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(), Duration.ofSeconds(2)),
                bus,
                Clock.fixed(Instant.parse("2025-01-03T12:00:00Z"), ZoneOffset.UTC)
        ));
    }

    @AfterEach
    void tearDown() {
        portal.close();
    }

    @Test
    void fetchesAndParsesRssFeed() throws Exception {
        portal.serve(FEED_PATH, FixtureUtils.fixture("fixtures/sample-rss.xml"));

        ParsedFeed parsed = parser.parse(feedAt(FEED_PATH));

        assertTrue(parsed.success());
        assertEquals(FeedFormat.RSS, parsed.format());
        assertEquals(2, parsed.items().size());
        FeedItem first = parsed.items().get(0);
        assertEquals(Instant.parse("2024-12-16T10:00:00Z"), first.publishedAt());
        assertEquals("Available", first.category());
        assertEquals(portal.baseUrl() + FEED_PATH, first.sourceFeed());
        assertEquals(1, capture.byType(FeedParsed.class).size());
        assertEquals("RSS", capture.byType(FeedParsed.class).get(0).format());
    }

    @Test
    void latin1FeedServedWithoutCharsetKeepsAccents() throws Exception {
        portal.serve(FEED_PATH, FixtureUtils.fixtureBytes("fixtures/latin1-rss.xml"), "application/rss+xml");

        ParsedFeed parsed = parser.parse(feedAt(FEED_PATH));

        assertTrue(parsed.success());
        FeedItem item = parsed.items().get(0);
        assertEquals("Caf\u00e9 r\u00e9sum\u00e9 for Z\u00fcrich tenants", item.title());
        assertEquals(Instant.parse("2024-12-16T10:00:00Z"), item.publishedAt());
    }

    @Test
    void atomEntriesUsePublishedThenUpdated() throws Exception {
        ParsedFeed parsed = parser.parseBody("https://feeds.example/atom", FixtureUtils.fixture("fixtures/sample-atom.xml"));

        assertEquals(FeedFormat.ATOM, parsed.format());
        assertEquals(Instant.parse("2024-12-18T08:00:00Z"), parsed.items().get(0).publishedAt());
        assertEquals(Instant.parse("2024-12-17T08:15:00Z"), parsed.items().get(1).publishedAt());
        assertNull(parsed.items().get(1).category());
    }

    @Test
    void entriesWithoutDateOrLinkAreDroppedAndCounted() throws Exception {
        ParsedFeed parsed = parser.parseBody("https://feeds.example/variants", FixtureUtils.fixture("fixtures/rss-variants.xml"));

        assertTrue(parsed.success());
        assertEquals(List.of("Standard story", "Guid only", "Textual date"),
                parsed.items().stream().map(FeedItem::title).toList());
        assertEquals(Instant.parse("2024-12-16T00:00:00Z"), parsed.items().get(2).publishedAt());
        assertEquals(3, parsed.droppedEntries());
        assertEquals(2, parsed.failures().stream().filter(f -> f.kind() == FailureKind.UNPARSABLE_DATE).count());
        assertEquals(1, parsed.failures().stream().filter(f -> f.kind() == FailureKind.MISSING_LINK).count());
        assertEquals(3, capture.byType(FeedParsed.class).get(0).droppedEntries());
    }

    @Test
    void malformedBodyYieldsZeroItemsAndFailureRecord() {
        ParsedFeed parsed = parser.parseBody("https://feeds.example/broken", "<rss><channel><item>");

        assertFalse(parsed.success());
        assertTrue(parsed.items().isEmpty());
        FeedFailure failure = parsed.failures().get(0);
        assertEquals(FailureKind.MALFORMED_FEED_BODY, failure.kind());
        assertEquals("https://feeds.example/broken", failure.url());
        assertEquals(1, capture.byType(AlertRaised.class).size());
        assertEquals("parsing", capture.byType(AlertRaised.class).get(0).category());
    }

    @Test
    void unrecognizedStructureYieldsFailureRecord() throws Exception {
        ParsedFeed parsed = parser.parseBody("https://feeds.example/sitemap", FixtureUtils.fixture("fixtures/unknown-structure.xml"));

        assertFalse(parsed.success());
        assertEquals(FailureKind.UNRECOGNIZED_FEED_STRUCTURE, parsed.failures().get(0).kind());
    }

    @Test
    void nonSuccessStatusOnFetchIsNotFoundOrInvalid() {
        portal.status(FEED_PATH, 500);

        ParsedFeed parsed = parser.parse(feedAt(FEED_PATH));

        assertFalse(parsed.success());
        assertEquals(FailureKind.NOT_FOUND_OR_INVALID, parsed.failures().get(0).kind());
    }

    @Test
    void transportFailureOnFetchIsTransient() {
        String url = portal.baseUrl() + FEED_PATH;
        portal.close();

        ParsedFeed parsed = parser.parse(new ValidatedFeed(new CandidateUrl(new ProductSpec("zia", "zscaler.net"), 2024, url), 200));

        assertFalse(parsed.success());
        assertEquals(FailureKind.TRANSIENT_NETWORK, parsed.failures().get(0).kind());
    }

    private ValidatedFeed feedAt(String path) {
        return new ValidatedFeed(new CandidateUrl(new ProductSpec("zia", "zscaler.net"), 2024, portal.baseUrl() + path), 200);
    }
}
