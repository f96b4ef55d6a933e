package com.releasefeed.pipeline.aggregate;

import com.releasefeed.core.model.AggregatedFeed;
import com.releasefeed.core.model.FeedItem;
import com.releasefeed.core.model.RunReport;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the items of all feeds into one newest-first list.
 *
 * <p>The retention window runs from the start of the UTC day {@code backfillDays} days before today up
 * to the current instant, so a 14 day window evaluated on 2025-01-03 keeps everything published on or
 * after 2024-12-20. Within the window, items sharing a normalized link collapse to the most recently
 * published one (the first seen on ties). Ordering is by publication time, descending, and stable.
 */
public class FeedAggregator {
    private static final Comparator<FeedItem> NEWEST_FIRST =
            Comparator.comparing(FeedItem::publishedAt, Comparator.reverseOrder());

    private final Clock clock;
    private final int backfillDays;

    public FeedAggregator(Clock clock, int backfillDays) {
        if (backfillDays < 0) {
            throw new IllegalArgumentException("backfillDays must not be negative");
        }
        this.clock = clock;
        this.backfillDays = backfillDays;
    }

    public static Instant windowStart(Instant now, int backfillDays) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC)
                .minusDays(backfillDays)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }

    public AggregationResult aggregate(List<FeedItem> items) {
        Instant now = clock.instant();
        Instant start = windowStart(now, backfillDays);

        int outsideWindow = 0;
        Map<String, FeedItem> byLink = new LinkedHashMap<>();
        for (FeedItem item : items) {
            if (item.publishedAt().isBefore(start) || item.publishedAt().isAfter(now)) {
                outsideWindow++;
                continue;
            }
            byLink.merge(LinkNormalizer.normalize(item.link()), item, FeedAggregator::later);
        }

        List<FeedItem> ordered = new ArrayList<>(byLink.values());
        ordered.sort(NEWEST_FIRST);

        AggregatedFeed feed = new AggregatedFeed(ordered, now, start, now);
        RunReport.Aggregation counts = new RunReport.Aggregation(items.size(), byLink.size(), outsideWindow, ordered.size());
        return new AggregationResult(feed, counts);
    }

    private static FeedItem later(FeedItem existing, FeedItem candidate) {
        return candidate.publishedAt().isAfter(existing.publishedAt()) ? candidate : existing;
    }
}
