package com.releasefeed.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record AggregatedFeed(
        List<FeedItem> items,
        Instant generatedAt,
        Instant windowStart,
        Instant windowEnd
) {
    public AggregatedFeed {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(windowStart, "windowStart is required");
        Objects.requireNonNull(windowEnd, "windowEnd is required");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static AggregatedFeed empty(Instant generatedAt, Instant windowStart, Instant windowEnd) {
        return new AggregatedFeed(List.of(), generatedAt, windowStart, windowEnd);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
