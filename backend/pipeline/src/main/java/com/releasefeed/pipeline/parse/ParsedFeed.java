package com.releasefeed.pipeline.parse;

import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.FeedItem;

import java.util.List;
import java.util.Objects;

/**
 * Result of fetching and parsing one feed. A failed feed carries no items and at least one failure.
 */
public record ParsedFeed(
        String url,
        FeedFormat format,
        boolean success,
        List<FeedItem> items,
        int droppedEntries,
        List<FeedFailure> failures
) {
    public ParsedFeed {
        Objects.requireNonNull(url, "url is required");
        items = items == null ? List.of() : List.copyOf(items);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ParsedFeed failed(String url, FeedFailure failure) {
        return new ParsedFeed(url, null, false, List.of(), 0, List.of(failure));
    }
}
