package com.releasefeed.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry parsed out of a product feed. {@code link} doubles as the identity used for deduplication.
 */
public record FeedItem(
        String title,
        String link,
        Instant publishedAt,
        String description,
        String category,
        String sourceFeed
) {
    public FeedItem {
        Objects.requireNonNull(link, "link is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        if (link.isBlank()) {
            throw new IllegalArgumentException("link must not be blank");
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        sourceFeed = sourceFeed == null ? "" : sourceFeed;
    }
}
