package com.releasefeed.core.events;

import java.time.Instant;

public record FeedParsed(
        Instant timestamp,
        String url,
        String format,
        int itemCount,
        int droppedEntries
) implements Event {
    @Override
    public String type() {
        return "FeedParsed";
    }
}
