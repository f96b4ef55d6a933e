package com.releasefeed.core.events;

import java.time.Instant;

public record FeedValidated(
        Instant timestamp,
        String url,
        int status,
        boolean valid,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FeedValidated";
    }
}
