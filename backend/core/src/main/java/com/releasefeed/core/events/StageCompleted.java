package com.releasefeed.core.events;

import java.time.Instant;
import java.util.Map;

public record StageCompleted(
        Instant timestamp,
        String stage,
        long durationMillis,
        Map<String, Object> counts
) implements Event {
    @Override
    public String type() {
        return "StageCompleted";
    }
}
