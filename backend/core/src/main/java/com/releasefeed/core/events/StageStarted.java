package com.releasefeed.core.events;

import java.time.Instant;

public record StageStarted(Instant timestamp, String stage, int units) implements Event {
    @Override
    public String type() {
        return "StageStarted";
    }
}
