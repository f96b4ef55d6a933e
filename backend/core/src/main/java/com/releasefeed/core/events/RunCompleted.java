package com.releasefeed.core.events;

import com.releasefeed.core.model.RunReport;

import java.time.Instant;

public record RunCompleted(Instant timestamp, RunReport report) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
