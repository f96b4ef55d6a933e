package com.releasefeed.pipeline.api;

import com.releasefeed.core.bus.EventBus;
import com.releasefeed.pipeline.http.FetchClient;

import java.time.Clock;
import java.util.Objects;

public record PipelineContext(
        FetchClient fetchClient,
        EventBus eventBus,
        Clock clock
) {
    public PipelineContext {
        Objects.requireNonNull(fetchClient, "fetchClient is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
