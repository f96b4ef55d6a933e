package com.releasefeed.pipeline.api;

import com.releasefeed.core.model.AggregatedFeed;
import com.releasefeed.core.model.RunReport;

import java.util.Objects;

public record PipelineResult(AggregatedFeed feed, RunReport report) {
    public PipelineResult {
        Objects.requireNonNull(feed, "feed is required");
        Objects.requireNonNull(report, "report is required");
    }
}
