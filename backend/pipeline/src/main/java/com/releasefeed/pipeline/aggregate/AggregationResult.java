package com.releasefeed.pipeline.aggregate;

import com.releasefeed.core.model.AggregatedFeed;
import com.releasefeed.core.model.RunReport;

import java.util.Objects;

public record AggregationResult(AggregatedFeed feed, RunReport.Aggregation counts) {
    public AggregationResult {
        Objects.requireNonNull(feed, "feed is required");
        Objects.requireNonNull(counts, "counts is required");
    }
}
