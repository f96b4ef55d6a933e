package com.releasefeed.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Stage-by-stage counts of one pipeline run. Serialized as-is into the run report document.
 */
public record RunReport(
        Instant startedAt,
        Instant completedAt,
        Discovery discovery,
        Validation validation,
        Parsing parsing,
        Aggregation aggregation,
        List<FeedFailure> failures
) {
    public RunReport {
        Objects.requireNonNull(startedAt, "startedAt is required");
        Objects.requireNonNull(completedAt, "completedAt is required");
        Objects.requireNonNull(discovery, "discovery is required");
        Objects.requireNonNull(validation, "validation is required");
        Objects.requireNonNull(parsing, "parsing is required");
        Objects.requireNonNull(aggregation, "aggregation is required");
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public long durationMillis() {
        return Duration.between(startedAt, completedAt).toMillis();
    }

    /**
     * True when there was something to validate and every check ended in a transport error, i.e. the
     * portal could not be reached at all.
     */
    public boolean unreachable() {
        return validation.candidates() > 0 && validation.errored() == validation.candidates();
    }

    public record Discovery(
            List<Integer> probedYears,
            List<Integer> discoveredYears,
            int validProbes,
            int invalidProbes,
            int unknownProbes
    ) {
        public Discovery {
            probedYears = probedYears == null ? List.of() : List.copyOf(probedYears);
            discoveredYears = discoveredYears == null ? List.of() : List.copyOf(discoveredYears);
        }

        public static Discovery none() {
            return new Discovery(List.of(), List.of(), 0, 0, 0);
        }
    }

    public record Validation(int candidates, int valid, int notFound, int errored) {
        public int invalid() {
            return notFound + errored;
        }
    }

    public record Parsing(int parsedFeeds, int failedFeeds, int droppedEntries, int rawItems) {
    }

    public record Aggregation(int inputItems, int uniqueItems, int outsideWindow, int finalItems) {
    }
}
