package com.releasefeed.pipeline.discovery;

import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.RunReport;

import java.util.List;

/**
 * Years found by discovery plus, for front-ends that list feeds directly, the candidates they found.
 * An empty {@code candidates} list means candidates are generated from {@code discoveredYears}.
 */
public record DiscoveryResult(
        List<Integer> probedYears,
        List<Integer> discoveredYears,
        int validProbes,
        int invalidProbes,
        int unknownProbes,
        List<CandidateUrl> candidates,
        List<FeedFailure> failures
) {
    public DiscoveryResult {
        probedYears = probedYears == null ? List.of() : List.copyOf(probedYears);
        discoveredYears = discoveredYears == null ? List.of() : List.copyOf(discoveredYears);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean listsCandidates() {
        return !candidates.isEmpty();
    }

    public RunReport.Discovery toReport() {
        return new RunReport.Discovery(probedYears, discoveredYears, validProbes, invalidProbes, unknownProbes);
    }
}
