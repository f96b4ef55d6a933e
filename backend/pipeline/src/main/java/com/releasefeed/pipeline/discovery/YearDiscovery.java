package com.releasefeed.pipeline.discovery;

import com.releasefeed.core.model.ProductSpec;
import com.releasefeed.pipeline.urls.FeedUrlGenerator;
import com.releasefeed.pipeline.validation.CandidateCheck;
import com.releasefeed.pipeline.validation.FeedValidator;
import com.releasefeed.pipeline.validation.ValidationResult;
import com.releasefeed.pipeline.validation.Verdict;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Finds the year partitions that currently exist by HEAD-probing the probe products' feed URL for
 * every year in {@code [Y - lookback, Y + 1]}.
 *
 * <p>A year is kept when at least one probe is valid. A year whose probes all failed at the transport
 * level (no definitive answer) is kept as well and left to the validation stage; only years answered
 * with non-2xx by every probe are dropped.
 */
public class YearDiscovery {
    private static final Logger LOGGER = Logger.getLogger(YearDiscovery.class.getName());

    private final FeedValidator validator;
    private final FeedUrlGenerator urlGenerator;
    private final Clock clock;

    public YearDiscovery(FeedValidator validator, FeedUrlGenerator urlGenerator, Clock clock) {
        this.validator = validator;
        this.urlGenerator = urlGenerator;
        this.clock = clock;
    }

    public static List<Integer> yearRange(int currentYear, int lookbackYears) {
        List<Integer> years = new ArrayList<>();
        for (int year = currentYear - lookbackYears; year <= currentYear + 1; year++) {
            years.add(year);
        }
        return years;
    }

    public DiscoveryResult discover(List<ProductSpec> probeProducts, int lookbackYears) {
        int currentYear = LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear();
        List<Integer> probedYears = yearRange(currentYear, lookbackYears);

        ValidationResult probes = validator.validate(urlGenerator.candidates(probeProducts, probedYears));

        Map<Integer, EnumMap<Verdict, Integer>> byYear = new HashMap<>();
        for (CandidateCheck check : probes.checks()) {
            byYear.computeIfAbsent(check.candidate().year(), ignored -> new EnumMap<>(Verdict.class))
                    .merge(check.verdict(), 1, Integer::sum);
        }

        List<Integer> discovered = new ArrayList<>();
        for (Integer year : probedYears) {
            EnumMap<Verdict, Integer> verdicts = byYear.getOrDefault(year, new EnumMap<>(Verdict.class));
            int valid = verdicts.getOrDefault(Verdict.VALID, 0);
            int unknown = verdicts.getOrDefault(Verdict.ERROR, 0);
            if (valid > 0) {
                discovered.add(year);
            } else if (unknown > 0) {
                LOGGER.warning("Year " + year + " could not be probed (" + unknown + " probe errors); keeping it for validation");
                discovered.add(year);
            } else {
                LOGGER.fine("Year " + year + " has no published feeds; skipping");
            }
        }
        discovered.sort(Comparator.reverseOrder());

        return new DiscoveryResult(
                probedYears,
                discovered,
                probes.count(Verdict.VALID),
                probes.count(Verdict.NOT_FOUND),
                probes.count(Verdict.ERROR),
                List.of(),
                probes.failures()
        );
    }
}
