package com.releasefeed.pipeline.validation;

import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.RunReport;
import com.releasefeed.core.model.ValidatedFeed;

import java.util.List;

public record ValidationResult(List<CandidateCheck> checks, List<ValidatedFeed> valid, List<FeedFailure> failures) {
    public ValidationResult {
        checks = checks == null ? List.of() : List.copyOf(checks);
        valid = valid == null ? List.of() : List.copyOf(valid);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int count(Verdict verdict) {
        return (int) checks.stream().filter(check -> check.verdict() == verdict).count();
    }

    public RunReport.Validation toReport() {
        return new RunReport.Validation(checks.size(), count(Verdict.VALID), count(Verdict.NOT_FOUND), count(Verdict.ERROR));
    }
}
