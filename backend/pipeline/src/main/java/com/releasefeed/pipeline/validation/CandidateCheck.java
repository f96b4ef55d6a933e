package com.releasefeed.pipeline.validation;

import com.releasefeed.core.model.CandidateUrl;

import java.util.Objects;

public record CandidateCheck(CandidateUrl candidate, Verdict verdict, int statusCode, String detail) {
    public CandidateCheck {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(verdict, "verdict is required");
        detail = detail == null ? "" : detail;
    }
}
