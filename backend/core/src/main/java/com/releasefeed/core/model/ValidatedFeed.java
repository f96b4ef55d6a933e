package com.releasefeed.core.model;

import java.util.Objects;

public record ValidatedFeed(CandidateUrl candidate, int statusCode) {
    public ValidatedFeed {
        Objects.requireNonNull(candidate, "candidate is required");
    }

    public String url() {
        return candidate.url();
    }
}
