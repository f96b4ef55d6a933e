package com.releasefeed.core.model;

import java.util.Objects;

public record CandidateUrl(ProductSpec product, int year, String url) {
    public CandidateUrl {
        Objects.requireNonNull(product, "product is required");
        Objects.requireNonNull(url, "url is required");
    }
}
