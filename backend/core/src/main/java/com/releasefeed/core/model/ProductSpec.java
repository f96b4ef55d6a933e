package com.releasefeed.core.model;

import java.util.Objects;

public record ProductSpec(String slug, String domain) {
    public ProductSpec {
        Objects.requireNonNull(slug, "slug is required");
        Objects.requireNonNull(domain, "domain is required");
        if (slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be blank");
        }
        if (domain.isBlank()) {
            throw new IllegalArgumentException("domain must not be blank for product " + slug);
        }
        slug = slug.trim();
        domain = domain.trim();
    }
}
