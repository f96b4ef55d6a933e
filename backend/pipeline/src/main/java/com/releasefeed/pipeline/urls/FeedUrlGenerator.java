package com.releasefeed.pipeline.urls;

import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.ProductSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps (product, year) pairs onto the portal's feed path template
 * {@code {base}/rss-feed/{slug}/release-upgrade-summary-{year}/{domain}}. No I/O.
 */
public final class FeedUrlGenerator {
    private final String baseUrl;

    public FeedUrlGenerator(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public CandidateUrl candidateFor(ProductSpec product, int year) {
        String url = baseUrl + "/rss-feed/" + product.slug() + "/release-upgrade-summary-" + year + "/" + product.domain();
        return new CandidateUrl(product, year, url);
    }

    /** One candidate per pair, years in the given order and products in configuration order within a year. */
    public List<CandidateUrl> candidates(List<ProductSpec> products, List<Integer> years) {
        List<CandidateUrl> candidates = new ArrayList<>(products.size() * years.size());
        for (Integer year : years) {
            for (ProductSpec product : products) {
                candidates.add(candidateFor(product, year));
            }
        }
        return candidates;
    }
}
