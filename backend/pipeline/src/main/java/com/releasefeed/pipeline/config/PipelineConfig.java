package com.releasefeed.pipeline.config;

import com.releasefeed.core.model.ProductSpec;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable run parameters. Built once before a run and never mutated while the pipeline executes.
 */
public record PipelineConfig(
        String baseUrl,
        List<ProductSpec> products,
        List<String> probeSlugs,
        int maxWorkers,
        int backfillDays,
        int lookbackYears,
        DiscoveryMode discoveryMode
) {
    public static final String DEFAULT_BASE_URL = "https://help.zscaler.com";
    public static final int DEFAULT_MAX_WORKERS = 10;
    public static final int DEFAULT_BACKFILL_DAYS = 14;
    public static final int DEFAULT_LOOKBACK_YEARS = 3;

    public PipelineConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : stripTrailingSlash(baseUrl.trim());
        products = products == null ? List.of() : List.copyOf(products);
        probeSlugs = probeSlugs == null ? List.of() : List.copyOf(probeSlugs);
        discoveryMode = discoveryMode == null ? DiscoveryMode.YEAR_PROBE : discoveryMode;
    }

    public static PipelineConfig defaults(List<ProductSpec> products) {
        return new PipelineConfig(
                DEFAULT_BASE_URL,
                products,
                List.of(),
                DEFAULT_MAX_WORKERS,
                DEFAULT_BACKFILL_DAYS,
                DEFAULT_LOOKBACK_YEARS,
                DiscoveryMode.YEAR_PROBE
        );
    }

    public PipelineConfig withBackfillDays(int days) {
        return new PipelineConfig(baseUrl, products, probeSlugs, maxWorkers, days, lookbackYears, discoveryMode);
    }

    public PipelineConfig withBaseUrl(String url) {
        return new PipelineConfig(url, products, probeSlugs, maxWorkers, backfillDays, lookbackYears, discoveryMode);
    }

    public PipelineConfig withMaxWorkers(int workers) {
        return new PipelineConfig(baseUrl, products, probeSlugs, workers, backfillDays, lookbackYears, discoveryMode);
    }

    public PipelineConfig withLookbackYears(int years) {
        return new PipelineConfig(baseUrl, products, probeSlugs, maxWorkers, backfillDays, years, discoveryMode);
    }

    public PipelineConfig withDiscoveryMode(DiscoveryMode mode) {
        return new PipelineConfig(baseUrl, products, probeSlugs, maxWorkers, backfillDays, lookbackYears, mode);
    }

    /**
     * Products whose year partitions are probed during discovery: the configured probe slugs in
     * configuration order, or every product when none are configured.
     */
    public List<ProductSpec> probeProducts() {
        if (probeSlugs.isEmpty()) {
            return products;
        }
        Set<String> wanted = new HashSet<>(probeSlugs);
        List<ProductSpec> selected = products.stream()
                .filter(product -> wanted.contains(product.slug()))
                .toList();
        return selected.isEmpty() ? products : selected;
    }

    public void validate() {
        if (products.isEmpty()) {
            throw new PipelineConfigurationException("No products configured");
        }
        Set<String> slugs = new HashSet<>();
        for (ProductSpec product : products) {
            if (!slugs.add(product.slug())) {
                throw new PipelineConfigurationException("Duplicate product slug: " + product.slug());
            }
        }
        if (maxWorkers < 1) {
            throw new PipelineConfigurationException("maxWorkers must be at least 1, was " + maxWorkers);
        }
        if (backfillDays < 0) {
            throw new PipelineConfigurationException("backfillDays must not be negative, was " + backfillDays);
        }
        if (lookbackYears < 0) {
            throw new PipelineConfigurationException("lookbackYears must not be negative, was " + lookbackYears);
        }
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new PipelineConfigurationException("baseUrl must be an http(s) URL: " + baseUrl);
        }
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
