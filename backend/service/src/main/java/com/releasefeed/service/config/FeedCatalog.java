package com.releasefeed.service.config;

import com.releasefeed.core.model.ProductSpec;

import java.util.List;

/**
 * Contents of {@code products.json}: the product catalogue plus the discovery probe selection and
 * the default worker pool width.
 */
public record FeedCatalog(
        List<ProductSpec> products,
        List<String> probeSlugs,
        Integer maxWorkers
) {
    public FeedCatalog {
        products = products == null ? List.of() : List.copyOf(products);
        probeSlugs = probeSlugs == null ? List.of() : List.copyOf(probeSlugs);
    }
}
