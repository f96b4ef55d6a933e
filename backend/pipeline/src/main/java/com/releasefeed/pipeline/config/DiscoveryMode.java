package com.releasefeed.pipeline.config;

public enum DiscoveryMode {
    /** HEAD-probe each year partition of the probe products. */
    YEAR_PROBE,
    /** Scrape the portal's RSS directory page, falling back to {@link #YEAR_PROBE} when it is unavailable. */
    DIRECTORY
}
