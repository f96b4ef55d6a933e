package com.releasefeed.pipeline.parse;

public enum FeedFormat {
    /** Item-oriented: {@code <rss><channel><item>} (and RSS 1.0 {@code rdf:RDF}). */
    RSS,
    /** Entry-oriented: {@code <feed><entry>}. */
    ATOM
}
