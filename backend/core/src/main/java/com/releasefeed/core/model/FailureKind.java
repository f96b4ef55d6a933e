package com.releasefeed.core.model;

public enum FailureKind {
    TRANSIENT_NETWORK,
    NOT_FOUND_OR_INVALID,
    MALFORMED_FEED_BODY,
    UNRECOGNIZED_FEED_STRUCTURE,
    UNPARSABLE_DATE,
    MISSING_LINK
}
