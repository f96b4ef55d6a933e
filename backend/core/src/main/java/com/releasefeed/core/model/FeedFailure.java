package com.releasefeed.core.model;

import java.util.Objects;

public record FeedFailure(String url, FailureKind kind, String message) {
    public FeedFailure {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(kind, "kind is required");
        message = message == null ? "" : message;
    }
}
