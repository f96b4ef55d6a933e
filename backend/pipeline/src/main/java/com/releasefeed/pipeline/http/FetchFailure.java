package com.releasefeed.pipeline.http;

import java.util.Objects;

public record FetchFailure(Kind kind, String message) {
    public enum Kind {
        TIMEOUT,
        UNKNOWN_HOST,
        CONNECTION_FAILED,
        CONNECTION_RESET,
        INVALID_URL,
        INTERRUPTED,
        IO
    }

    public FetchFailure {
        Objects.requireNonNull(kind, "kind is required");
        message = message == null ? "" : message;
    }
}
