package com.releasefeed.pipeline.http;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Outcome of one HTTP exchange: either a status (with the raw body for GETs) or a transport failure.
 * The body is kept as bytes so XML consumers can honour the document's own encoding declaration.
 */
public record FetchResponse(String url, int statusCode, byte[] body, FetchFailure failure) {
    public FetchResponse {
        Objects.requireNonNull(url, "url is required");
    }

    public static FetchResponse of(String url, int statusCode, byte[] body) {
        return new FetchResponse(url, statusCode, body, null);
    }

    public static FetchResponse failed(String url, FetchFailure failure) {
        return new FetchResponse(url, 0, null, Objects.requireNonNull(failure, "failure is required"));
    }

    /** Body decoded as UTF-8, or null for bodyless responses. */
    public String bodyText() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }

    public boolean isTransportFailure() {
        return failure != null;
    }

    public boolean isSuccess() {
        return failure == null && statusCode >= 200 && statusCode < 300;
    }

    public String describe() {
        if (failure != null) {
            return failure.kind() + ": " + failure.message();
        }
        return "HTTP " + statusCode;
    }
}
