package com.releasefeed.pipeline.http;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Thin blocking facade over a shared {@link HttpClient}. Per-request problems never escape as exceptions;
 * they are mapped to a {@link FetchFailure} on the returned {@link FetchResponse}.
 */
public class FetchClient {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; Release-Feed-Aggregator/1.0; +https://github.com/release-feed)";

    private static final Logger LOGGER = Logger.getLogger(FetchClient.class.getName());

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String userAgent;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public FetchClient(HttpClient httpClient, Duration requestTimeout) {
        this(httpClient, requestTimeout, DEFAULT_USER_AGENT, 1, Duration.ZERO);
    }

    public FetchClient(HttpClient httpClient, Duration requestTimeout, String userAgent, int maxAttempts, Duration retryBackoff) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoff = retryBackoff == null ? Duration.ZERO : retryBackoff;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public FetchResponse head(String url) {
        return execute(url, builder -> builder.method("HEAD", HttpRequest.BodyPublishers.noBody()), false);
    }

    /** Single-byte GET for servers that refuse HEAD. The body is discarded. */
    public FetchResponse rangedGet(String url) {
        return execute(url, builder -> builder.GET().header("Range", "bytes=0-0"), false);
    }

    public FetchResponse get(String url) {
        return execute(url, HttpRequest.Builder::GET, true);
    }

    private FetchResponse execute(String url, UnaryOperator<HttpRequest.Builder> method, boolean readBody) {
        Objects.requireNonNull(url, "url is required");
        HttpRequest request;
        try {
            request = method.apply(HttpRequest.newBuilder(URI.create(url)))
                    .timeout(requestTimeout)
                    .header("User-Agent", userAgent)
                    .build();
        } catch (IllegalArgumentException e) {
            return FetchResponse.failed(url, new FetchFailure(FetchFailure.Kind.INVALID_URL, e.getMessage()));
        }

        FetchResponse response = sendOnce(url, request, readBody);
        if (isStaleConnection(response)) {
            FetchResponse dropped = response;
            LOGGER.fine(() -> "Resending " + url + " on a fresh connection after " + dropped.describe());
            response = sendOnce(url, request, readBody);
        }
        int attempt = 1;
        while (attempt < maxAttempts && isRetryable(response)) {
            FetchResponse failed = response;
            LOGGER.fine(() -> "Retrying " + url + " after " + failed.describe());
            if (!pause(retryBackoff.multipliedBy(attempt))) {
                return response;
            }
            response = sendOnce(url, request, readBody);
            attempt++;
        }
        return response;
    }

    private FetchResponse sendOnce(String url, HttpRequest request, boolean readBody) {
        try {
            if (readBody) {
                HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
                return FetchResponse.of(url, response.statusCode(), response.body());
            }
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return FetchResponse.of(url, response.statusCode(), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResponse.failed(url, new FetchFailure(FetchFailure.Kind.INTERRUPTED, "Interrupted while fetching " + url));
        } catch (IOException e) {
            return FetchResponse.failed(url, classify(url, e));
        } catch (IllegalArgumentException e) {
            return FetchResponse.failed(url, new FetchFailure(FetchFailure.Kind.INVALID_URL, e.getMessage()));
        }
    }

    static FetchFailure classify(String url, IOException error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (hasCause(error, UnknownHostException.class)
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return new FetchFailure(FetchFailure.Kind.UNKNOWN_HOST, "DNS/unknown host while fetching " + url + ": " + rootText);
        }
        if (error instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return new FetchFailure(FetchFailure.Kind.TIMEOUT, "Request timed out while fetching " + url);
        }
        if (hasCause(error, ConnectException.class)) {
            return new FetchFailure(FetchFailure.Kind.CONNECTION_FAILED, "Connection failed for " + url + ": " + rootText);
        }
        if (hasCause(error, EOFException.class)
                || lowered.contains("eof reached")
                || lowered.contains("connection reset")
                || lowered.contains("received no bytes")
                || lowered.contains("connection closed")) {
            return new FetchFailure(FetchFailure.Kind.CONNECTION_RESET, "Connection dropped while fetching " + url + ": " + rootText);
        }
        return new FetchFailure(FetchFailure.Kind.IO, "Fetch failure for " + url + ": " + rootText);
    }

    // a pooled keep-alive connection may already be closed by the server when it is picked up
    private static boolean isStaleConnection(FetchResponse response) {
        return response.isTransportFailure() && response.failure().kind() == FetchFailure.Kind.CONNECTION_RESET;
    }

    private static boolean isRetryable(FetchResponse response) {
        return response.isTransportFailure()
                && response.failure().kind() != FetchFailure.Kind.INVALID_URL
                && response.failure().kind() != FetchFailure.Kind.INTERRUPTED;
    }

    private static boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
