package com.releasefeed.pipeline.aggregate;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Deduplication key for item links. Scheme and host are lowercased, {@code http} is folded into
 * {@code https}, default ports, fragments and trailing slashes are removed; query strings are kept.
 * Values that are not absolute URIs only lose their fragment and trailing slashes.
 */
public final class LinkNormalizer {
    private LinkNormalizer() {
    }

    public static String normalize(String link) {
        if (link == null) {
            return "";
        }
        String trimmed = link.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return fallback(trimmed);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return fallback(trimmed);
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if ("http".equals(scheme)) {
            scheme = "https";
        }
        int port = uri.getPort();
        StringBuilder normalized = new StringBuilder()
                .append(scheme)
                .append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));
        if (port != -1 && port != 80 && port != 443) {
            normalized.append(':').append(port);
        }
        normalized.append(stripTrailingSlashes(uri.getRawPath() == null ? "" : uri.getRawPath()));
        if (uri.getRawQuery() != null) {
            normalized.append('?').append(uri.getRawQuery());
        }
        return normalized.toString();
    }

    private static String fallback(String value) {
        int hash = value.indexOf('#');
        return stripTrailingSlashes(hash >= 0 ? value.substring(0, hash) : value);
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
