package com.releasefeed.core.util;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    // quoted or bare href values on anchor tags
    private static final Pattern ANCHOR_HREF = Pattern.compile(
            "<a\\b[^>]*?\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>]+))",
            Pattern.CASE_INSENSITIVE
    );
    private static final List<String> SKIPPED_PREFIXES = List.of("mailto:", "javascript:", "tel:", "#");

    private HtmlUtils() {
    }

    /**
     * Anchor targets in document order without duplicates. Common character entities are decoded;
     * {@code mailto:}, {@code javascript:}, {@code tel:} and fragment-only targets are left out.
     */
    public static List<String> extractLinks(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Set<String> links = new LinkedHashSet<>();
        Matcher matcher = ANCHOR_HREF.matcher(html);
        while (matcher.find()) {
            String raw = firstNonNull(matcher.group(1), matcher.group(2), matcher.group(3));
            String href = decodeEntities(raw.trim());
            if (!href.isEmpty() && !skipped(href)) {
                links.add(href);
            }
        }
        return List.copyOf(links);
    }

    static String decodeEntities(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        return value
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&#x2F;", "/")
                .replace("&#38;", "&")
                .replace("&amp;", "&");
    }

    private static boolean skipped(String href) {
        String lowered = href.toLowerCase(Locale.ROOT);
        return SKIPPED_PREFIXES.stream().anyMatch(lowered::startsWith);
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return "";
    }
}
