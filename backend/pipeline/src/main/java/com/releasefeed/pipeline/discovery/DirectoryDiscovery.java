package com.releasefeed.pipeline.discovery;

import com.releasefeed.core.model.CandidateUrl;
import com.releasefeed.core.model.ProductSpec;
import com.releasefeed.core.util.HtmlUtils;
import com.releasefeed.pipeline.http.FetchClient;
import com.releasefeed.pipeline.http.FetchResponse;
import com.releasefeed.pipeline.urls.FeedUrlGenerator;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Alternative front-end to {@link YearDiscovery}: reads the portal's RSS directory page and lists the
 * feed links it advertises. Candidates found here go through the same validation and parsing stages.
 */
public class DirectoryDiscovery {
    public static final String DIRECTORY_PATH = "/rss";

    private static final Logger LOGGER = Logger.getLogger(DirectoryDiscovery.class.getName());
    private static final Pattern FEED_PATH = Pattern.compile(
            "^/rss-feed/([^/]+)/release-upgrade-summary-(\\d{4})/([^/?#]+)/?$"
    );

    private final FetchClient fetchClient;
    private final FeedUrlGenerator urlGenerator;
    private final Clock clock;

    public DirectoryDiscovery(FetchClient fetchClient, FeedUrlGenerator urlGenerator, Clock clock) {
        this.fetchClient = fetchClient;
        this.urlGenerator = urlGenerator;
        this.clock = clock;
    }

    /**
     * Empty when the directory page could not be fetched; the caller then falls back to year probing.
     */
    public Optional<DiscoveryResult> discover(List<ProductSpec> products, int lookbackYears) {
        String directoryUrl = urlGenerator.baseUrl() + DIRECTORY_PATH;
        FetchResponse response = fetchClient.get(directoryUrl);
        if (!response.isSuccess() || response.body() == null) {
            LOGGER.warning("RSS directory page unavailable (" + response.describe() + "): " + directoryUrl);
            return Optional.empty();
        }

        int currentYear = LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear();
        List<Integer> window = YearDiscovery.yearRange(currentYear, lookbackYears);
        Map<String, ProductSpec> bySlug = products.stream()
                .collect(Collectors.toMap(ProductSpec::slug, Function.identity(), (first, second) -> first));

        Map<String, CandidateUrl> candidates = new LinkedHashMap<>();
        for (String link : HtmlUtils.extractLinks(response.bodyText())) {
            parseFeedLink(link, bySlug)
                    .filter(candidate -> window.contains(candidate.year()))
                    .ifPresent(candidate -> candidates.putIfAbsent(candidate.url(), candidate));
        }

        TreeSet<Integer> years = candidates.values().stream()
                .map(CandidateUrl::year)
                .collect(Collectors.toCollection(() -> new TreeSet<Integer>(Comparator.reverseOrder())));
        LOGGER.info("RSS directory listed " + candidates.size() + " feeds across years " + years);

        return Optional.of(new DiscoveryResult(
                window,
                new ArrayList<>(years),
                0,
                0,
                0,
                new ArrayList<>(candidates.values()),
                List.of()
        ));
    }

    Optional<CandidateUrl> parseFeedLink(String link, Map<String, ProductSpec> bySlug) {
        String path;
        try {
            URI uri = URI.create(link);
            if (uri.getHost() != null && !uri.getHost().equalsIgnoreCase(URI.create(urlGenerator.baseUrl()).getHost())) {
                return Optional.empty();
            }
            path = uri.getRawPath();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = FEED_PATH.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String slug = matcher.group(1);
        int year = Integer.parseInt(matcher.group(2));
        String domain = matcher.group(3);
        ProductSpec configured = bySlug.get(slug);
        ProductSpec product = configured != null && configured.domain().equals(domain)
                ? configured
                : new ProductSpec(slug, domain);
        return Optional.of(urlGenerator.candidateFor(product, year));
    }
}
