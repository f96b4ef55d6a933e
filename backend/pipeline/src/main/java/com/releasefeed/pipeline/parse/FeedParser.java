package com.releasefeed.pipeline.parse;

import com.releasefeed.core.events.AlertRaised;
import com.releasefeed.core.events.FeedParsed;
import com.releasefeed.core.model.FailureKind;
import com.releasefeed.core.model.FeedFailure;
import com.releasefeed.core.model.FeedItem;
import com.releasefeed.core.model.ValidatedFeed;
import com.releasefeed.pipeline.api.PipelineContext;
import com.releasefeed.pipeline.http.FetchResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Fetches one validated feed and converts its entries into {@link FeedItem}s. All failures stay inside
 * the returned {@link ParsedFeed}; nothing is thrown to the caller.
 */
public class FeedParser {
    private static final Logger LOGGER = Logger.getLogger(FeedParser.class.getName());

    private final PipelineContext ctx;

    public FeedParser(PipelineContext ctx) {
        this.ctx = ctx;
    }

    public ParsedFeed parse(ValidatedFeed feed) {
        String url = feed.url();
        FetchResponse response = ctx.fetchClient().get(url);
        if (response.isTransportFailure()) {
            return fail(url, FailureKind.TRANSIENT_NETWORK, response.failure().message());
        }
        if (!response.isSuccess()) {
            return fail(url, FailureKind.NOT_FOUND_OR_INVALID, "HTTP status " + response.statusCode() + " from " + url);
        }
        return parseBody(url, response.body());
    }

    public ParsedFeed parseBody(String url, byte[] body) {
        return interpret(url, FeedDocumentParser.parse(body));
    }

    public ParsedFeed parseBody(String url, String body) {
        return interpret(url, FeedDocumentParser.parse(body));
    }

    private ParsedFeed interpret(String url, ParseResult result) {
        if (result instanceof ParseResult.Malformed malformed) {
            return fail(url, FailureKind.MALFORMED_FEED_BODY, "Invalid feed XML from " + url + ": " + malformed.reason());
        }
        if (result instanceof ParseResult.Unrecognized unrecognized) {
            return fail(url, FailureKind.UNRECOGNIZED_FEED_STRUCTURE,
                    "Unrecognized feed structure <" + unrecognized.rootElement() + "> from " + url);
        }

        FeedFormat format = result instanceof ParseResult.AtomEntries ? FeedFormat.ATOM : FeedFormat.RSS;
        List<FeedItem> items = new ArrayList<>();
        List<FeedFailure> dropped = new ArrayList<>();
        for (RawEntry entry : result.entries()) {
            if (entry.link() == null || entry.link().isBlank()) {
                dropped.add(new FeedFailure(url, FailureKind.MISSING_LINK, "Entry without link: " + entry.title()));
                continue;
            }
            Optional<Instant> publishedAt = DateNormalizer.normalize(entry.date());
            if (publishedAt.isEmpty()) {
                LOGGER.warning("Dropping entry with unparsable date '" + entry.date() + "' from " + url + ": " + entry.link());
                dropped.add(new FeedFailure(url, FailureKind.UNPARSABLE_DATE,
                        "Unparsable date '" + entry.date() + "' for " + entry.link()));
                continue;
            }
            items.add(new FeedItem(
                    entry.title(),
                    entry.link().trim(),
                    publishedAt.get(),
                    entry.description(),
                    entry.category(),
                    url
            ));
        }

        ctx.eventBus().publish(new FeedParsed(ctx.clock().instant(), url, format.name(), items.size(), dropped.size()));
        return new ParsedFeed(url, format, true, items, dropped.size(), dropped);
    }

    private ParsedFeed fail(String url, FailureKind kind, String message) {
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "parsing",
                message,
                Map.of("url", url, "kind", kind.name())
        ));
        return ParsedFeed.failed(url, new FeedFailure(url, kind, message));
    }
}
