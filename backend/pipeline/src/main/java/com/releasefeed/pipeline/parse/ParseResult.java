package com.releasefeed.pipeline.parse;

import java.util.List;

public sealed interface ParseResult
        permits ParseResult.RssItems, ParseResult.AtomEntries, ParseResult.Unrecognized, ParseResult.Malformed {

    default List<RawEntry> entries() {
        return List.of();
    }

    record RssItems(List<RawEntry> entries) implements ParseResult {
        public RssItems {
            entries = List.copyOf(entries);
        }
    }

    record AtomEntries(List<RawEntry> entries) implements ParseResult {
        public AtomEntries {
            entries = List.copyOf(entries);
        }
    }

    /** Well-formed XML whose root is neither an RSS nor an Atom document. */
    record Unrecognized(String rootElement) implements ParseResult {
    }

    /** The body is not well-formed XML. */
    record Malformed(String reason) implements ParseResult {
    }
}
