package com.releasefeed.pipeline.parse;

/**
 * Field values exactly as read from one feed entry, before date normalization. Absent fields are null.
 */
public record RawEntry(
        String title,
        String link,
        String date,
        String description,
        String category
) {
}
