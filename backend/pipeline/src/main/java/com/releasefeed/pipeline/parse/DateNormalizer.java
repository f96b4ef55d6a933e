package com.releasefeed.pipeline.parse;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns the date strings found in feeds into UTC instants. Strategies are tried in order and the first
 * match wins; values without an offset are taken as UTC and date-only values as the start of that day.
 */
public final class DateNormalizer {
    private static final DateTimeFormatter ISO_BASIC_OFFSET = formatter("uuuu-MM-dd'T'HH:mm:ss[.SSS]Z");
    private static final DateTimeFormatter RFC_2822_NUMERIC_OFFSET = formatter("d MMM uuuu HH:mm[:ss] Z");
    private static final DateTimeFormatter RFC_2822_ZONE_NAME = formatter("d MMM uuuu HH:mm[:ss] z");
    private static final DateTimeFormatter SPACE_SEPARATED_DATE_TIME = formatter("uuuu-MM-dd HH:mm[:ss]");
    private static final DateTimeFormatter SLASH_DATE = formatter("uuuu/MM/dd");
    private static final DateTimeFormatter LONG_MONTH_FIRST = formatter("MMMM d, uuuu");
    private static final DateTimeFormatter SHORT_MONTH_FIRST = formatter("MMM d, uuuu");
    private static final DateTimeFormatter LONG_DAY_FIRST = formatter("d MMMM uuuu");
    private static final DateTimeFormatter SHORT_DAY_FIRST = formatter("d MMM uuuu");

    // RFC 1123 parsing in java.time is lenient about the year width
    private static final Pattern RFC_DAY_MONTH_YEAR = Pattern.compile("^(?:[A-Za-z]{2,9},\\s*)?\\d{1,2} [A-Za-z]{3,9} \\d{4} ");

    private static final List<Strategy> STRATEGIES = List.of(
            new Strategy("iso-instant", Instant::parse),
            new Strategy("iso-offset-date-time", v -> OffsetDateTime.parse(v).toInstant()),
            new Strategy("iso-basic-offset", v -> OffsetDateTime.parse(v, ISO_BASIC_OFFSET).toInstant()),
            new Strategy("iso-local-date-time", v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC)),
            new Strategy("rfc-1123", v -> ZonedDateTime.parse(fourDigitYear(v), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()),
            new Strategy("rfc-2822-offset", v -> OffsetDateTime.parse(stripWeekday(fourDigitYear(v)), RFC_2822_NUMERIC_OFFSET).toInstant()),
            new Strategy("rfc-2822-zone-name", v -> ZonedDateTime.parse(stripWeekday(fourDigitYear(v)), RFC_2822_ZONE_NAME).toInstant()),
            new Strategy("space-separated-date-time", v -> LocalDateTime.parse(v, SPACE_SEPARATED_DATE_TIME).toInstant(ZoneOffset.UTC)),
            new Strategy("iso-date", v -> startOfDay(LocalDate.parse(v))),
            new Strategy("slash-date", v -> startOfDay(LocalDate.parse(v, SLASH_DATE))),
            new Strategy("long-month-first", v -> startOfDay(LocalDate.parse(v, LONG_MONTH_FIRST))),
            new Strategy("short-month-first", v -> startOfDay(LocalDate.parse(v, SHORT_MONTH_FIRST))),
            new Strategy("long-day-first", v -> startOfDay(LocalDate.parse(v, LONG_DAY_FIRST))),
            new Strategy("short-day-first", v -> startOfDay(LocalDate.parse(v, SHORT_DAY_FIRST)))
    );

    private DateNormalizer() {
    }

    public static Optional<Instant> normalize(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String cleaned = value.trim().replaceAll("\\s+", " ");
        for (Strategy strategy : STRATEGIES) {
            Optional<Instant> parsed = strategy.tryParse(cleaned);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    static List<String> strategyNames() {
        return STRATEGIES.stream().map(Strategy::name).toList();
    }

    private static String fourDigitYear(String value) {
        if (!RFC_DAY_MONTH_YEAR.matcher(value).find()) {
            throw new DateTimeException("Year must have four digits: " + value);
        }
        return value;
    }

    private static String stripWeekday(String value) {
        return value.replaceFirst("^[A-Za-z]{2,9},\\s*", "");
    }

    private static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    private record Strategy(String name, Function<String, Instant> parser) {
        Optional<Instant> tryParse(String value) {
            try {
                return Optional.of(parser.apply(value));
            } catch (DateTimeException ex) {
                return Optional.empty();
            }
        }
    }
}
