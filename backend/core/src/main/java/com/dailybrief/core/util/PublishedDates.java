package com.dailybrief.core.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient parsing of source-supplied publish dates. Naive values (no offset)
 * are read as UTC. Dates outside years 1 to 9999 are treated as unparseable.
 */
public final class PublishedDates {
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private PublishedDates() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, trimmed))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst()
                .filter(PublishedDates::inSupportedRange);
    }

    private static boolean inSupportedRange(Instant instant) {
        int year = instant.atOffset(ZoneOffset.UTC).getYear();
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
