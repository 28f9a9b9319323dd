package com.bank.reconciliation.service;

import com.bank.reconciliation.config.DateFormatConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses heterogeneous date text into a calendar date.
 *
 * Patterns are tried in configured order, then ISO-8601 date-times with an offset or zone,
 * then plain ISO local date-times. Unparseable text yields an empty result, never an exception.
 */
@Component
public class DateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DateNormalizer.class);

    private final List<DateTimeFormatter> formatters;

    public DateNormalizer(DateFormatConfig config) {
        List<DateTimeFormatter> compiled = new ArrayList<>();
        for (String pattern : config.getPatterns()) {
            try {
                compiled.add(new DateTimeFormatterBuilder()
                        .parseCaseInsensitive()
                        .appendPattern(pattern)
                        .toFormatter(Locale.ENGLISH)
                        .withResolverStyle(ResolverStyle.STRICT));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid date pattern '{}': {}", pattern, e.getMessage());
            }
        }
        this.formatters = Collections.unmodifiableList(compiled);
    }

    public Optional<LocalDate> normalize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();

        for (DateTimeFormatter formatter : formatters) {
            Optional<LocalDate> parsed = tryParse(trimmed, value -> LocalDate.parse(value, formatter));
            if (parsed.isPresent()) {
                return parsed;
            }
        }

        Optional<LocalDate> parsed = tryParse(trimmed, value -> OffsetDateTime.parse(value).toLocalDate())
                .or(() -> tryParse(trimmed, value -> ZonedDateTime.parse(value).toLocalDate()))
                .or(() -> tryParse(trimmed, value -> LocalDateTime.parse(value).toLocalDate()));
        if (parsed.isEmpty()) {
            log.debug("Unparseable date text '{}'", trimmed);
        }
        return parsed;
    }

    public boolean isParseable(String text) {
        return normalize(text).isPresent();
    }

    private static Optional<LocalDate> tryParse(String text, Function<String, LocalDate> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
