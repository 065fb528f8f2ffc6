package com.wom.openings.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;

/**
 * One calendar-date shape. Missing month or day resolve to the first of the period.
 */
public record DatePattern(String pattern, DateTimeFormatter formatter) {

    public static DatePattern of(String pattern) {
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .appendPattern(pattern)
                .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
        return new DatePattern(pattern, formatter);
    }

    public Optional<LocalDate> tryParse(String value) {
        try {
            return Optional.of(LocalDate.parse(value, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
