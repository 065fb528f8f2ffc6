package com.wom.openings.normalize;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Parses the loose date values found in opening_date, start_date and registration fields.
 *
 * <p>Patterns are tried from most to least specific: full date, year-month, year; each with
 * {@code -}, {@code /} and {@code .} separators. The first pattern that consumes the whole value wins.
 * A time part after {@code T} or a space is dropped first. If nothing matches and the value holds a
 * {@code /} range such as {@code 2025-06-01/2025-06-30}, only the start is parsed.
 */
@Component
public class OpeningDateParser {

    public static final List<DatePattern> DEFAULT_PATTERNS = List.of(
            DatePattern.of("uuuu-M-d"),
            DatePattern.of("uuuu/M/d"),
            DatePattern.of("uuuu.M.d"),
            DatePattern.of("uuuu-M"),
            DatePattern.of("uuuu/M"),
            DatePattern.of("uuuu.M"),
            DatePattern.of("uuuu")
    );

    private final List<DatePattern> patterns;

    public OpeningDateParser() {
        this(DEFAULT_PATTERNS);
    }

    public OpeningDateParser(List<DatePattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public Optional<LocalDate> parse(String raw) {
        if (raw == null) return Optional.empty();
        String value = stripTime(raw.strip());
        if (value.isEmpty()) return Optional.empty();

        Optional<LocalDate> whole = firstMatch(value);
        if (whole.isPresent()) return whole;

        int slash = value.indexOf('/');
        if (slash > 0) {
            return firstMatch(value.substring(0, slash).strip());
        }
        return Optional.empty();
    }

    public List<DatePattern> patterns() {
        return patterns;
    }

    private Optional<LocalDate> firstMatch(String value) {
        for (DatePattern p : patterns) {
            Optional<LocalDate> parsed = p.tryParse(value);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    private static String stripTime(String value) {
        String v = value.replace('T', ' ');
        int space = v.indexOf(' ');
        return space >= 0 ? v.substring(0, space) : v;
    }
}
