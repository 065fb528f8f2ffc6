package com.wom.openings.util;

import java.util.*;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextUtils() {}

    /** Collapses every Unicode whitespace run (no-break space included) to one space, then trims. Null becomes empty. */
    public static String normalizeWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /** Lowercased, whitespace-normalized {@code name|address}; empty when both parts are blank. */
    public static String dedupKey(String name, String address) {
        if (isBlank(name) && isBlank(address)) return "";
        return normalizeWhitespace(safe(name) + "|" + safe(address)).toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) {
        return s == null || normalizeWhitespace(s).isEmpty();
    }

    public static String safe(String s) {
        return s == null ? "" : s;
    }

    /** Joins the non-blank fragments with {@code ", "}. */
    public static String joinFragments(String... fragments) {
        StringJoiner joiner = new StringJoiner(", ");
        for (String f : fragments) {
            if (!isBlank(f)) joiner.add(f.strip());
        }
        return joiner.toString();
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (isBlank(haystack) || isBlank(needle)) return false;
        return haystack.toLowerCase(Locale.ROOT).contains(needle.strip().toLowerCase(Locale.ROOT));
    }
}
