package com.wom.openings.model;

import java.util.Locale;

public enum Confidence {
    HIGH, MEDIUM, LOW;

    /** Lowercase form used in tags, e.g. {@code confidence:high}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
