package com.wom.openings.model;

/**
 * Identifies the adapter a record came from. {@link #displayName()} is what the output rows carry.
 */
public enum SourceLabel {
    GEO_TAG("OpenStreetMap"),
    REVERSE_GEOCODE("Nominatim"),
    PLACE_SEARCH("Google Places (Text Search)"),
    REGISTRY("PRH Trade Register");

    private final String displayName;

    SourceLabel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
