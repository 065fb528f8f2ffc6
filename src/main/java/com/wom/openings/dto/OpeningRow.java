package com.wom.openings.dto;

import com.wom.openings.model.CanonicalRecord;

import java.util.TreeSet;

public record OpeningRow(
        String name,
        String fullAddress,
        String description,
        String tags,          // sorted, ';'-joined, includes confidence:<tier>
        String openingDate,   // ISO date or ""
        String source,
        String confidence,    // high | medium | low
        String lastModified   // registry only, "" elsewhere
) {
    public static OpeningRow from(CanonicalRecord r) {
        TreeSet<String> tags = new TreeSet<>(r.tags());
        tags.add("confidence:" + r.confidence().label());
        return new OpeningRow(
                r.name(),
                r.address(),
                r.description(),
                String.join(";", tags),
                r.openingDate() == null ? "" : r.openingDate().toString(),
                r.source().displayName(),
                r.confidence().label(),
                r.lastModified() == null ? "" : r.lastModified()
        );
    }
}
