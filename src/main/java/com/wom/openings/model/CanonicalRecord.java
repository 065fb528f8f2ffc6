package com.wom.openings.model;

import com.wom.openings.util.TextUtils;
import lombok.Builder;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared post-normalization schema. Every source is mapped into this before merge.
 *
 * @param name         venue name, may be empty
 * @param address      free-text address, may be empty
 * @param description  one-line description, may be empty
 * @param tags         bare category tokens or {@code key:value} tokens, kept sorted and unique
 * @param openingDate  best available proxy for when the venue started operating, or null
 * @param source       adapter that produced the record
 * @param confidence   coarse trust tier fixed at normalization time
 * @param lastModified last-edit timestamp reported by the registry, or null
 */
@Builder(toBuilder = true)
public record CanonicalRecord(
        String name,
        String address,
        String description,
        Set<String> tags,
        LocalDate openingDate,
        SourceLabel source,
        Confidence confidence,
        String lastModified
) {
    public CanonicalRecord {
        name = name == null ? "" : name;
        address = address == null ? "" : address;
        description = description == null ? "" : description;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(tags));
    }

    /** Identity used for merging: lowercase, whitespace-collapsed {@code name|address}. */
    public String dedupKey() {
        return TextUtils.dedupKey(name, address);
    }

    public CanonicalRecord withAddress(String newAddress) {
        return toBuilder().address(newAddress).build();
    }
}
