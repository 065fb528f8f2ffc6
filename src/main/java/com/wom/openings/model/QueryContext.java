package com.wom.openings.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Parameters of one discovery run. Built once by the orchestrator's caller and read-only afterwards.
 */
public record QueryContext(
        String city,
        LocalDate today,
        LocalDate cutoff,
        List<String> amenities,
        String registeredOffice,
        List<String> businessLineCodes,
        int pageSize,
        int maxResults,
        boolean strictRestaurants,
        boolean useNewerProxy,
        boolean reverseGeocode,
        boolean placeSearch,
        boolean registry
) {
    public QueryContext {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("city is required");
        }
        city = city.trim();
        List<String> cleaned = amenities == null ? List.of() : amenities.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (strictRestaurants || cleaned.isEmpty()) {
            cleaned = List.of("restaurant");
        }
        amenities = cleaned;
        registeredOffice = registeredOffice == null || registeredOffice.isBlank() ? city : registeredOffice.trim();
        businessLineCodes = businessLineCodes == null ? List.of() : businessLineCodes.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        if (pageSize <= 0) pageSize = 100;
        if (maxResults <= 0) maxResults = 1000;
    }

    /** Lookback cutoff: {@code today} minus {@code months}, day clamped to the end of the target month. */
    public static LocalDate cutoff(LocalDate today, int months) {
        return today.minusMonths(Math.max(0, months));
    }
}
