package com.wom.openings.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Every field is optional; gaps are filled from {@code openings.defaults}.
 */
public record DiscoveryRequest(
        String city,                       // "Helsinki"
        @Min(0) @Max(120) Integer months,  // lookback window
        List<String> amenities,            // OSM amenity values, e.g. restaurant, cafe, fast_food
        Boolean strictRestaurants,         // restaurants only, across all sources
        Boolean useNewerProxy,             // include recently edited OSM venues without an opening date
        Boolean reverseGeocode,            // backfill missing OSM addresses via Nominatim
        Boolean placeSearch,
        Boolean registry,
        String registeredOffice,           // registry municipality, defaults to city
        List<String> businessLineCodes,    // TOL 2008 codes, e.g. 56101
        @Min(1) @Max(1000) Integer pageSize,
        @Min(1) @Max(100000) Integer maxResults
) {}
