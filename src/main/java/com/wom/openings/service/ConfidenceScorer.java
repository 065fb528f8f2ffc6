package com.wom.openings.service;

import com.wom.openings.model.Confidence;
import com.wom.openings.model.SourceLabel;
import org.springframework.stereotype.Service;

/**
 * Fixed confidence tier per source and evidence. Assigned once at normalization, never revised by the merge.
 */
@Service
public class ConfidenceScorer {

    public Confidence seed(SourceLabel source, boolean explicitOpeningDate) {
        return switch (source) {
            case GEO_TAG -> explicitOpeningDate ? Confidence.HIGH : Confidence.MEDIUM;
            case REGISTRY -> Confidence.MEDIUM;
            case PLACE_SEARCH -> Confidence.LOW;
            // reverse geocoding only backfills addresses on geo-tag records
            case REVERSE_GEOCODE -> throw new IllegalArgumentException("reverse geocoding produces no records");
        };
    }
}
