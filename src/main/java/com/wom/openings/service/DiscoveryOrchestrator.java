package com.wom.openings.service;

import com.wom.openings.exception.EndpointResolutionException;
import com.wom.openings.model.CanonicalRecord;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;
import com.wom.openings.normalize.CanonicalRecordNormalizer;
import com.wom.openings.source.GeoTagAdapter;
import com.wom.openings.source.PlaceSearchAdapter;
import com.wom.openings.source.ReverseGeocodeAdapter;
import com.wom.openings.source.SourceAdapter;
import com.wom.openings.source.registry.RegistryAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Runs the sources one after another (geo-tag, place search, registry), normalizes each payload,
 * backfills missing geo-tag addresses and merges everything through one deduplication context.
 *
 * <p>Only the geo-tag source is mandatory; its failure propagates. Every other failure becomes a warning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryOrchestrator {

    private final GeoTagAdapter geoTag;
    private final PlaceSearchAdapter placeSearch;
    private final RegistryAdapter registry;
    private final ReverseGeocodeAdapter reverseGeocoder;
    private final CanonicalRecordNormalizer normalizer;
    private final Deduplicator deduplicator;

    public DiscoveryResult discover(QueryContext ctx) {
        DeduplicationContext merge = new DeduplicationContext();
        Map<SourceLabel, Integer> kept = new EnumMap<>(SourceLabel.class);
        List<String> warnings = new ArrayList<>();

        // 1) geo-tag: mandatory, SourceUnavailableException aborts the run
        for (RawPayload payload : geoTag.fetch(ctx)) {
            normalizer.normalize(payload, ctx)
                    .map(r -> backfillAddress(r, payload, ctx))
                    .ifPresent(r -> accept(merge, r, kept));
        }

        // 2) place search
        if (ctx.placeSearch()) {
            runOptional(placeSearch, ctx, merge, kept, warnings);
        }

        // 3) registry
        if (ctx.registry()) {
            try {
                runOptional(registry, ctx, merge, kept, warnings);
            } catch (EndpointResolutionException e) {
                log.warn("[Openings] registry skipped: {}", e.getMessage());
                warnings.add(SourceLabel.REGISTRY.displayName() + " skipped: " + e.getMessage());
            }
        }

        log.info("[Openings] city={} cutoff={} kept={} bySource={} warnings={}",
                ctx.city(), ctx.cutoff(), merge.survivors().size(), kept, warnings.size());
        return new DiscoveryResult(ctx, List.copyOf(merge.survivors()), Collections.unmodifiableMap(kept), List.copyOf(warnings));
    }

    private void runOptional(SourceAdapter adapter, QueryContext ctx, DeduplicationContext merge,
                             Map<SourceLabel, Integer> kept, List<String> warnings) {
        Optional<String> problem = adapter.misconfiguration();
        if (problem.isPresent()) {
            log.warn("[Openings] {}", problem.get());
            warnings.add(problem.get());
            return;
        }
        List<RawPayload> payloads;
        try {
            payloads = adapter.fetch(ctx);
        } catch (EndpointResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Openings] source={} failed: {}", adapter.source(), e.getMessage());
            warnings.add(adapter.source().displayName() + " failed: " + e.getMessage());
            return;
        }
        for (RawPayload payload : payloads) {
            normalizer.normalize(payload, ctx).ifPresent(r -> accept(merge, r, kept));
        }
    }

    private CanonicalRecord backfillAddress(CanonicalRecord record, RawPayload payload, QueryContext ctx) {
        if (!ctx.reverseGeocode() || !record.address().isBlank()) return record;
        return CanonicalRecordNormalizer.coordinatesOf(payload)
                .flatMap(reverseGeocoder::lookup)
                .map(record::withAddress)
                .orElse(record);
    }

    private void accept(DeduplicationContext merge, CanonicalRecord record, Map<SourceLabel, Integer> kept) {
        if (deduplicator.offer(merge, record)) {
            kept.merge(record.source(), 1, Integer::sum);
        }
    }
}
