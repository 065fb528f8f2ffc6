package com.wom.openings.service;

import com.wom.openings.model.CanonicalRecord;
import com.wom.openings.model.Confidence;
import com.wom.openings.model.SourceLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeduplicatorTest {

    private final Deduplicator deduplicator = new Deduplicator();

    private static CanonicalRecord record(String name, String address, SourceLabel source, Confidence confidence) {
        return CanonicalRecord.builder()
                .name(name)
                .address(address)
                .tags(Set.of())
                .source(source)
                .confidence(confidence)
                .build();
    }

    @Test
    @DisplayName("first record with a key wins, whatever the source or confidence of later ones")
    void firstSeenWins() {
        DeduplicationContext ctx = new DeduplicationContext();
        CanonicalRecord place = record("Cafe X", "Mannerheimintie 1", SourceLabel.PLACE_SEARCH, Confidence.LOW);
        CanonicalRecord osm = record("  CAFE   x", "mannerheimintie 1", SourceLabel.GEO_TAG, Confidence.HIGH)
                .toBuilder().openingDate(LocalDate.of(2025, 3, 1)).build();

        assertThat(deduplicator.offer(ctx, place)).isTrue();
        assertThat(deduplicator.offer(ctx, osm)).isFalse();

        assertThat(ctx.survivors()).containsExactly(place);
    }

    @Test
    @DisplayName("whitespace next to the separator is part of the key")
    void spaceBeforeSeparatorIsSignificant() {
        DeduplicationContext ctx = new DeduplicationContext();

        assertThat(deduplicator.offer(ctx, record("Cafe X", "Kamppi", SourceLabel.GEO_TAG, Confidence.HIGH))).isTrue();
        assertThat(deduplicator.offer(ctx, record("Cafe X ", "Kamppi", SourceLabel.PLACE_SEARCH, Confidence.LOW))).isTrue();
    }

    @Test
    @DisplayName("no-break spaces merge like ordinary spaces")
    void noBreakSpaceMerges() {
        DeduplicationContext ctx = new DeduplicationContext();

        assertThat(deduplicator.offer(ctx,
                record("Cafe X", "Mannerheimintie 1", SourceLabel.GEO_TAG, Confidence.HIGH))).isTrue();
        assertThat(deduplicator.offer(ctx,
                record("Cafe\u00A0X", "Mannerheimintie\u00A01", SourceLabel.PLACE_SEARCH, Confidence.LOW))).isFalse();
    }

    @Test
    @DisplayName("records without name and address are never merged")
    void emptyKeyAlwaysKept() {
        DeduplicationContext ctx = new DeduplicationContext();
        CanonicalRecord a = record("", " ", SourceLabel.GEO_TAG, Confidence.MEDIUM);
        CanonicalRecord b = record(null, null, SourceLabel.GEO_TAG, Confidence.MEDIUM);

        assertThat(deduplicator.fold(ctx, List.of(a, b, a))).hasSize(3);
        assertThat(ctx.hasSeen("")).isFalse();
    }

    @Test
    @DisplayName("same name at different addresses are different venues")
    void addressIsPartOfIdentity() {
        DeduplicationContext ctx = new DeduplicationContext();
        List<CanonicalRecord> kept = deduplicator.fold(ctx, List.of(
                record("Hesburger", "Kamppi", SourceLabel.GEO_TAG, Confidence.HIGH),
                record("Hesburger", "Itäkeskus", SourceLabel.GEO_TAG, Confidence.HIGH)));

        assertThat(kept).hasSize(2);
    }

    @Test
    @DisplayName("folding the same batch twice adds nothing the second time")
    void idempotent() {
        DeduplicationContext ctx = new DeduplicationContext();
        List<CanonicalRecord> batch = List.of(
                record("A", "1", SourceLabel.GEO_TAG, Confidence.HIGH),
                record("B", "2", SourceLabel.REGISTRY, Confidence.MEDIUM),
                record("a", "1", SourceLabel.PLACE_SEARCH, Confidence.LOW));

        assertThat(deduplicator.fold(ctx, batch)).hasSize(2);
        assertThat(deduplicator.fold(ctx, batch)).isEmpty();
        assertThat(ctx.survivors()).extracting(CanonicalRecord::name).containsExactly("A", "B");
    }

    @Test
    void preSeededKeysAreTreatedAsSeen() {
        DeduplicationContext ctx = new DeduplicationContext(List.of("cafe x|mannerheimintie 1"));

        assertThat(deduplicator.offer(ctx,
                record("Cafe X", "Mannerheimintie 1", SourceLabel.GEO_TAG, Confidence.HIGH))).isFalse();
        assertThat(ctx.survivors()).isEmpty();
    }
}
