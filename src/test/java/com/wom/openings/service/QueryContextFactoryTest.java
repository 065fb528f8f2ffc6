package com.wom.openings.service;

import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.dto.DiscoveryRequest;
import com.wom.openings.exception.InvalidRequestException;
import com.wom.openings.model.QueryContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryContextFactoryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-08-31T10:00:00Z"), ZoneOffset.UTC);
    private final QueryContextFactory factory = new QueryContextFactory(new OpeningsProperties(), clock);

    private static DiscoveryRequest empty() {
        return new DiscoveryRequest(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("an empty request runs with the configured defaults")
    void defaults() {
        QueryContext ctx = factory.create(empty());

        assertThat(ctx.city()).isEqualTo("Helsinki");
        assertThat(ctx.today()).isEqualTo(LocalDate.of(2025, 8, 31));
        assertThat(ctx.amenities()).containsExactly("restaurant", "cafe", "fast_food");
        assertThat(ctx.registeredOffice()).isEqualTo("Helsinki");
        assertThat(ctx.pageSize()).isEqualTo(100);
        assertThat(ctx.maxResults()).isEqualTo(1000);
        assertThat(ctx.placeSearch()).isFalse();
        assertThat(ctx.registry()).isFalse();
        assertThat(ctx.strictRestaurants()).isFalse();
    }

    @Test
    @DisplayName("cutoff clamps the day to the end of the target month")
    void cutoffClamps() {
        QueryContext ctx = factory.create(new DiscoveryRequest(null, 6, null, null, null, null, null, null,
                null, null, null, null));

        assertThat(ctx.cutoff()).isEqualTo(LocalDate.of(2025, 2, 28));
    }

    @Test
    void strictRestaurantsNarrowsAmenities() {
        QueryContext ctx = factory.create(new DiscoveryRequest("Espoo", 3, List.of("cafe", "bar"), true,
                true, null, true, true, "Espoo", List.of("56101", " ", "56101"), 50, 200));

        assertThat(ctx.city()).isEqualTo("Espoo");
        assertThat(ctx.amenities()).containsExactly("restaurant");
        assertThat(ctx.businessLineCodes()).containsExactly("56101");
        assertThat(ctx.useNewerProxy()).isTrue();
        assertThat(ctx.placeSearch()).isTrue();
        assertThat(ctx.pageSize()).isEqualTo(50);
        assertThat(ctx.maxResults()).isEqualTo(200);
    }

    @Test
    @DisplayName("a request that cannot name a city is rejected as invalid")
    void noCityAnywhere() {
        OpeningsProperties props = new OpeningsProperties();
        props.getDefaults().setCity(" ");
        QueryContextFactory blankDefault = new QueryContextFactory(props, clock);

        assertThatThrownBy(() -> blankDefault.create(empty()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("city is required")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
