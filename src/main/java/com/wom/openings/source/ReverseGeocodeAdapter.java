package com.wom.openings.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wom.openings.config.HttpTimeouts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.model.GeoPoint;
import com.wom.openings.model.SourceLabel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Nominatim reverse lookup used to backfill addresses of geo-tag venues. Best-effort: never throws.
 */
@Slf4j
@Component
public class ReverseGeocodeAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String userAgent;
    private final CourtesyThrottle throttle;
    private final Cache<String, String> addressCache;

    @Autowired
    public ReverseGeocodeAdapter(RestClient.Builder builder,
                                 OpeningsProperties props,
                                 @Value("${openings.reverse-geocode.user-agent:${NOMINATIM_USER_AGENT:wom-new-openings}}") String userAgent) {
        this(HttpTimeouts.withTimeouts(builder, props.getHttp().getConnectTimeout(),
                        props.getReverseGeocode().getReadTimeout()).build(),
                props, userAgent, new CourtesyThrottle(props.getReverseGeocode().getMinInterval()));
    }

    ReverseGeocodeAdapter(RestClient rest, OpeningsProperties props, String userAgent, CourtesyThrottle throttle) {
        this.rest = rest;
        this.endpoint = props.getReverseGeocode().getEndpoint();
        this.userAgent = userAgent;
        this.throttle = throttle;
        this.addressCache = Caffeine.newBuilder()
                .maximumSize(props.getReverseGeocode().getCacheSize())
                .build();
    }

    public SourceLabel source() { return SourceLabel.REVERSE_GEOCODE; }

    public Optional<String> lookup(GeoPoint point) {
        String key = String.format(Locale.ROOT, "%.6f,%.6f", point.lat(), point.lon());
        String cached = addressCache.getIfPresent(key);
        if (cached != null) return Optional.of(cached);

        URI uri = UriComponentsBuilder.fromUriString(endpoint)
                .queryParam("lat", point.lat())
                .queryParam("lon", point.lon())
                .queryParam("format", "jsonv2")
                .build()
                .toUri();
        try {
            JsonNode res = throttle.call(() -> rest.get()
                    .uri(uri)
                    .header(HttpHeaders.USER_AGENT, userAgent)
                    .retrieve()
                    .body(JsonNode.class));
            String address = res == null ? "" : res.path("display_name").asText("").strip();
            if (address.isEmpty()) return Optional.empty();
            addressCache.put(key, address);
            return Optional.of(address);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[Openings] reverse geocode failed at {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
