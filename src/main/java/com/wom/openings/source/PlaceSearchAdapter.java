package com.wom.openings.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.wom.openings.config.HttpTimeouts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.model.GeoPoint;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;
import com.wom.openings.util.GeoMath;
import com.wom.openings.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.*;

/**
 * Google Places Text Search (New). Cannot tell how old a venue is, so every candidate is low confidence.
 */
@Slf4j
@Component
public class PlaceSearchAdapter implements SourceAdapter {

    private final RestClient rest;
    private final OpeningsProperties.Places config;
    private final String apiKey;

    @Autowired
    public PlaceSearchAdapter(RestClient.Builder builder,
                              OpeningsProperties props,
                              @Value("${openings.places.api-key:${GOOGLE_PLACES_API_KEY:}}") String apiKey) {
        this(HttpTimeouts.withTimeouts(builder, props.getHttp().getConnectTimeout(),
                props.getPlaces().getReadTimeout()).build(), props, apiKey);
    }

    PlaceSearchAdapter(RestClient rest, OpeningsProperties props, String apiKey) {
        this.rest = rest;
        this.config = props.getPlaces();
        this.apiKey = apiKey;
    }

    @Override public SourceLabel source() { return SourceLabel.PLACE_SEARCH; }

    @Override
    public Optional<String> misconfiguration() {
        if (apiKey == null || apiKey.isBlank()) {
            return Optional.of("GOOGLE_PLACES_API_KEY not set; skipping Google Places");
        }
        return Optional.empty();
    }

    @Override
    public List<RawPayload> fetch(QueryContext ctx) {
        if (misconfiguration().isPresent()) return List.of();

        Set<String> allowed = new HashSet<>(config.getAllowedTypes());
        Set<String> excluded = new HashSet<>(config.getExcludedTypes());
        if (ctx.strictRestaurants()) {
            allowed = new HashSet<>(Set.of("restaurant"));
            excluded.addAll(List.of("cafe", "fast_food"));
        }
        OpeningsProperties.CityCenter center = cityCenter(ctx.city());

        List<RawPayload> out = new ArrayList<>();
        for (String template : config.getQueryTemplates()) {
            String query = template.formatted(ctx.city());
            JsonNode places;
            try {
                places = search(query, center);
            } catch (RestClientException e) {
                log.warn("[Openings] places query=\"{}\" failed: {}", query, e.getMessage());
                continue;
            }
            int kept = 0;
            for (JsonNode place : places) {
                if (accept(place, ctx.city(), center, allowed, excluded)) {
                    out.add(new RawPayload(SourceLabel.PLACE_SEARCH, place));
                    kept++;
                }
            }
            log.debug("[Openings] places query=\"{}\" hits={} kept={}", query, places.size(), kept);
        }
        return out;
    }

    private JsonNode search(String query, OpeningsProperties.CityCenter center) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("textQuery", query);
        body.put("languageCode", config.getLanguageCode());
        body.put("pageSize", config.getPageSize());
        if (center != null) {
            body.put("locationBias", Map.of("circle", Map.of(
                    "center", Map.of("latitude", center.getLat(), "longitude", center.getLon()),
                    "radius", center.getRadiusKm() * 1000
            )));
        }

        JsonNode res = rest.post()
                .uri(config.getEndpoint())
                .header("X-Goog-Api-Key", apiKey)
                .header("X-Goog-FieldMask", config.getFieldMask())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);
        return res == null ? MissingNode.getInstance() : res.path("places");
    }

    /**
     * Type filter first (an excluded type wins over an allowed one), then location: the formatted address
     * names the city, or the point lies within the configured radius of the city center.
     */
    static boolean accept(JsonNode place, String city, OpeningsProperties.CityCenter center,
                          Set<String> allowed, Set<String> excluded) {
        Set<String> types = new HashSet<>();
        place.path("types").forEach(t -> types.add(t.asText("")));
        String primary = place.path("primaryType").asText("");
        if (!primary.isEmpty()) types.add(primary);

        if (!Collections.disjoint(types, excluded)) return false;
        if (Collections.disjoint(types, allowed)) return false;

        if (TextUtils.containsIgnoreCase(place.path("formattedAddress").asText(""), city)) return true;

        JsonNode location = place.path("location");
        if (center != null && location.path("latitude").isNumber() && location.path("longitude").isNumber()) {
            GeoPoint p = new GeoPoint(location.get("latitude").asDouble(), location.get("longitude").asDouble());
            return GeoMath.withinRadius(new GeoPoint(center.getLat(), center.getLon()), p, center.getRadiusKm());
        }
        return false;
    }

    private OpeningsProperties.CityCenter cityCenter(String city) {
        return config.getCityCenters().get(city.toLowerCase(Locale.ROOT));
    }
}
