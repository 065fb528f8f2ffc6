package com.wom.openings.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.wom.openings.config.HttpTimeouts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.exception.SourceUnavailableException;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;
import com.wom.openings.util.FallbackChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * OpenStreetMap venues via the Overpass API. Mandatory source: if every mirror fails the run is aborted.
 */
@Slf4j
@Component
public class GeoTagAdapter implements SourceAdapter {

    private static final Pattern REGEX_META = Pattern.compile("[^A-Za-z0-9_ ]");

    private final RestClient rest;
    private final OpeningsProperties.GeoTag config;

    @Autowired
    public GeoTagAdapter(RestClient.Builder builder, OpeningsProperties props) {
        this(HttpTimeouts.withTimeouts(builder, props.getHttp().getConnectTimeout(),
                props.getGeoTag().getReadTimeout()).build(), props);
    }

    GeoTagAdapter(RestClient rest, OpeningsProperties props) {
        this.rest = rest;
        this.config = props.getGeoTag();
    }

    @Override public SourceLabel source() { return SourceLabel.GEO_TAG; }

    @Override
    public List<RawPayload> fetch(QueryContext ctx) {
        String query = buildQuery(ctx, config.getAdminLevel(), config.getQueryTimeoutSeconds());
        JsonNode root;
        try {
            root = FallbackChain.firstSuccess("overpass", config.getMirrors(), url -> post(url, query));
        } catch (FallbackChain.ExhaustedException e) {
            throw new SourceUnavailableException(SourceLabel.GEO_TAG,
                    "All Overpass endpoints failed. Last error: "
                            + (e.getCause() == null ? "no mirrors configured" : e.getCause().getMessage()),
                    e);
        }

        Pattern amenityPattern = Pattern.compile("^(" + amenityRegex(ctx.amenities()) + ")$", Pattern.CASE_INSENSITIVE);
        List<RawPayload> out = new ArrayList<>();
        for (JsonNode el : root.path("elements")) {
            JsonNode tags = el.path("tags");
            if (!tags.isObject() || tags.isEmpty()) continue;
            if (!amenityPattern.matcher(tags.path("amenity").asText("")).matches()) continue;
            out.add(new RawPayload(SourceLabel.GEO_TAG, el));
        }
        log.info("[Openings] overpass city={} elements={} kept={}", ctx.city(), root.path("elements").size(), out.size());
        return out;
    }

    private JsonNode post(String url, String query) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("data", query);
        JsonNode res = rest.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (res == null || !res.isObject()) {
            throw new IllegalStateException("empty or non-object response from " + url);
        }
        return res;
    }

    /**
     * Venues in the city's administrative area carrying {@code opening_date} or {@code start_date};
     * with the newer proxy also anything edited since the cutoff.
     */
    static String buildQuery(QueryContext ctx, int adminLevel, int timeoutSeconds) {
        String amenities = amenityRegex(ctx.amenities());
        List<String> parts = new ArrayList<>();
        parts.add("nwr[\"amenity\"~\"^(%s)$\"][\"opening_date\"](area.searchArea);".formatted(amenities));
        parts.add("nwr[\"amenity\"~\"^(%s)$\"][\"start_date\"](area.searchArea);".formatted(amenities));
        if (ctx.useNewerProxy()) {
            parts.add("nwr[\"amenity\"~\"^(%s)$\"](newer:\"%sT00:00:00Z\")(area.searchArea);"
                    .formatted(amenities, ctx.cutoff()));
        }
        return """
                [out:json][timeout:%d];
                area["name"="%s"]["boundary"="administrative"]["admin_level"="%d"]->.searchArea;
                (
                  %s
                );
                out center tags;
                """.formatted(timeoutSeconds, escapeQl(ctx.city()), adminLevel,
                String.join("\n  ", parts));
    }

    /** Escapes a value for a double-quoted QL string literal. */
    static String escapeQl(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String amenityRegex(List<String> amenities) {
        String joined = amenities.stream()
                .map(String::strip)
                .filter(a -> !a.isEmpty())
                .map(a -> REGEX_META.matcher(a).replaceAll("\\\\$0"))
                .collect(Collectors.joining("|"));
        return joined.isEmpty() ? "restaurant" : joined;
    }
}
