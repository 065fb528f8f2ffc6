package com.wom.openings.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.model.CanonicalRecord;
import com.wom.openings.model.GeoPoint;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;
import com.wom.openings.service.ConfidenceScorer;
import com.wom.openings.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Maps one raw payload to at most one {@link CanonicalRecord}. Pure: no network, no shared state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CanonicalRecordNormalizer {

    static final String PLACE_DESCRIPTION = "Place search candidate (no opening date provided)";

    private static final Pattern CUISINE_SPLIT = Pattern.compile("[;,_]");
    private static final List<String> BOOLEAN_AMENITIES =
            List.of("outdoor_seating", "delivery", "takeaway", "vegetarian", "vegan");
    private static final List<String> DESCRIPTION_KEYS =
            List.of("description", "description:en", "short_description", "note");

    private final OpeningDateParser dateParser;
    private final ConfidenceScorer scorer;
    private final OpeningsProperties props;

    public Optional<CanonicalRecord> normalize(RawPayload payload, QueryContext ctx) {
        return switch (payload.source()) {
            case GEO_TAG -> fromGeoTag(payload.body(), ctx);
            case PLACE_SEARCH -> Optional.of(fromPlace(payload.body()));
            case REGISTRY -> Optional.of(fromRegistry(payload.body()));
            case REVERSE_GEOCODE -> Optional.empty();
        };
    }

    // ===================== geo-tag =====================

    private Optional<CanonicalRecord> fromGeoTag(JsonNode element, QueryContext ctx) {
        Map<String, String> tags = tagMap(element);

        String rawDate = firstNonBlank(tags.get("opening_date"), tags.get("start_date"));
        LocalDate openingDate = dateParser.parse(rawDate).orElse(null);

        if (openingDate == null && !ctx.useNewerProxy()) {
            log.debug("[Openings] geo-tag element {} dropped: no usable date", element.path("id").asText());
            return Optional.empty();
        }
        if (openingDate != null && openingDate.isBefore(ctx.cutoff())) {
            return Optional.empty();
        }

        return Optional.of(CanonicalRecord.builder()
                .name(TextUtils.safe(tags.get("name")))
                .address(buildAddress(tags))
                .description(describe(tags))
                .tags(buildTags(tags))
                .openingDate(openingDate)
                .source(SourceLabel.GEO_TAG)
                .confidence(scorer.seed(SourceLabel.GEO_TAG, openingDate != null))
                .build());
    }

    /** Element coordinates, from {@code lat}/{@code lon} or the nested {@code center} of ways and relations. */
    public static Optional<GeoPoint> coordinatesOf(RawPayload payload) {
        JsonNode el = payload.body();
        JsonNode lat = el.hasNonNull("lat") ? el.get("lat") : el.path("center").get("lat");
        JsonNode lon = el.hasNonNull("lon") ? el.get("lon") : el.path("center").get("lon");
        if (lat == null || lon == null || !lat.isNumber() || !lon.isNumber()) return Optional.empty();
        return Optional.of(new GeoPoint(lat.asDouble(), lon.asDouble()));
    }

    /**
     * {@code addr:full} if present, otherwise street + house number, postcode + city and country,
     * skipping whatever is missing.
     */
    static String buildAddress(Map<String, String> tags) {
        String full = tags.get("addr:full");
        if (!TextUtils.isBlank(full)) return full.strip();

        String street = tags.get("addr:street");
        String house = tags.get("addr:housenumber");
        String streetPart = TextUtils.isBlank(street) ? null
                : TextUtils.isBlank(house) ? street.strip() : street.strip() + " " + house.strip();

        String postcode = tags.get("addr:postcode");
        String city = tags.get("addr:city");
        String cityPart = TextUtils.isBlank(city) ? null
                : TextUtils.isBlank(postcode) ? city.strip() : postcode.strip() + " " + city.strip();

        return TextUtils.joinFragments(streetPart, cityPart, tags.get("addr:country"));
    }

    static Set<String> buildTags(Map<String, String> tags) {
        Set<String> out = new TreeSet<>();

        String amenity = tags.get("amenity");
        if (!TextUtils.isBlank(amenity)) out.add(amenity.strip());

        String cuisine = tags.get("cuisine");
        if (!TextUtils.isBlank(cuisine)) {
            for (String item : CUISINE_SPLIT.split(cuisine)) {
                if (!item.isBlank()) out.add("cuisine:" + item.strip());
            }
        }

        for (String key : BOOLEAN_AMENITIES) {
            String v = tags.get(key);
            if ("yes".equals(v) || "no".equals(v)) out.add(key + ":" + v);
        }

        tags.forEach((k, v) -> {
            if (k.startsWith("diet:") && !TextUtils.isBlank(v)) out.add(k + ":" + v);
        });
        return out;
    }

    static String describe(Map<String, String> tags) {
        for (String key : DESCRIPTION_KEYS) {
            String v = tags.get(key);
            if (!TextUtils.isBlank(v)) return v.strip();
        }
        String cuisine = tags.get("cuisine");
        if (!TextUtils.isBlank(cuisine)) return cuisine.replace(";", ", ") + " cuisine";
        return "";
    }

    // ===================== place search =====================

    private CanonicalRecord fromPlace(JsonNode place) {
        Set<String> tags = new TreeSet<>();
        tags.add("source:google_places");
        String primary = text(place, "primaryType");
        if (!primary.isEmpty()) tags.add("type:" + primary);
        for (JsonNode t : place.path("types")) {
            if (!t.asText("").isBlank()) tags.add("type:" + t.asText().strip());
        }

        return CanonicalRecord.builder()
                .name(text(place.path("displayName"), "text"))
                .address(text(place, "formattedAddress"))
                .description(PLACE_DESCRIPTION)
                .tags(tags)
                .source(SourceLabel.PLACE_SEARCH)
                .confidence(scorer.seed(SourceLabel.PLACE_SEARCH, false))
                .build();
    }

    // ===================== registry =====================

    private CanonicalRecord fromRegistry(JsonNode body) {
        JsonNode company = body.path("company");
        JsonNode detail = body.path("detail");

        Set<String> tags = new TreeSet<>();
        tags.add("source:registry");

        String companyForm = text(company, "companyForm");
        if (!companyForm.isEmpty()) tags.add("company_form:" + companyForm);

        String address = "";
        String businessLine = "";
        String businessLineCode = text(body, "businessLineCode");
        if (detail.isObject()) {
            JsonNode addr = preferredEntry(detail.path("addresses"));
            if (addr != null) {
                String postCity = (text(addr, "postCode") + " " + text(addr, "city")).strip();
                address = TextUtils.joinFragments(text(addr, "street"), postCity);
            }
            JsonNode line = preferredEntry(detail.path("businessLines"));
            if (line != null) {
                businessLine = text(line, "name");
                if (!text(line, "code").isEmpty()) businessLineCode = text(line, "code");
            }
        }
        if (!businessLine.isEmpty()) tags.add("business_line:" + businessLine);
        if (!businessLineCode.isEmpty()) tags.add("business_line_code:" + businessLineCode);

        String lastModified = firstNonBlank(text(detail, "lastModified"), text(company, "lastModified"));

        return CanonicalRecord.builder()
                .name(text(company, "name"))
                .address(address)
                .description(businessLine)
                .tags(tags)
                .openingDate(dateParser.parse(text(company, "registrationDate")).orElse(null))
                .source(SourceLabel.REGISTRY)
                .confidence(scorer.seed(SourceLabel.REGISTRY, true))
                .lastModified(lastModified)
                .build();
    }

    /**
     * Among current entries (no end date) pick by configured language order, then any entry.
     */
    JsonNode preferredEntry(JsonNode entries) {
        if (!entries.isArray() || entries.isEmpty()) return null;
        List<JsonNode> current = new ArrayList<>();
        for (JsonNode e : entries) {
            if (text(e, "endDate").isEmpty()) current.add(e);
        }
        if (current.isEmpty()) entries.forEach(current::add);

        for (String lang : props.getRegistry().getLanguagePreference()) {
            for (JsonNode e : current) {
                if (lang.equalsIgnoreCase(text(e, "language"))) return e;
            }
        }
        return current.get(0);
    }

    // ===================== helpers =====================

    private static Map<String, String> tagMap(JsonNode element) {
        Map<String, String> out = new LinkedHashMap<>();
        element.path("tags").fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText("")));
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return "";
        return v.asText("").strip();
    }

    private static String firstNonBlank(String a, String b) {
        if (!TextUtils.isBlank(a)) return a;
        return TextUtils.isBlank(b) ? null : b;
    }
}
