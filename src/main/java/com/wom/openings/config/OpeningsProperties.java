package com.wom.openings.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source endpoints, candidate lists and run defaults. Credentials are injected separately with {@code @Value}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "openings")
public class OpeningsProperties {

    private Defaults defaults = new Defaults();
    private Http http = new Http();
    private GeoTag geoTag = new GeoTag();
    private ReverseGeocode reverseGeocode = new ReverseGeocode();
    private Places places = new Places();
    private Registry registry = new Registry();

    @Getter
    @Setter
    public static class Defaults {
        private String city = "Helsinki";
        private int months = 6;
        private List<String> amenities = new ArrayList<>(List.of("restaurant", "cafe", "fast_food"));
        private int pageSize = 100;
        private int maxResults = 1000;
        private boolean useNewerProxy = false;
        private boolean reverseGeocode = false;
        private boolean placeSearch = false;
        private boolean registry = false;
    }

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class GeoTag {
        private List<String> mirrors = new ArrayList<>(List.of(
                "https://overpass-api.de/api/interpreter",
                "https://overpass.kumi.systems/api/interpreter",
                "https://overpass.nchc.org.tw/api/interpreter"
        ));
        /** Server-side timeout written into the Overpass QL header. */
        private int queryTimeoutSeconds = 180;
        private int adminLevel = 8;
        private Duration readTimeout = Duration.ofSeconds(180);
    }

    @Getter
    @Setter
    public static class ReverseGeocode {
        private String endpoint = "https://nominatim.openstreetmap.org/reverse";
        /** Courtesy delay between consecutive calls. The service blocks callers that go faster. */
        private Duration minInterval = Duration.ofSeconds(1);
        private long cacheSize = 5_000;
        private Duration readTimeout = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Places {
        private String endpoint = "https://places.googleapis.com/v1/places:searchText";
        private String languageCode = "en";
        private Duration readTimeout = Duration.ofSeconds(60);
        private int pageSize = 20;
        private String fieldMask = "places.displayName,places.formattedAddress,"
                + "places.primaryType,places.types,places.businessStatus,places.location";
        private List<String> queryTemplates = new ArrayList<>(List.of(
                "restaurant in %s",
                "cafe in %s",
                "street food in %s",
                "new restaurant in %s",
                "bistro in %s",
                "food stall in %s",
                "food court in %s"
        ));
        private List<String> allowedTypes = new ArrayList<>(List.of("restaurant", "cafe", "fast_food"));
        private List<String> excludedTypes = new ArrayList<>(List.of(
                "bar", "pub", "night_club", "casino", "lodging", "gas_station"
        ));
        /** Keyed by lowercase city name. */
        private Map<String, CityCenter> cityCenters = new LinkedHashMap<>(Map.of(
                "helsinki", new CityCenter(60.1699, 24.9384, 30)
        ));
    }

    @Getter
    @Setter
    public static class CityCenter {
        private double lat;
        private double lon;
        private double radiusKm;

        public CityCenter() {}

        public CityCenter(double lat, double lon, double radiusKm) {
            this.lat = lat;
            this.lon = lon;
            this.radiusKm = radiusKm;
        }
    }

    @Getter
    @Setter
    public static class Registry {
        /** When set, discovery is skipped and this base URL is used as-is. */
        private String baseUrl;
        private String searchPath = "";
        private String detailPath = "/{businessId}";
        private Duration descriptorTtl = Duration.ofHours(6);
        /** Also bounds each discovery probe. */
        private Duration readTimeout = Duration.ofSeconds(30);
        private List<String> docPortals = new ArrayList<>(List.of(
                "https://avoindata.prh.fi/ytj_en.html",
                "https://avoindata.prh.fi/ytj.html",
                "https://avoindata.prh.fi/swagger-ui/swagger-initializer.js"
        ));
        private List<String> candidateBaseUrls = new ArrayList<>(List.of(
                "https://avoindata.prh.fi/bis/v1",
                "https://avoindata.prh.fi/opendata-bis/v1",
                "https://avoindata.prh.fi/tr/v1"
        ));
        private List<String> candidatePathSuffixes = new ArrayList<>(List.of(
                "", "/companies", "/company"
        ));
        /** Parameter names that identify the registration-date search operation in an API description. */
        private List<String> dateFilterParams = new ArrayList<>(List.of(
                "companyRegistrationFrom", "companyRegistrationTo"
        ));
        private List<String> languagePreference = new ArrayList<>(List.of("EN", "FI"));
    }
}
