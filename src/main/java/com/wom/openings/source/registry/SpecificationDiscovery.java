package com.wom.openings.source.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.util.FallbackChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the registry API through its published API description.
 *
 * <p>Each documentation portal page is scanned for an embedded description URL, either a Swagger UI style
 * {@code url: "..."} assignment or a {@code "urls": [{"url": "..."}]} array. The description (OpenAPI 3 or
 * Swagger 2 JSON) yields the base URL, the search operation (the one whose parameters include every
 * registration-date filter name) and a detail path with an id placeholder.
 */
@Slf4j
public class SpecificationDiscovery implements EndpointDiscoveryStrategy {

    static final Pattern DIRECT_URL = Pattern.compile("\\burl\\s*:\\s*[\"']([^\"']+)[\"']");
    static final Pattern URLS_ARRAY = Pattern.compile("\"urls\"\\s*:\\s*\\[\\s*\\{[^}]*?\"url\"\\s*:\\s*\"([^\"]+)\"");

    private static final List<String> HTTP_METHODS = List.of("get", "post", "put", "delete", "patch", "head", "options");

    private final RestClient rest;
    private final ObjectMapper om;
    private final List<String> portals;
    private final List<String> dateFilterParams;

    public SpecificationDiscovery(RestClient rest, ObjectMapper om, OpeningsProperties.Registry config) {
        this.rest = rest;
        this.om = om;
        this.portals = List.copyOf(config.getDocPortals());
        this.dateFilterParams = List.copyOf(config.getDateFilterParams());
    }

    @Override public String name() { return "api-description"; }

    @Override
    public Optional<EndpointDescriptor> discover(RegistryQuery probe) {
        try {
            return Optional.of(FallbackChain.firstSuccess("registry api-description", portals, this::fromPortal));
        } catch (FallbackChain.ExhaustedException e) {
            log.info("[Openings] registry api-description discovery found nothing: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private EndpointDescriptor fromPortal(String portal) throws Exception {
        String page = rest.get().uri(portal).retrieve().body(String.class);
        String specUrl = extractSpecUrl(page)
                .orElseThrow(() -> new NoSuchElementException("no API description link on " + portal));
        URI specUri = URI.create(portal).resolve(specUrl);

        String specText = rest.get().uri(specUri).retrieve().body(String.class);
        if (specText == null || specText.isBlank()) {
            throw new NoSuchElementException("empty API description at " + specUri);
        }
        return fromSpecification(om.readTree(specText), specUri);
    }

    static Optional<String> extractSpecUrl(String page) {
        if (page == null || page.isBlank()) return Optional.empty();
        Matcher direct = DIRECT_URL.matcher(page);
        if (direct.find()) return Optional.of(direct.group(1));
        Matcher array = URLS_ARRAY.matcher(page);
        if (array.find()) return Optional.of(array.group(1));
        return Optional.empty();
    }

    EndpointDescriptor fromSpecification(JsonNode spec, URI specUri) {
        String base = baseUrl(spec, specUri);
        JsonNode paths = spec.path("paths");
        if (!paths.isObject()) throw new NoSuchElementException("API description at " + specUri + " has no paths");

        String searchPath = null;
        Iterator<Map.Entry<String, JsonNode>> it = paths.fields();
        while (it.hasNext() && searchPath == null) {
            Map.Entry<String, JsonNode> e = it.next();
            if (parameterNames(spec, e.getValue()).containsAll(dateFilterParams)) {
                searchPath = e.getKey();
            }
        }
        if (searchPath == null) {
            throw new NoSuchElementException("no operation with parameters " + dateFilterParams + " in " + specUri);
        }

        String detailPath = null;
        String searchPrefix = EndpointDescriptor.stripTrailingSlash(searchPath) + "/";
        for (Iterator<String> names = paths.fieldNames(); names.hasNext(); ) {
            String path = names.next();
            if (!EndpointDescriptor.PLACEHOLDER.matcher(path).find()) continue;
            if (path.startsWith(searchPrefix)) {
                detailPath = path;
                break;
            }
            if (detailPath == null) detailPath = path;
        }
        if (detailPath == null) detailPath = EndpointDescriptor.guessDetailPath(searchPath);

        return new EndpointDescriptor(base, EndpointDescriptor.stripTrailingSlash(searchPath), detailPath);
    }

    /** OpenAPI 3 {@code servers}, else Swagger 2 {@code schemes/host/basePath}, else the description's own origin. */
    static String baseUrl(JsonNode spec, URI specUri) {
        JsonNode servers = spec.path("servers");
        if (servers.isArray() && !servers.isEmpty() && !servers.get(0).path("url").asText("").isBlank()) {
            return specUri.resolve(servers.get(0).path("url").asText().strip()).toString();
        }
        String basePath = spec.path("basePath").asText("");
        String host = spec.path("host").asText("");
        if (!host.isBlank()) {
            String scheme = spec.path("schemes").path(0).asText(specUri.getScheme());
            return scheme + "://" + host + basePath;
        }
        return specUri.getScheme() + "://" + specUri.getRawAuthority() + basePath;
    }

    private static Set<String> parameterNames(JsonNode spec, JsonNode pathItem) {
        Set<String> names = new HashSet<>();
        collectNames(spec, pathItem.path("parameters"), names);
        for (String method : HTTP_METHODS) {
            collectNames(spec, pathItem.path(method).path("parameters"), names);
        }
        return names;
    }

    private static void collectNames(JsonNode spec, JsonNode params, Set<String> names) {
        for (JsonNode p : params) {
            JsonNode param = p;
            String ref = p.path("$ref").asText("");
            if (ref.startsWith("#/")) param = spec.at(ref.substring(1));
            String name = param.path("name").asText("");
            if (!name.isEmpty()) names.add(name);
        }
    }
}
