package com.wom.openings.source.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wom.openings.config.HttpTimeouts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.model.QueryContext;
import com.wom.openings.model.RawPayload;
import com.wom.openings.model.SourceLabel;
import com.wom.openings.source.SourceAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Newly registered companies from the Finnish trade register. Registration date stands in for opening date.
 *
 * <p>Each payload body is {@code {"company": <search hit>, "detail": <detail or absent>, "businessLineCode": <filter>}}.
 * Endpoint resolution failures propagate; everything after resolution degrades to fewer or thinner payloads.
 */
@Slf4j
@Component
public class RegistryAdapter implements SourceAdapter {

    private static final String DESCRIPTOR_KEY = "registry";

    private final RestClient rest;
    private final EndpointResolver resolver;
    private final List<String> dateFilterParams;
    private final Cache<String, EndpointDescriptor> descriptors;

    @Autowired
    public RegistryAdapter(RestClient.Builder builder, EndpointResolver resolver, OpeningsProperties props) {
        this(HttpTimeouts.withTimeouts(builder, props.getHttp().getConnectTimeout(),
                props.getRegistry().getReadTimeout()).build(), resolver, props);
    }

    RegistryAdapter(RestClient rest, EndpointResolver resolver, OpeningsProperties props) {
        this.rest = rest;
        this.resolver = resolver;
        this.dateFilterParams = List.copyOf(props.getRegistry().getDateFilterParams());
        this.descriptors = Caffeine.newBuilder()
                .expireAfterWrite(props.getRegistry().getDescriptorTtl())
                .maximumSize(1)
                .build();
    }

    @Override public SourceLabel source() { return SourceLabel.REGISTRY; }

    /**
     * @throws com.wom.openings.exception.EndpointResolutionException when no endpoint can be found
     */
    @Override
    public List<RawPayload> fetch(QueryContext ctx) {
        EndpointDescriptor endpoint = descriptors.get(DESCRIPTOR_KEY, k -> resolver.resolve(RegistryQuery.probe(ctx)));

        List<String> codes = ctx.businessLineCodes().isEmpty()
                ? Collections.singletonList(null)
                : ctx.businessLineCodes();

        List<RawPayload> out = new ArrayList<>();
        for (String code : codes) {
            if (out.size() >= ctx.maxResults()) break;
            pageThrough(endpoint, ctx, code, out);
        }
        log.info("[Openings] registry office={} codes={} hits={}", ctx.registeredOffice(), codes, out.size());
        return out;
    }

    private void pageThrough(EndpointDescriptor endpoint, QueryContext ctx, String code, List<RawPayload> out) {
        int offset = 0;
        while (out.size() < ctx.maxResults()) {
            URI uri = RegistryQuery.page(ctx, code, offset).toUri(endpoint.searchUrl(), dateFilterParams);
            JsonNode results;
            try {
                JsonNode page = rest.get().uri(uri).retrieve().body(JsonNode.class);
                results = page == null ? null : page.get("results");
            } catch (RestClientException e) {
                log.warn("[Openings] registry page code={} offset={} failed: {}", code, offset, e.getMessage());
                return;
            }
            if (results == null || !results.isArray()) {
                log.warn("[Openings] registry page code={} offset={} has no results array", code, offset);
                return;
            }

            for (JsonNode hit : results) {
                if (out.size() >= ctx.maxResults()) return;
                out.add(toPayload(endpoint, hit, code));
            }
            if (results.size() < ctx.pageSize()) return;
            offset += results.size();
        }
    }

    private RawPayload toPayload(EndpointDescriptor endpoint, JsonNode hit, String code) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("company", hit);
        JsonNode detail = lookupDetail(endpoint, hit.path("businessId").asText(""));
        if (detail != null) body.set("detail", detail);
        if (code != null) body.put("businessLineCode", code);
        return new RawPayload(SourceLabel.REGISTRY, body);
    }

    /** The company's detail object, or null when the lookup fails or the response has no usable shape. */
    JsonNode lookupDetail(EndpointDescriptor endpoint, String businessId) {
        if (businessId.isBlank()) return null;
        try {
            JsonNode root = rest.get()
                    .uri(URI.create(endpoint.detailUrl(businessId)))
                    .retrieve()
                    .body(JsonNode.class);
            if (root == null) return null;
            JsonNode results = root.path("results");
            if (results.isArray() && !results.isEmpty() && results.get(0).isObject()) return results.get(0);
            if (root.has("addresses") || root.has("businessLines")) return root;
            log.warn("[Openings] registry detail for {} has unexpected shape", businessId);
            return null;
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("[Openings] registry detail for {} failed: {}", businessId, e.getMessage());
            return null;
        }
    }
}
