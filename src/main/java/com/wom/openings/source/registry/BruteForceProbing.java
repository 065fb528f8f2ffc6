package com.wom.openings.source.registry;

import com.wom.openings.config.OpeningsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Probes every candidate base URL and path suffix with a cheap search.
 *
 * <p>A 404 moves on to the next candidate. Any other outcome, including timeouts, server errors and
 * unreadable bodies, accepts the candidate: the path exists even if it rejects this particular query.
 */
@Slf4j
public class BruteForceProbing implements EndpointDiscoveryStrategy {

    private final RestClient rest;
    private final List<String> baseUrls;
    private final List<String> suffixes;
    private final List<String> dateFilterParams;

    public BruteForceProbing(RestClient rest, OpeningsProperties.Registry config) {
        this.rest = rest;
        this.baseUrls = List.copyOf(config.getCandidateBaseUrls());
        this.suffixes = List.copyOf(config.getCandidatePathSuffixes());
        this.dateFilterParams = List.copyOf(config.getDateFilterParams());
    }

    @Override public String name() { return "probe"; }

    @Override
    public Optional<EndpointDescriptor> discover(RegistryQuery probe) {
        for (String base : baseUrls) {
            for (String suffix : suffixes) {
                EndpointDescriptor candidate = new EndpointDescriptor(base, suffix, null);
                URI uri;
                try {
                    uri = probe.toUri(candidate.searchUrl(), dateFilterParams);
                } catch (IllegalArgumentException e) {
                    log.warn("[Openings] registry probe skipped malformed candidate {}: {}", candidate.searchUrl(), e.getMessage());
                    continue;
                }
                try {
                    rest.get().uri(uri).retrieve().toBodilessEntity();
                    return Optional.of(candidate);
                } catch (HttpClientErrorException e) {
                    if (e.getStatusCode().value() == 404) {
                        log.debug("[Openings] registry probe 404 at {}", uri);
                        continue;
                    }
                    log.warn("[Openings] registry probe accepted {} despite HTTP {}", candidate.searchUrl(), e.getStatusCode().value());
                    return Optional.of(candidate);
                } catch (RestClientException e) {
                    log.warn("[Openings] registry probe accepted {} despite error: {}", candidate.searchUrl(), e.getMessage());
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }
}
