package com.wom.openings.source.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wom.openings.config.HttpTimeouts;
import com.wom.openings.config.OpeningsProperties;
import com.wom.openings.exception.EndpointResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

/**
 * Locates the trade-register API, whose address and path layout have changed before and may change again.
 * A configured base URL wins; otherwise strategies run in order and the first descriptor is returned.
 */
@Slf4j
@Component
public class EndpointResolver {

    private final OpeningsProperties.Registry config;
    private final List<EndpointDiscoveryStrategy> strategies;

    @Autowired
    public EndpointResolver(RestClient.Builder builder, OpeningsProperties props, ObjectMapper om) {
        this(props, defaultStrategies(HttpTimeouts.withTimeouts(builder, props.getHttp().getConnectTimeout(),
                props.getRegistry().getReadTimeout()).build(), om, props.getRegistry()));
    }

    public EndpointResolver(OpeningsProperties props, List<EndpointDiscoveryStrategy> strategies) {
        this.config = props.getRegistry();
        this.strategies = List.copyOf(strategies);
    }

    static List<EndpointDiscoveryStrategy> defaultStrategies(RestClient rest, ObjectMapper om,
                                                             OpeningsProperties.Registry config) {
        return List.of(new SpecificationDiscovery(rest, om, config), new BruteForceProbing(rest, config));
    }

    public EndpointDescriptor resolve(RegistryQuery probe) {
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            EndpointDescriptor fixed = new EndpointDescriptor(config.getBaseUrl(), config.getSearchPath(), config.getDetailPath());
            log.info("[Openings] registry endpoint from configuration: {}", fixed);
            return fixed;
        }
        for (EndpointDiscoveryStrategy strategy : strategies) {
            Optional<EndpointDescriptor> found = strategy.discover(probe);
            if (found.isPresent()) {
                log.info("[Openings] registry endpoint resolved by {}: {}", strategy.name(), found.get());
                return found.get();
            }
        }
        throw new EndpointResolutionException("registry endpoint could not be resolved by any of "
                + strategies.stream().map(EndpointDiscoveryStrategy::name).toList());
    }
}
