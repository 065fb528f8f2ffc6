package com.wom.openings.source.registry;

import java.util.Optional;

/**
 * One way of locating the registry API. Coming up empty is an ordinary outcome, not an error.
 */
public interface EndpointDiscoveryStrategy {
    String name();
    Optional<EndpointDescriptor> discover(RegistryQuery probe);
}
