package com.wom.openings.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

// Local credentials (places API key, nominatim user agent) kept out of application.yml.
@Configuration
@PropertySource(
        value = "classpath:properties/credentials.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
