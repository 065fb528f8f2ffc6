package com.wom.openings.config;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Per-source timeouts. Each adapter builds its client from a copy of the shared builder.
 */
public final class HttpTimeouts {

    private HttpTimeouts() {}

    public static RestClient.Builder withTimeouts(RestClient.Builder builder, Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connect.toMillis());
        factory.setReadTimeout((int) read.toMillis());
        return builder.clone().requestFactory(factory);
    }
}
