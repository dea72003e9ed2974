package com.seamtalk.util;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds {@link RestClient}s with bounded connect and read timeouts for collaborator calls.
 */
public final class RestClients {

    private RestClients() {
    }

    public static RestClient withTimeout(Duration timeout) {
        return withTimeout(RestClient.builder(), timeout);
    }

    public static RestClient withTimeout(RestClient.Builder builder, Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return builder.requestFactory(factory).build();
    }
}
