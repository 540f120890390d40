package com.advisoryplatform.orchestrator.acquirer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Where and how to ask one peer for its verdict.
 *
 * @param coreName   peer identity, used when the payload carries no {@code core_name}
 * @param url        absolute endpoint URL
 * @param method     HTTP method, upper-cased; defaults to {@code POST}
 * @param payloadKey key under which the decision context is sent; defaults to {@code query}
 */
public record PeerEndpoint(
    @JsonProperty("core_name")   String coreName,
    @JsonProperty("url")         String url,
    @JsonProperty("method")      String method,
    @JsonProperty("payload_key") String payloadKey
) {
    public static final String DEFAULT_METHOD      = "POST";
    public static final String DEFAULT_PAYLOAD_KEY = "query";

    public PeerEndpoint {
        if (coreName == null || coreName.isBlank()) {
            throw new IllegalArgumentException("core_name is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required. core=" + coreName);
        }
        method     = (method == null || method.isBlank()) ? DEFAULT_METHOD : method.strip().toUpperCase(Locale.ROOT);
        payloadKey = (payloadKey == null || payloadKey.isBlank()) ? DEFAULT_PAYLOAD_KEY : payloadKey;
    }

    public static PeerEndpoint of(String coreName, String url) {
        return new PeerEndpoint(coreName, url, DEFAULT_METHOD, DEFAULT_PAYLOAD_KEY);
    }

    public boolean isGet() {
        return "GET".equals(method);
    }
}
