package com.kernelgate.core.model;

import com.kernelgate.gateway.HttpRequestFactory;
import com.kernelgate.gateway.WebSocketFactory;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to reach one gateway.
 *
 * <p>Immutable: every credential step returns a new value. The {@code with*}
 * methods only add material (headers are merged, never dropped), so repeated
 * negotiation rounds are monotonic. Transport hooks are replaced only when a
 * strategy explicitly installs its own.
 *
 * @param baseUrl            HTTP(S) base URL of the gateway
 * @param wsUrl              WebSocket base URL, or null to derive it from {@code baseUrl}
 * @param token              bearer token, or null
 * @param requestHeaders     extra headers sent on every request (never null)
 * @param httpRequestFactory hook creating HTTP requests, or null until defaults are merged
 * @param webSocketFactory   hook configuring WebSocket handshakes, or null until defaults are merged
 */
public record ConnectionOptions(
        String baseUrl,
        String wsUrl,
        String token,
        Map<String, String> requestHeaders,
        HttpRequestFactory httpRequestFactory,
        WebSocketFactory webSocketFactory
) {

    public ConnectionOptions {
        Objects.requireNonNull(baseUrl, "baseUrl");
        requestHeaders = requestHeaders == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requestHeaders));
    }

    public static ConnectionOptions of(String baseUrl) {
        return new ConnectionOptions(baseUrl, null, null, Map.of(), null, null);
    }

    public ConnectionOptions withToken(String newToken) {
        return new ConnectionOptions(baseUrl, wsUrl, newToken, requestHeaders,
                httpRequestFactory, webSocketFactory);
    }

    /**
     * Sets {@code name}, replacing any existing header of that name regardless of case.
     */
    public ConnectionOptions withRequestHeader(String name, String value) {
        var merged = headersWithout(name);
        merged.put(name, value);
        return new ConnectionOptions(baseUrl, wsUrl, token, merged,
                httpRequestFactory, webSocketFactory);
    }

    public ConnectionOptions withoutRequestHeader(String name) {
        return new ConnectionOptions(baseUrl, wsUrl, token, headersWithout(name),
                httpRequestFactory, webSocketFactory);
    }

    private LinkedHashMap<String, String> headersWithout(String name) {
        var remaining = new LinkedHashMap<>(requestHeaders);
        remaining.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
        return remaining;
    }

    public ConnectionOptions withTransport(HttpRequestFactory http, WebSocketFactory ws) {
        return new ConnectionOptions(baseUrl, wsUrl, token, requestHeaders,
                Objects.requireNonNull(http, "http"), Objects.requireNonNull(ws, "ws"));
    }

    /**
     * Fills in transport hooks the configuration left unset; configured hooks win.
     */
    public ConnectionOptions withDefaultTransport(HttpRequestFactory http, WebSocketFactory ws) {
        return new ConnectionOptions(baseUrl, wsUrl, token, requestHeaders,
                httpRequestFactory != null ? httpRequestFactory : http,
                webSocketFactory != null ? webSocketFactory : ws);
    }

    /**
     * Base URL for WebSocket connections: {@code wsUrl} when configured, otherwise
     * the base URL with {@code http → ws} and {@code https → wss}.
     */
    public URI webSocketBase() {
        if (wsUrl != null && !wsUrl.isBlank()) {
            return URI.create(wsUrl);
        }
        URI base = URI.create(baseUrl);
        String scheme = "https".equalsIgnoreCase(base.getScheme()) ? "wss" : "ws";
        return URI.create(scheme + baseUrl.substring(base.getScheme().length()));
    }

    @Override
    public String toString() {
        var safeHeaders = new LinkedHashMap<String, String>();
        requestHeaders.forEach((k, v) ->
                safeHeaders.put(k, "cookie".equalsIgnoreCase(k) || "authorization".equalsIgnoreCase(k) ? "***" : v));
        return "ConnectionOptions[baseUrl=" + baseUrl
                + ", wsUrl=" + wsUrl
                + ", token=" + (token == null ? "null" : "***")
                + ", requestHeaders=" + safeHeaders + "]";
    }
}
