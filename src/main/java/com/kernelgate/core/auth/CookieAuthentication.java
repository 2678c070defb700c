package com.kernelgate.core.auth;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.gateway.HttpRequestFactory;
import com.kernelgate.gateway.WebSocketFactory;

import java.net.http.HttpRequest;

/**
 * Cookie-based authentication for gateways that sit behind a login page.
 *
 * <p>The cookie travels as a regular request header on HTTP calls. Such gateways
 * usually also insist that requests come from their own origin, so both transport
 * hooks are wrapped: HTTP requests carry an {@code Origin} matching their target,
 * and WebSocket upgrades carry the cookie plus the {@code Origin} described by
 * {@link WebSocketHandshake#sameOrigin}. The hooks already present keep running
 * underneath.
 */
public final class CookieAuthentication {

    private CookieAuthentication() {}

    public static ConnectionOptions apply(ConnectionOptions options, String cookie) {
        HttpRequestFactory http = options.httpRequestFactory() != null
                ? options.httpRequestFactory()
                : HttpRequest::newBuilder;
        WebSocketFactory ws = options.webSocketFactory() != null
                ? options.webSocketFactory()
                : (builder, target) -> builder;

        return options
                .withoutRequestHeader("Origin")
                .withRequestHeader("Cookie", cookie)
                .withTransport(sameOriginRequests(http), sameOriginWebSocket(ws, cookie));
    }

    static HttpRequestFactory sameOriginRequests(HttpRequestFactory delegate) {
        return uri -> delegate.newRequest(uri).setHeader("Origin", WebSocketHandshake.originOf(uri));
    }

    static WebSocketFactory sameOriginWebSocket(WebSocketFactory delegate, String cookie) {
        return (builder, target) -> {
            var handshake = WebSocketHandshake.sameOrigin(target, cookie);
            var configured = delegate.configure(builder, target);
            // Host comes from the target URI itself and already equals handshake.host().
            handshake.headers().forEach(configured::header);
            return configured;
        };
    }
}
