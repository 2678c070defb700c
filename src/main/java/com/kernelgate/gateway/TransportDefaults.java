package com.kernelgate.gateway;

import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Transport hooks used when a gateway's configuration does not supply its own.
 */
public class TransportDefaults {

    private final HttpRequestFactory httpRequestFactory;
    private final WebSocketFactory webSocketFactory;

    public TransportDefaults(Duration requestTimeout, Duration connectTimeout) {
        this.httpRequestFactory = uri -> HttpRequest.newBuilder(uri).timeout(requestTimeout);
        this.webSocketFactory = (builder, target) -> builder.connectTimeout(connectTimeout);
    }

    public HttpRequestFactory httpRequestFactory() { return httpRequestFactory; }
    public WebSocketFactory webSocketFactory() { return webSocketFactory; }
}
