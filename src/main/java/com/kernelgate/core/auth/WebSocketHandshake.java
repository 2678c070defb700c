package com.kernelgate.core.auth;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handshake headers that make a WebSocket upgrade look same-origin to the gateway.
 *
 * <p>Origin and host are computed from the target with {@code wss → https} and
 * every other scheme → {@code http}.
 *
 * @param originUri the target rewritten to its HTTP scheme
 * @param origin    {@code scheme://host[:port]} of {@code originUri}
 * @param host      {@code host[:port]} of the target
 * @param headers   headers to attach to the upgrade request
 */
public record WebSocketHandshake(URI originUri, String origin, String host, Map<String, String> headers) {

    public static WebSocketHandshake sameOrigin(URI target, String cookie) {
        String scheme = "wss".equalsIgnoreCase(target.getScheme()) ? "https" : "http";
        URI originUri = URI.create(scheme + target.toString().substring(target.getScheme().length()));
        String host = hostOf(originUri);
        String origin = scheme + "://" + host;

        var headers = new LinkedHashMap<String, String>();
        headers.put("Cookie", cookie);
        headers.put("Origin", origin);
        return new WebSocketHandshake(originUri, origin, host, Collections.unmodifiableMap(headers));
    }

    /**
     * {@code scheme://host[:port]} of an HTTP(S) URI.
     */
    static String originOf(URI uri) {
        return uri.getScheme().toLowerCase() + "://" + hostOf(uri);
    }

    private static String hostOf(URI uri) {
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }
}
