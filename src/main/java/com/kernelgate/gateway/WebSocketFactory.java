package com.kernelgate.gateway;

import java.net.URI;
import java.net.http.WebSocket;

/**
 * Configures the handshake of every WebSocket opened to a gateway.
 */
@FunctionalInterface
public interface WebSocketFactory {

    /**
     * @param builder a fresh builder from the client's {@code HttpClient}
     * @param target  the WebSocket URI about to be opened
     * @return the builder to open the connection with
     */
    WebSocket.Builder configure(WebSocket.Builder builder, URI target);
}
