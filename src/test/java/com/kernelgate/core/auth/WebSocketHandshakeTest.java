package com.kernelgate.core.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketHandshakeTest {

    @Test
    @DisplayName("secure websocket targets present an https origin")
    void wssBecomesHttps() {
        var handshake = WebSocketHandshake.sameOrigin(
                URI.create("wss://gw.example.com/api/kernels/k1/channels?session_id=x"), "c=1");

        assertEquals("https", handshake.originUri().getScheme());
        assertEquals("https://gw.example.com", handshake.origin());
        assertEquals("gw.example.com", handshake.host());
    }

    @Test
    @DisplayName("plain websocket targets present an http origin and keep the port")
    void wsBecomesHttp() {
        var handshake = WebSocketHandshake.sameOrigin(
                URI.create("ws://localhost:8888/api/kernels/k1/channels"), "c=1");

        assertEquals("http://localhost:8888", handshake.origin());
        assertEquals("localhost:8888", handshake.host());
        assertEquals(URI.create("http://localhost:8888/api/kernels/k1/channels"), handshake.originUri());
    }

    @Test
    @DisplayName("origin scheme is never a websocket scheme")
    void originSchemeIsAlwaysHttpFamily() {
        for (String target : List.of("ws://a/x", "wss://a/x", "WSS://a:1/x", "http://a/x", "https://a/x")) {
            var scheme = WebSocketHandshake.sameOrigin(URI.create(target), "c").originUri().getScheme();
            assertTrue(scheme.equals("http") || scheme.equals("https"), target + " -> " + scheme);
        }
    }

    @Test
    @DisplayName("handshake headers carry the cookie and origin")
    void headers() {
        var handshake = WebSocketHandshake.sameOrigin(URI.create("wss://gw/x"), "token=abc");

        assertEquals("token=abc", handshake.headers().get("Cookie"));
        assertEquals("https://gw", handshake.headers().get("Origin"));
        assertFalse(handshake.headers().containsKey("Host"));
    }
}
