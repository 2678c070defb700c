package com.kernelgate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kernelgate.gateway.jupyter.JupyterGatewayClient;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    private final GatewayConfig config = new GatewayConfig();

    @Test
    void httpClientUsesConfiguredConnectTimeout() {
        var properties = new GatewayProperties();
        properties.getHttp().setConnectTimeoutSeconds(3);

        HttpClient client = config.gatewayHttpClient(properties);

        assertEquals(Duration.ofSeconds(3), client.connectTimeout().orElseThrow());
    }

    @Test
    void transportDefaultsApplyRequestTimeout() {
        var properties = new GatewayProperties();
        properties.getHttp().setRequestTimeoutSeconds(7);

        TransportDefaults defaults = config.transportDefaults(properties);
        var request = defaults.httpRequestFactory().newRequest(URI.create("http://lab/api")).GET().build();

        assertEquals(Duration.ofSeconds(7), request.timeout().orElseThrow());
        assertSame(defaults.httpRequestFactory(), defaults.httpRequestFactory());
    }

    @Test
    void defaultClientTalksJupyter() {
        var client = config.jupyterGatewayClient(HttpClient.newHttpClient(), new ObjectMapper());
        assertInstanceOf(JupyterGatewayClient.class, client);
    }
}
