package com.kernelgate.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kernelgate.gateway.jupyter.JupyterGatewayClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class GatewayConfig {

    @Bean
    public HttpClient gatewayHttpClient(GatewayProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public TransportDefaults transportDefaults(GatewayProperties properties) {
        return new TransportDefaults(
                Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
                Duration.ofSeconds(properties.getConnectTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean(GatewayClient.class)
    public GatewayClient jupyterGatewayClient(HttpClient gatewayHttpClient, ObjectMapper objectMapper) {
        return new JupyterGatewayClient(gatewayHttpClient, objectMapper);
    }
}
