package com.kernelgate.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for known gateways and the default HTTP transport.
 * <p>
 * Binds {@code kernelgate.*} from application.yml / environment variables.
 *
 * <pre>
 * kernelgate:
 *   gateways:
 *     - name: Local notebook server
 *       base-url: http://localhost:8888
 *       token: ...
 *   http:
 *     connect-timeout-seconds: 10
 *     request-timeout-seconds: 30
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "kernelgate")
public class GatewayProperties {

    private List<Gateway> gateways = new ArrayList<>();
    private Http http = new Http();

    // -- Http accessors (delegate to nested) --
    public int getConnectTimeoutSeconds() { return http.connectTimeoutSeconds; }
    public int getRequestTimeoutSeconds() { return http.requestTimeoutSeconds; }

    public List<Gateway> getGateways() { return gateways; }
    public void setGateways(List<Gateway> gateways) { this.gateways = gateways; }
    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }

    public static class Gateway {
        private String name;
        private String baseUrl;
        private String wsUrl;
        private String token;
        private Map<String, String> requestHeaders = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getWsUrl() { return wsUrl; }
        public void setWsUrl(String wsUrl) { this.wsUrl = wsUrl; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public Map<String, String> getRequestHeaders() { return requestHeaders; }
        public void setRequestHeaders(Map<String, String> requestHeaders) { this.requestHeaders = requestHeaders; }
    }

    public static class Http {
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }
}
