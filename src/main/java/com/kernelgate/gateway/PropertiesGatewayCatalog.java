package com.kernelgate.gateway;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.GatewayDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GatewayCatalog} backed by {@code kernelgate.gateways}.
 */
@Component
public class PropertiesGatewayCatalog implements GatewayCatalog {

    private static final Logger log = LoggerFactory.getLogger(PropertiesGatewayCatalog.class);

    private final GatewayProperties properties;

    public PropertiesGatewayCatalog(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<GatewayDescriptor> listGateways() {
        var descriptors = new ArrayList<GatewayDescriptor>();
        if (properties.getGateways() == null) {
            return descriptors;
        }
        for (var gateway : properties.getGateways()) {
            if (isBlank(gateway.getName()) || isBlank(gateway.getBaseUrl())) {
                log.warn("Skipping gateway entry without name or base-url: name={}", gateway.getName());
                continue;
            }
            var options = new ConnectionOptions(
                    gateway.getBaseUrl(),
                    gateway.getWsUrl(),
                    isBlank(gateway.getToken()) ? null : gateway.getToken(),
                    gateway.getRequestHeaders(),
                    null, null);
            descriptors.add(new GatewayDescriptor(gateway.getName(), options));
        }
        return descriptors;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
