package com.kernelgate.core.model;

import java.util.Objects;

/**
 * A configured gateway the user can pick from.
 *
 * @param name    display name of the gateway
 * @param options connection options as configured (no transport hooks required)
 */
public record GatewayDescriptor(String name, ConnectionOptions options) {

    public GatewayDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(options, "options");
    }
}
