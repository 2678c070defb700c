package com.kernelgate.gateway;

import com.kernelgate.core.model.GatewayDescriptor;

import java.util.List;

/**
 * Read-only source of the gateways a user can pick from.
 */
public interface GatewayCatalog {

    List<GatewayDescriptor> listGateways();
}
