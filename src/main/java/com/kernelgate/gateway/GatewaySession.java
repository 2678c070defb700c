package com.kernelgate.gateway;

import com.kernelgate.core.model.KernelModel;
import com.kernelgate.core.model.KernelSpec;

/**
 * A live session on a gateway, holding the connection to its kernel.
 */
public interface GatewaySession extends AutoCloseable {

    String id();

    String path();

    KernelModel kernel();

    /**
     * Fetches the spec of this session's kernel from the gateway.
     */
    KernelSpec getKernelSpec();

    /**
     * Closes the kernel connection. The remote session keeps running.
     */
    @Override
    void close();
}
