package com.kernelgate.core.resolver;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.gateway.GatewayException;

import java.util.List;

/**
 * Outcome of spec discovery against one gateway. Fatal failures are thrown, not returned.
 */
public sealed interface GatewayResolution {

    /**
     * Discovery succeeded.
     *
     * @param options     the options that worked, credentials included
     * @param kernelSpecs specs that passed the caller's filter
     */
    record Resolved(ConnectionOptions options, List<KernelSpec> kernelSpecs) implements GatewayResolution {
        public Resolved {
            kernelSpecs = List.copyOf(kernelSpecs);
        }
    }

    /** The user backed out of credential negotiation. */
    record Cancelled() implements GatewayResolution {}

    /** The gateway timed out; not retried. */
    record Unreachable(GatewayException cause) implements GatewayResolution {}
}
