package com.kernelgate.core.resolver;

import com.kernelgate.core.auth.CredentialNegotiator;
import com.kernelgate.core.auth.Negotiation;
import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.FailureKind;
import com.kernelgate.core.model.GatewayDescriptor;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.picker.ResolutionContext;
import com.kernelgate.gateway.GatewayClient;
import com.kernelgate.gateway.GatewayException;
import com.kernelgate.gateway.TransportDefaults;
import com.kernelgate.ui.ChooserMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Discovers the kernel specs of a chosen gateway, negotiating credentials on demand.
 *
 * <p>Gateways rarely tell a bad credential apart from an unreachable server (both
 * often surface as a refused connection), so every failure that carries a gateway
 * payload and is not a timeout earns exactly one credential round and one retry.
 * A failure of the retry is fatal; negotiation is never re-entered.
 */
@Service
public class GatewayResolver {

    private static final Logger log = LoggerFactory.getLogger(GatewayResolver.class);

    static final ChooserMessages LOADING =
            ChooserMessages.loading("Loading sessions...", "No sessions available");

    private final GatewayClient client;
    private final CredentialNegotiator negotiator;
    private final TransportDefaults transportDefaults;

    public GatewayResolver(GatewayClient client, CredentialNegotiator negotiator,
                           TransportDefaults transportDefaults) {
        this.client = client;
        this.negotiator = negotiator;
        this.transportDefaults = transportDefaults;
    }

    /**
     * Resolves {@code descriptor} to working options and the kernel specs that pass
     * the context's filter.
     *
     * @throws GatewayException for transport failures and for a retry that fails again
     */
    public GatewayResolution resolve(ResolutionContext ctx, GatewayDescriptor descriptor) {
        ConnectionOptions options = seed(descriptor);
        List<KernelSpec> specs;
        try {
            specs = client.getKernelSpecs(options);
        } catch (GatewayException e) {
            if (ctx.isCancelled()) {
                log.debug("Discarding failure of '{}', resolution was cancelled: {}", descriptor.name(), e.getMessage());
                return new GatewayResolution.Cancelled();
            }
            if (e.getKind() == FailureKind.TRANSPORT) {
                throw e;
            }
            if (e.getKind() == FailureKind.TIMEOUT) {
                log.warn("Gateway '{}' timed out: {}", descriptor.name(), e.getMessage());
                return new GatewayResolution.Unreachable(e);
            }

            log.warn("Gateway '{}' rejected spec discovery ({}), asking for credentials",
                    descriptor.name(), e.getMessage());
            Negotiation negotiation = negotiator.negotiate(options, ctx.view());
            if (!negotiation.isApplied()) {
                return new GatewayResolution.Cancelled();
            }
            options = negotiation.options();
            ctx.view().showStatus(LOADING);
            try {
                specs = client.getKernelSpecs(options);
            } catch (GatewayException retryFailure) {
                if (ctx.isCancelled()) {
                    log.debug("Discarding retry failure of '{}', resolution was cancelled", descriptor.name());
                    return new GatewayResolution.Cancelled();
                }
                log.error("Gateway '{}' still failing after {}: {}",
                        descriptor.name(), negotiation.outcome(), retryFailure.getMessage());
                throw retryFailure;
            }
        }

        if (ctx.isCancelled()) {
            log.debug("Discarding specs of '{}', resolution was cancelled", descriptor.name());
            return new GatewayResolution.Cancelled();
        }

        List<KernelSpec> filtered = specs.stream().filter(ctx.specFilter()).toList();
        log.info("Gateway '{}' offers {} matching kernel specs (of {})",
                descriptor.name(), filtered.size(), specs.size());
        return new GatewayResolution.Resolved(options, filtered);
    }

    /**
     * The descriptor's options over the default transport hooks.
     */
    ConnectionOptions seed(GatewayDescriptor descriptor) {
        return descriptor.options().withDefaultTransport(
                transportDefaults.httpRequestFactory(), transportDefaults.webSocketFactory());
    }
}
