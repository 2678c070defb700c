package com.kernelgate.core.auth;

import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.NegotiationOutcome;

/**
 * Result of one negotiation round.
 *
 * @param outcome which strategy was applied, or CANCELLED
 * @param options the options to retry with; the unchanged input when cancelled
 */
public record Negotiation(NegotiationOutcome outcome, ConnectionOptions options) {

    public static Negotiation cancelled(ConnectionOptions options) {
        return new Negotiation(NegotiationOutcome.CANCELLED, options);
    }

    public boolean isApplied() {
        return outcome != NegotiationOutcome.CANCELLED;
    }
}
