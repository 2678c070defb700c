package com.kernelgate.core.model;

/**
 * Result tag of one credential negotiation round.
 */
public enum NegotiationOutcome {
    TOKEN_APPLIED,
    COOKIE_APPLIED,
    CANCELLED
}
