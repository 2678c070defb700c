package com.kernelgate.gateway;

import com.kernelgate.core.model.FailureKind;

/**
 * Thrown by a {@link GatewayClient} when a gateway call fails.
 * The {@link FailureKind} is decided by the client that observed the failure.
 */
public class GatewayException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final FailureKind kind;
    private final int status;
    private final String payload;

    public GatewayException(FailureKind kind, int status, String payload, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
        this.payload = payload;
    }

    public GatewayException(FailureKind kind, int status, String payload, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.payload = payload;
    }

    public static GatewayException transport(String message, Throwable cause) {
        return new GatewayException(FailureKind.TRANSPORT, NO_STATUS, null, message, cause);
    }

    public FailureKind getKind() {
        return kind;
    }

    /** HTTP status of the failed call, or {@link #NO_STATUS}. */
    public int getStatus() {
        return status;
    }

    /** Failure payload as reported by the gateway or transport, may be null. */
    public String getPayload() {
        return payload;
    }
}
