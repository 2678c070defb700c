package com.kernelgate.core.model;

/**
 * Classification of a failed gateway call, computed once at the client boundary.
 */
public enum FailureKind {
    /** The gateway did not answer in time; treated as unreachable. */
    TIMEOUT,
    /** The gateway answered with an explicit permission-denied status. */
    PERMISSION_DENIED,
    /** The gateway answered with some other failure payload (possibly an auth problem). */
    STRUCTURED,
    /** No gateway payload at all: a transport or programming error. */
    TRANSPORT
}
