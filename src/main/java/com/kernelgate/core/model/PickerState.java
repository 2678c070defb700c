package com.kernelgate.core.model;

/**
 * States of one kernel-picker resolution.
 * <pre>
 * IDLE → GATEWAY_SELECTION → SPEC_DISCOVERY → SESSION_LISTING → KERNEL_SELECTION → CONNECTING → DONE
 *                                                             └──────────────────→ CONNECTING
 * any non-terminal state → CANCELLED
 * SPEC_DISCOVERY | SESSION_LISTING | CONNECTING → FAILED
 * </pre>
 */
public enum PickerState {
    IDLE,
    GATEWAY_SELECTION,
    SPEC_DISCOVERY,
    SESSION_LISTING,
    KERNEL_SELECTION,   // only on the new-session path
    CONNECTING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
