package com.kernelgate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing kernelgate-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setResolution(String resolutionId) {
        MDC.put("resolutionId", resolutionId);
    }

    public static void setGateway(String resolutionId, String gatewayName) {
        MDC.put("resolutionId", resolutionId);
        MDC.put("gateway", gatewayName);
    }

    public static void clear() {
        MDC.remove("resolutionId");
        MDC.remove("gateway");
    }
}
