package com.kernelgate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for kernel resolution.
 */
@Service
public class PickerMetrics {

    private final MeterRegistry registry;

    public PickerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordResolution(String outcome) {
        Counter.builder("kernelgate.resolutions.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordResolutionDuration(long ms) {
        Timer.builder("kernelgate.resolution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNegotiation(String outcome) {
        Counter.builder("kernelgate.negotiations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a gateway that refused to enumerate its sessions.
     */
    public void recordListingForbidden() {
        Counter.builder("kernelgate.sessions.listing_forbidden")
                .description("Session listings refused with permission denied")
                .register(registry)
                .increment();
    }
}
