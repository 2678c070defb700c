package com.kernelgate.core.picker;

import com.kernelgate.core.metrics.PickerMetrics;
import com.kernelgate.core.model.ResolvedKernel;
import com.kernelgate.core.resolver.GatewayResolver;
import com.kernelgate.core.resolver.SessionResolver;
import com.kernelgate.gateway.GatewayCatalog;
import com.kernelgate.ui.Chooser;
import com.kernelgate.ui.DocumentContext;
import com.kernelgate.ui.FailureReporter;
import com.kernelgate.ui.Prompter;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Creates {@link KernelPicker}s bound to one set of UI collaborators.
 */
@Component
public class KernelPickerFactory {

    private final GatewayCatalog catalog;
    private final GatewayResolver gatewayResolver;
    private final SessionResolver sessionResolver;
    private final PickerMetrics metrics;

    public KernelPickerFactory(GatewayCatalog catalog, GatewayResolver gatewayResolver,
                               SessionResolver sessionResolver, PickerMetrics metrics) {
        this.catalog = catalog;
        this.gatewayResolver = gatewayResolver;
        this.sessionResolver = sessionResolver;
        this.metrics = metrics;
    }

    /**
     * A picker running its resolutions on the given executor.
     */
    public KernelPicker create(Chooser chooser, Prompter prompter, FailureReporter reporter,
                               DocumentContext document, Consumer<ResolvedKernel> onChosen,
                               Executor executor) {
        return new KernelPicker(catalog, gatewayResolver, sessionResolver, metrics,
                chooser, prompter, reporter, document, onChosen, executor, false);
    }

    /**
     * A picker running its resolutions on a dedicated background thread, which
     * {@link KernelPicker#destroy()} shuts down.
     */
    public KernelPicker create(Chooser chooser, Prompter prompter, FailureReporter reporter,
                               DocumentContext document, Consumer<ResolvedKernel> onChosen) {
        ExecutorService worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "kernel-picker");
            thread.setDaemon(true);
            return thread;
        });
        return new KernelPicker(catalog, gatewayResolver, sessionResolver, metrics,
                chooser, prompter, reporter, document, onChosen, worker, true);
    }
}
