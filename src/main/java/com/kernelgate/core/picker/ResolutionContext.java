package com.kernelgate.core.picker;

import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.PickerState;

import java.util.function.Predicate;

/**
 * Per-resolution state shared by the orchestrator and the resolvers it drives.
 * Owned by exactly one resolution; never shared across {@code toggle()} calls.
 */
public class ResolutionContext {

    private final String id;
    private final PickerView view;
    private final PickerStateMachine machine;
    private final String sessionPath;
    private final Predicate<KernelSpec> specFilter;
    private volatile String gatewayName;

    public ResolutionContext(String id, PickerView view, PickerStateMachine machine,
                             String sessionPath, Predicate<KernelSpec> specFilter) {
        this.id = id;
        this.view = view;
        this.machine = machine;
        this.sessionPath = sessionPath;
        this.specFilter = specFilter;
    }

    public String id() { return id; }
    public PickerView view() { return view; }
    public PickerStateMachine machine() { return machine; }
    public String sessionPath() { return sessionPath; }
    public Predicate<KernelSpec> specFilter() { return specFilter; }
    public String gatewayName() { return gatewayName; }

    void setGatewayName(String gatewayName) {
        this.gatewayName = gatewayName;
    }

    public PickerState state() {
        return machine.state();
    }

    public void transition(PickerState next) {
        machine.transition(next);
    }

    public boolean isCancelled() {
        return view.isCancelled();
    }
}
