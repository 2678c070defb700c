package com.kernelgate.core.model;

import java.util.Optional;

/**
 * How one {@code toggle()} ended.
 *
 * @param state    terminal state, or IDLE when the picker never started
 * @param resolved the resolved kernel when {@code state == DONE}, otherwise null
 */
public record PickerOutcome(PickerState state, ResolvedKernel resolved) {

    public static PickerOutcome done(ResolvedKernel resolved) {
        return new PickerOutcome(PickerState.DONE, resolved);
    }

    public static PickerOutcome of(PickerState state) {
        return new PickerOutcome(state, null);
    }

    public Optional<ResolvedKernel> resolvedKernel() {
        return Optional.ofNullable(resolved);
    }
}
