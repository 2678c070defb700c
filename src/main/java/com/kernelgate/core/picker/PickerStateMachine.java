package com.kernelgate.core.picker;

import com.kernelgate.core.model.PickerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.kernelgate.core.model.PickerState.*;

/**
 * Tracks the state of one resolution and rejects transitions outside the table below.
 * CANCELLED is reachable from every non-terminal state.
 */
public class PickerStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PickerStateMachine.class);

    private static final Map<PickerState, Set<PickerState>> TRANSITIONS = new EnumMap<>(PickerState.class);

    static {
        TRANSITIONS.put(IDLE, EnumSet.of(GATEWAY_SELECTION));
        TRANSITIONS.put(GATEWAY_SELECTION, EnumSet.of(SPEC_DISCOVERY));
        TRANSITIONS.put(SPEC_DISCOVERY, EnumSet.of(SESSION_LISTING, FAILED));
        TRANSITIONS.put(SESSION_LISTING, EnumSet.of(KERNEL_SELECTION, CONNECTING, FAILED));
        TRANSITIONS.put(KERNEL_SELECTION, EnumSet.of(CONNECTING));
        TRANSITIONS.put(CONNECTING, EnumSet.of(DONE, FAILED));
        TRANSITIONS.put(DONE, EnumSet.noneOf(PickerState.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(PickerState.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(PickerState.class));
    }

    private final List<PickerState> history = new ArrayList<>(List.of(IDLE));
    private PickerState state = IDLE;

    public static boolean canTransition(PickerState from, PickerState to) {
        if (to == CANCELLED) {
            return !from.isTerminal();
        }
        return TRANSITIONS.get(from).contains(to);
    }

    public synchronized PickerState state() {
        return state;
    }

    public synchronized boolean canTransitionTo(PickerState next) {
        return canTransition(state, next);
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current state
     */
    public synchronized void transition(PickerState next) {
        if (!canTransition(state, next)) {
            throw new IllegalStateException("Illegal picker transition " + state + " -> " + next);
        }
        log.debug("Picker state {} -> {}", state, next);
        state = next;
        history.add(next);
    }

    public synchronized List<PickerState> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }
}
