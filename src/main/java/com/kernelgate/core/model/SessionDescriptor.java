package com.kernelgate.core.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One entry of the session chooser: either an existing session to attach to,
 * or the synthetic "new session" entry.
 */
public sealed interface SessionDescriptor permits SessionDescriptor.Bound, SessionDescriptor.Unbound {

    String label();

    ConnectionOptions options();

    /**
     * Exhaustive dispatch over both shapes.
     */
    <R> R fold(Function<Bound, R> onBound, Function<Unbound, R> onUnbound);

    /**
     * An existing running session.
     */
    record Bound(String label, SessionModel session, ConnectionOptions options) implements SessionDescriptor {

        public Bound {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(options, "options");
        }

        @Override
        public <R> R fold(Function<Bound, R> onBound, Function<Unbound, R> onUnbound) {
            return onBound.apply(this);
        }
    }

    /**
     * A session still to be started with one of {@code kernelSpecs}.
     */
    record Unbound(String label, List<KernelSpec> kernelSpecs, ConnectionOptions options) implements SessionDescriptor {

        public static final String NEW_SESSION_LABEL = "[new session]";

        public Unbound {
            kernelSpecs = List.copyOf(kernelSpecs);
            Objects.requireNonNull(options, "options");
        }

        public static Unbound newSession(List<KernelSpec> kernelSpecs, ConnectionOptions options) {
            return new Unbound(NEW_SESSION_LABEL, kernelSpecs, options);
        }

        @Override
        public <R> R fold(Function<Bound, R> onBound, Function<Unbound, R> onUnbound) {
            return onUnbound.apply(this);
        }
    }
}
