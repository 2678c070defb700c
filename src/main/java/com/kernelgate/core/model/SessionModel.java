package com.kernelgate.core.model;

import java.util.Optional;

/**
 * A running session reported by a gateway's session listing.
 *
 * @param id           session id
 * @param path         session path, may be null
 * @param notebookPath legacy notebook path, may be null
 * @param kernel       the kernel bound to the session, may be null
 */
public record SessionModel(String id, String path, String notebookPath, KernelModel kernel) {

    /**
     * Returns the kernel name when the gateway reported one.
     */
    public Optional<String> kernelName() {
        if (kernel == null || kernel.name() == null || kernel.name().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(kernel.name());
    }
}
