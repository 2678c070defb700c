package com.kernelgate.core.model;

import java.util.Objects;

/**
 * One installable kernel type as reported by a gateway at discovery time.
 *
 * @param name        the kernel name used to start sessions (e.g. "python3")
 * @param displayName the human-facing name shown in the chooser
 * @param language    the kernel language, or null when the gateway omits it
 */
public record KernelSpec(String name, String displayName, String language) {

    public KernelSpec {
        Objects.requireNonNull(name, "name");
        if (displayName == null || displayName.isBlank()) {
            displayName = name;
        }
    }
}
