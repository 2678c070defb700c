package com.kernelgate.core.model;

import java.util.function.Predicate;

/**
 * Common kernel spec filters.
 */
public final class KernelSpecFilters {

    private KernelSpecFilters() {}

    public static Predicate<KernelSpec> any() {
        return spec -> true;
    }

    /**
     * Specs whose language matches {@code language} (case-insensitive).
     * Specs that do not report a language are kept.
     */
    public static Predicate<KernelSpec> forLanguage(String language) {
        return spec -> spec.language() == null || spec.language().equalsIgnoreCase(language);
    }
}
