package com.kernelgate.ui;

import java.util.Optional;

/**
 * The document a kernel is being picked for.
 */
public interface DocumentContext {

    /** Path of the document, empty when it has never been saved. */
    Optional<String> filePath();

    /** Language of the document, empty when none is active. */
    Optional<String> language();

    static DocumentContext of(String filePath, String language) {
        return new DocumentContext() {
            @Override
            public Optional<String> filePath() {
                return Optional.ofNullable(filePath);
            }

            @Override
            public Optional<String> language() {
                return Optional.ofNullable(language);
            }
        };
    }
}
