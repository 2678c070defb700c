package com.kernelgate.ui;

/**
 * Shows a failure to the user. Fire-and-forget.
 */
public interface FailureReporter {

    void reportFailure(String title, String description);

    default void reportFailure(String title) {
        reportFailure(title, null);
    }
}
