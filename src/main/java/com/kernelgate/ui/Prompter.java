package com.kernelgate.ui;

import java.util.Optional;

/**
 * Collects one line of free text from the user.
 */
public interface Prompter {

    /**
     * @param label prompt shown to the user, e.g. "Token:"
     * @return the text entered, or empty when the user cancelled
     */
    Optional<String> prompt(String label);
}
