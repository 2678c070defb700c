package com.kernelgate.dispatch.cli;

import com.kernelgate.ui.FailureReporter;

/**
 * Prints failures in the CLI's colors.
 */
public class ConsoleFailureReporter implements FailureReporter {

    @Override
    public void reportFailure(String title, String description) {
        ConsoleOutput.error(title);
        if (description != null) {
            System.out.println("  " + description);
        }
    }
}
