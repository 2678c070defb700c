package com.kernelgate.dispatch.cli;

import com.kernelgate.ui.Prompter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Reads one line of text from the terminal. End of input counts as cancel.
 */
public class ConsolePrompter implements Prompter {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Optional<String> prompt(String label) {
        out.print(label + " ");
        out.flush();
        try {
            return Optional.ofNullable(in.readLine()).map(String::trim);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read answer from terminal", e);
        }
    }
}
