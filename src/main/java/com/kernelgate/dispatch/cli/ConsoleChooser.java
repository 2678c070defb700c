package com.kernelgate.dispatch.cli;

import com.kernelgate.ui.Chooser;
import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Line-oriented {@link Chooser} for the terminal: prints a numbered list and reads
 * the choice from input. A blank line, {@code q} or end of input cancels.
 *
 * <p>{@link #show()} blocks until the user answered, so the callbacks fire on the
 * calling thread.
 */
public class ConsoleChooser implements Chooser {

    private final BufferedReader in;
    private final PrintStream out;
    private List<ChooserItem<?>> items = List.of();
    private ChooserMessages messages = ChooserMessages.NONE;
    private Consumer<ChooserItem<?>> onConfirm = item -> {};
    private Runnable onCancel = () -> {};
    private boolean visible;

    public ConsoleChooser(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public void update(List<? extends ChooserItem<?>> items, ChooserMessages messages) {
        this.items = new ArrayList<>(items);
        this.messages = messages;
        if (messages.loading() != null) {
            out.println("... " + messages.loading());
        }
        if (messages.error() != null) {
            out.println("! " + messages.error());
        }
    }

    @Override
    public void setOnConfirm(Consumer<ChooserItem<?>> onConfirm) {
        this.onConfirm = onConfirm;
    }

    @Override
    public void setOnCancel(Runnable onCancel) {
        this.onCancel = onCancel;
    }

    @Override
    public void show() {
        visible = true;
        if (messages.info() != null) {
            out.println(messages.info());
        }
        if (items.isEmpty()) {
            if (messages.empty() != null) {
                out.println("  (" + messages.empty() + ")");
            }
            dismiss();
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            out.printf("  %d) %s%n", i + 1, items.get(i).label());
        }
        while (visible) {
            out.printf("Select [1-%d], blank to cancel: ", items.size());
            out.flush();
            String line = readLine();
            if (line == null || line.isBlank() || "q".equalsIgnoreCase(line.trim())) {
                dismiss();
                return;
            }
            int index = parseIndex(line.trim());
            if (index < 0) {
                out.println("Not a valid choice: " + line.trim());
                continue;
            }
            onConfirm.accept(items.get(index));
            return;
        }
    }

    @Override
    public void cancel() {
        visible = false;
    }

    @Override
    public void destroy() {
        cancel();
        items = List.of();
    }

    private void dismiss() {
        cancel();
        onCancel.run();
    }

    private int parseIndex(String text) {
        try {
            int choice = Integer.parseInt(text);
            return choice >= 1 && choice <= items.size() ? choice - 1 : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read choice from terminal", e);
        }
    }
}
