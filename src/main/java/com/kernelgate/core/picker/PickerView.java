package com.kernelgate.core.picker;

import com.kernelgate.ui.Chooser;
import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;
import com.kernelgate.ui.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns the callback-based {@link Chooser} and the {@link Prompter} into calls the
 * resolution thread can wait on.
 *
 * <p>At most one choice is outstanding at a time. A user cancel completes the
 * outstanding choice with nothing and marks the whole view cancelled: every later
 * {@link #choose} or {@link #promptForText} returns empty without showing anything.
 */
public class PickerView {

    private static final Logger log = LoggerFactory.getLogger(PickerView.class);

    private final Chooser chooser;
    private final Prompter prompter;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile CompletableFuture<Optional<ChooserItem<?>>> pending;

    public PickerView(Chooser chooser, Prompter prompter) {
        this.chooser = chooser;
        this.prompter = prompter;
        chooser.setOnConfirm(this::confirmed);
        chooser.setOnCancel(this::cancel);
    }

    /**
     * Shows {@code items} and waits for the user to confirm one.
     *
     * @return the confirmed item's value, or empty when the user cancelled
     */
    public <T> Optional<T> choose(List<ChooserItem<T>> items, ChooserMessages messages) {
        if (cancelled.get()) {
            return Optional.empty();
        }
        var future = new CompletableFuture<Optional<ChooserItem<?>>>();
        pending = future;
        if (cancelled.get()) {
            pending = null;
            return Optional.empty();
        }
        chooser.update(items, messages);
        chooser.show();
        Optional<ChooserItem<?>> confirmed = future.join();
        pending = null;
        if (confirmed.isEmpty()) {
            return Optional.empty();
        }
        for (ChooserItem<T> item : items) {
            if (item == confirmed.get()) {
                return Optional.ofNullable(item.value());
            }
        }
        throw new IllegalStateException("Confirmed item '" + confirmed.get().label()
                + "' is not one of the items on display");
    }

    /**
     * Replaces the chooser contents with status messages only.
     */
    public void showStatus(ChooserMessages messages) {
        if (!cancelled.get()) {
            chooser.update(List.of(), messages);
        }
    }

    /**
     * Hides the chooser and asks for free text. An empty or cancelled answer
     * cancels the whole view and leaves the chooser hidden.
     */
    public Optional<String> promptForText(String label) {
        if (cancelled.get()) {
            return Optional.empty();
        }
        chooser.cancel();
        Optional<String> answer = prompter.prompt(label).filter(text -> !text.isEmpty());
        if (answer.isEmpty()) {
            log.debug("Prompt '{}' cancelled", label);
            cancelled.set(true);
        }
        return answer;
    }

    public void hide() {
        chooser.cancel();
    }

    /**
     * Cancels the view: the outstanding choice, if any, resolves with nothing.
     */
    public void cancel() {
        cancelled.set(true);
        var future = pending;
        if (future != null) {
            future.complete(Optional.empty());
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void destroy() {
        cancel();
        chooser.destroy();
    }

    private void confirmed(ChooserItem<?> item) {
        var future = pending;
        if (future == null) {
            log.debug("Ignoring confirmation of '{}' with no choice outstanding", item.label());
            return;
        }
        future.complete(Optional.of(item));
    }
}
