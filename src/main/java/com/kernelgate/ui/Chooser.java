package com.kernelgate.ui;

import java.util.List;
import java.util.function.Consumer;

/**
 * A selection list the user picks one item from.
 *
 * <p>Callbacks may fire on any thread. {@link #cancel()} only hides the chooser;
 * the cancel callback fires when the <em>user</em> dismisses it.
 */
public interface Chooser {

    /**
     * Replaces the items and status messages.
     */
    void update(List<? extends ChooserItem<?>> items, ChooserMessages messages);

    void setOnConfirm(Consumer<ChooserItem<?>> onConfirm);

    void setOnCancel(Runnable onCancel);

    void show();

    /**
     * Hides the chooser and restores whatever had focus before it.
     */
    void cancel();

    void destroy();
}
