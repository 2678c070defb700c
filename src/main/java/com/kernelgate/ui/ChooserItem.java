package com.kernelgate.ui;

/**
 * One selectable entry of a {@link Chooser}.
 *
 * @param label text shown to the user and used for filtering
 * @param value the value the entry stands for
 */
public record ChooserItem<T>(String label, T value) {}
