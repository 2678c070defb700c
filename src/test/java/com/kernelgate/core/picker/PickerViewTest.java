package com.kernelgate.core.picker;

import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;
import com.kernelgate.ui.Prompter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PickerViewTest {

    private ScriptedChooser chooser;
    private Prompter prompter;
    private PickerView view;

    private final List<ChooserItem<Integer>> items = List.of(
            new ChooserItem<>("one", 1),
            new ChooserItem<>("two", 2));

    @BeforeEach
    void setUp() {
        chooser = new ScriptedChooser();
        prompter = mock(Prompter.class);
        view = new PickerView(chooser, prompter);
    }

    @Test
    void returnsConfirmedValue() {
        chooser.pick("two");

        assertEquals(Optional.of(2), view.choose(items, ChooserMessages.NONE));
        assertEquals(List.of("one", "two"), chooser.lastUpdate().labels());
        assertFalse(view.isCancelled());
    }

    @Test
    void dismissCancelsTheWholeView() {
        chooser.dismiss();

        assertEquals(Optional.empty(), view.choose(items, ChooserMessages.NONE));
        assertTrue(view.isCancelled());
        assertEquals(Optional.empty(), view.choose(items, ChooserMessages.NONE));
        assertEquals(1, chooser.shown().size());
    }

    @Test
    void statusIsDroppedOnceCancelled() {
        view.showStatus(ChooserMessages.loading("Loading", null));
        view.cancel();
        view.showStatus(ChooserMessages.loading("Loading again", null));

        assertEquals(1, chooser.updates().size());
        assertTrue(chooser.lastUpdate().labels().isEmpty());
    }

    @Test
    void promptHidesChooserAndReturnsAnswer() {
        when(prompter.prompt("Token:")).thenReturn(Optional.of("abc"));

        assertEquals(Optional.of("abc"), view.promptForText("Token:"));
        assertEquals(1, chooser.cancelCount());
        assertFalse(view.isCancelled());
    }

    @Test
    void emptyPromptAnswerCancels() {
        when(prompter.prompt("Token:")).thenReturn(Optional.of(""));

        assertEquals(Optional.empty(), view.promptForText("Token:"));
        assertTrue(view.isCancelled());
    }

    @Test
    void noPromptAfterCancel() {
        view.cancel();

        assertEquals(Optional.empty(), view.promptForText("Token:"));
        verifyNoInteractions(prompter);
    }

    @Test
    void destroyReleasesChooser() {
        view.destroy();

        assertTrue(view.isCancelled());
        assertEquals(1, chooser.destroyCount());
    }
}
