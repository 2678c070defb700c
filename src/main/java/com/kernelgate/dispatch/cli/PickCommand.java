package com.kernelgate.dispatch.cli;

import com.kernelgate.core.model.KernelSpecFilters;
import com.kernelgate.core.model.PickerOutcome;
import com.kernelgate.core.model.PickerState;
import com.kernelgate.core.picker.KernelPicker;
import com.kernelgate.core.picker.KernelPickerFactory;
import com.kernelgate.ui.DocumentContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * CLI command: kernelgate pick [--file PATH] [--language LANG]
 * <p>
 * Walks through gateway, session and kernel choice on the terminal, prints the
 * bound kernel and disconnects again.
 */
@Command(name = "pick", mixinStandardHelpOptions = true, description = "Pick a remote kernel and bind a session")
@Component
public class PickCommand implements Callable<Integer> {

    @Option(names = {"--file", "-f"}, description = "Document path the session is started for")
    private String file;

    @Option(names = {"--language", "-l"},
            description = "Document language; only kernels for it are offered",
            defaultValue = "python")
    private String language;

    @Option(names = {"--all-kernels"}, description = "Offer kernels of every language")
    private boolean allKernels;

    private final KernelPickerFactory pickerFactory;
    private final BufferedReader in;

    @Autowired
    public PickCommand(KernelPickerFactory pickerFactory) {
        this(pickerFactory, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    PickCommand(KernelPickerFactory pickerFactory, BufferedReader in) {
        this.pickerFactory = pickerFactory;
        this.in = in;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        KernelPicker picker = pickerFactory.create(
                new ConsoleChooser(in, System.out),
                new ConsolePrompter(in, System.out),
                new ConsoleFailureReporter(),
                DocumentContext.of(file, language),
                ConsoleOutput::resolved,
                Runnable::run);
        try {
            PickerOutcome outcome = picker.toggle(
                    allKernels ? KernelSpecFilters.any() : KernelSpecFilters.forLanguage(language)).join();
            outcome.resolvedKernel().ifPresent(kernel -> kernel.session().close());
            if (outcome.state() == PickerState.CANCELLED) {
                ConsoleOutput.info("Cancelled.");
            }
            return exitCode(outcome.state());
        } finally {
            picker.destroy();
        }
    }

    static int exitCode(PickerState state) {
        return switch (state) {
            case DONE -> 0;
            case FAILED -> 1;
            default -> 2;
        };
    }
}
