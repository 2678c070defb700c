package com.kernelgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for kernelgate.
 * Routes to subcommands: pick, gateways.
 */
@Command(
        name = "kernelgate",
        mixinStandardHelpOptions = true,
        version = "kernelgate 0.1.0",
        description = "Connects to kernels on remote Jupyter gateways",
        subcommands = {
                PickCommand.class,
                GatewaysCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KernelGateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
