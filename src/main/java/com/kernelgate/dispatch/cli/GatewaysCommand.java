package com.kernelgate.dispatch.cli;

import com.kernelgate.gateway.GatewayCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: kernelgate gateways
 * <p>
 * Lists the configured gateways.
 */
@Command(name = "gateways", mixinStandardHelpOptions = true, description = "List configured gateways")
@Component
public class GatewaysCommand implements Runnable {

    private final GatewayCatalog catalog;

    public GatewaysCommand(GatewayCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var gateways = catalog.listGateways();
        if (gateways.isEmpty()) {
            ConsoleOutput.error("No gateways configured. Set kernelgate.gateways in application.yml.");
            return;
        }
        ConsoleOutput.info(gateways.size() + " gateway" + (gateways.size() != 1 ? "s" : "") + " configured:");
        gateways.forEach(ConsoleOutput::gateway);
    }
}
