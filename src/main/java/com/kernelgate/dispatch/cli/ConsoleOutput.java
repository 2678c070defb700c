package com.kernelgate.dispatch.cli;

import com.kernelgate.core.model.GatewayDescriptor;
import com.kernelgate.core.model.ResolvedKernel;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the kernelgate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) KERNELGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [KERNELGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void gateway(GatewayDescriptor gateway) {
        String auth = gateway.options().token() != null ? " @|fg(yellow) [token]|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + gateway.name() + "|@ " + gateway.options().baseUrl() + auth));
    }

    public static void resolved(ResolvedKernel kernel) {
        success("Kernel bound");
        System.out.println("  Gateway:  " + kernel.gatewayName());
        System.out.println("  Kernel:   " + kernel.kernelSpec().displayName()
                + " (" + kernel.kernelSpec().name() + ")");
        System.out.println("  Language: " + kernel.language());
        System.out.println("  Session:  " + kernel.session().id());
    }
}
