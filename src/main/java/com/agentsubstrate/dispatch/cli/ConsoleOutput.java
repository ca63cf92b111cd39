package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.contract.PersistenceStatus;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the substrate CLI.
 * Errors go to stderr so stdout only carries command results.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENT SUBSTRATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SUBSTRATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void printResult(String agentName, AgentResult result, String details) {
        printBanner();
        if (result instanceof AgentResult.Success success) {
            DecisionEvent event = success.event();
            success(agentName + " produced " + event.decisionType());
            System.out.println("  Execution ref: " + event.executionRef());
            System.out.println("  Confidence:    " + String.format(Locale.ROOT, "%.2f", event.confidence()));
            System.out.println("  Constraints:   " + String.join(", ", event.constraintsApplied()));
            System.out.println("  Inputs hash:   " + event.inputsHash());
            System.out.println("  Ledger:        " + ledger(success.persistenceStatus()));
            if (details != null) {
                info(details);
            }
        } else if (result instanceof AgentResult.Failure failure) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [" + failure.errorCode() + "]|@ " + failure.errorMessage()));
            System.out.println("  Execution ref: " + failure.executionRef());
        }
    }

    private static String ledger(PersistenceStatus status) {
        if (status.status() == PersistenceStatus.Status.PERSISTED) {
            return CommandLine.Help.Ansi.AUTO.string("@|fg(green) persisted|@");
        }
        return CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) skipped|@")
                + (status.error() != null ? " (" + status.error() + ")" : "");
    }
}
