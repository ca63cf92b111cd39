package com.agentsubstrate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to one subcommand per analytical agent plus the ledger query command.
 */
@Command(
        name = "substrate",
        mixinStandardHelpOptions = true,
        version = "Agent Substrate 0.1.0",
        description = "Stateless analytical agents that emit one decision event per run",
        subcommands = {
                DecomposeCommand.class,
                MetaReasonCommand.class,
                ClarifyCommand.class,
                ReflectCommand.class,
                EventsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SubstrateCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        spec.commandLine().usage(System.out);
    }
}
