package com.celesteos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: classify, health, serve.
 */
@Command(
        name = "celeste",
        mixinStandardHelpOptions = true,
        version = "Celeste Router 0.1.0",
        description = "Lane routing and maritime entity extraction for crew queries",
        subcommands = {
                ClassifyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CelesteCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
