package com.hivemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Hivemind.
 * Routes to subcommands: run, status, health, slo, serve.
 */
@Command(
        name = "hivemind",
        mixinStandardHelpOptions = true,
        version = "Hivemind 0.1.0",
        description = "Coordinates swarms of specialized worker agents",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                SloCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HivemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
