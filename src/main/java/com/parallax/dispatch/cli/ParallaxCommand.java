package com.parallax.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Parallax.
 * Routes to subcommands: run, plan.
 */
@Command(
        name = "parallax",
        mixinStandardHelpOptions = true,
        version = "Parallax 0.1.0",
        description = "Parallel task distribution engine",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ParallaxCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
