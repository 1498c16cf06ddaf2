package com.isweep.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for ISweep.
 * Routes to subcommands: serve, analyze, health.
 */
@Command(
        name = "isweep",
        mixinStandardHelpOptions = true,
        version = "ISweep 1.0.0",
        description = "Playback decision engine for caption and transcript filtering",
        subcommands = {
                ServeCommand.class,
                AnalyzeCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class IsweepCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
