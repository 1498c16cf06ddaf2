package com.isweep.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and reports
 * its exit code back to {@link org.springframework.boot.SpringApplication#exit}.
 * The {@code serve} subcommand is left to the embedded web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final String SERVE = "serve";

    private final IsweepCommand isweepCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(IsweepCommand isweepCommand, IFactory factory) {
        this.isweepCommand = isweepCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand, i.e. the first argument that is not an
     * option, is {@code serve}. {@code isweep analyze serve} is not serve mode.
     */
    public static boolean isServeCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE.equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeCommand(args)) {
            return;
        }
        exitCode = new CommandLine(isweepCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
