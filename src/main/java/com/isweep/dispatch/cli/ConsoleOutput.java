package com.isweep.dispatch.cli;

import com.isweep.core.model.Decision;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the ISweep CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ISWEEP v1.0.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ISWEEP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void decision(Decision decision) {
        String color = decision.isMatch() ? "fg(red)" : "fg(green)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Action:   @|bold," + color + " " + decision.action().wireName() + "|@"));
        System.out.println("  Duration: " + decision.durationSeconds() + "s");
        System.out.println("  Category: " + (decision.isMatch() ? decision.matchedCategory().wireName() : "-"));
        System.out.println("  Reason:   " + decision.reason());
    }
}
