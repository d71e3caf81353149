package com.celesteos.dispatch.cli;

import com.celesteos.core.model.Lane;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the celeste CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) CELESTE ROUTER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CELESTE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void lane(Lane lane, String reason) {
        String color = switch (lane) {
            case BLOCKED -> "fg(red),bold";
            case UNKNOWN -> "fg(yellow)";
            case NO_LLM -> "fg(green)";
            case RULES_ONLY -> "fg(blue)";
            case GPT -> "fg(magenta)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [" + lane + "]|@ " + reason));
    }

    public static void entity(String type, String value, String canonical, double confidence) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|fg(cyan) %-13s|@ %-24s -> %s (%.2f)", type, value, canonical, confidence)));
    }
}
