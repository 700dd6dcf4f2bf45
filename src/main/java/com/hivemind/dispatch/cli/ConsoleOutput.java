package com.hivemind.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Hivemind CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) HIVEMIND v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [HIVEMIND]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agentState(String agentId, String state, int loopCount) {
        String color = switch (state) {
            case "system_halt" -> "fg(red)";
            case "responding", "looping" -> "fg(blue)";
            default -> "fg(green)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + agentId + "|@ @|" + color + " " + state + "|@ (loops: " + loopCount + ")"));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
