package com.testall.cli;

import com.testall.core.model.ExecutionSummary;
import com.testall.core.model.Project;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the testall CLI.
 */
public class ConsoleOutput {

    static final String RULE = "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Running Tests Across All Applications|@"));
        System.out.println(RULE);
        System.out.println();
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) i|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) ✓ " + message + "|@"));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) ✗ " + message + "|@"));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) ⚠ " + message + "|@"));
    }

    public static void project(Project project) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + project.displayName() + "|@ @|faint (" + project.platform().tag() + ")|@"));
    }

    public static void progress(ExecutionSummary summary) {
        String name = summary.project().displayName();
        String duration = formatDuration(summary.elapsedMs());
        switch (summary.status()) {
            case SUCCEEDED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) PASSED   |@ " + name + " @|faint (" + duration + ")|@"));
            case FAILED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) FAILED   |@ " + name + exitSuffix(summary) + " @|faint (" + duration + ")|@"));
            case CANCELLED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) CANCELLED|@ " + name));
            case TIMED_OUT -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) TIMED OUT|@ " + name + " @|faint (" + duration + ")|@"));
            default -> System.out.println("  " + summary.status() + " " + name);
        }
    }

    /** Prints captured adapter output verbatim, without ANSI interpretation. */
    public static void log(String content) {
        System.out.println(RULE);
        if (content == null || content.isEmpty()) {
            System.out.println("(no output captured)");
        } else {
            System.out.print(content);
            if (!content.endsWith("\n")) {
                System.out.println();
            }
        }
        System.out.println(RULE);
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String exitSuffix(ExecutionSummary summary) {
        return summary.exitCode() != null ? " [exit " + summary.exitCode() + "]" : "";
    }
}
