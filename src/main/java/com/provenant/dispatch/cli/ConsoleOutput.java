package com.provenant.dispatch.cli;

import com.provenant.core.model.ByteRangeDelta;
import com.provenant.core.model.DiffReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Provenant CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PROVENANT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PROVENANT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void diff(DiffReport report) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [DIFF]|@ " + report.leftDigest() + " vs " + report.rightDigest()
                        + " (" + report.leftSize() + " / " + report.rightSize() + " bytes)"));
        for (ByteRangeDelta delta : report.deltas()) {
            System.out.println("    offset " + delta.offset() + ", " + delta.length() + " byte(s)");
        }
        if (report.truncated()) {
            System.out.println("    ... truncated");
        }
    }
}
