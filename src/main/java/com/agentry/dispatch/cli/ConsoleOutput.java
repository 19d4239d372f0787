package com.agentry.dispatch.cli;

import com.agentry.core.model.BatchResult;
import com.agentry.core.model.ExecutionResult;
import com.agentry.core.model.RecipeResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Agentry CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTRY v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTRY]|@ " + message));
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

    public static void agent(String agentName, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + agentName + "]|@ " + message));
    }

    public static void result(ExecutionResult result) {
        long ms = result.metrics() != null ? result.metrics().durationMs() : 0;
        if (result.success()) {
            success(result.agentName() + " completed in " + ms + "ms");
        } else {
            String kind = result.errorKind() != null ? result.errorKind().code() : "error";
            error(result.agentName() + " failed (" + kind + ") after " + ms + "ms: " + result.error());
        }
    }

    public static void batch(BatchResult batch) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Batch|@ " + batch.total() + " tasks: @|fg(green) " + batch.successful()
                        + " succeeded|@" + (batch.failed() > 0 ? ", @|fg(red) " + batch.failed() + " failed|@" : "")));
        for (ExecutionResult r : batch.results()) {
            result(r);
        }
    }

    public static void recipe(RecipeResult recipe) {
        System.out.println(RULE);
        String status = recipe.success() ? "@|fg(green) SUCCESS|@" : "@|fg(red) FAILED|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Recipe " + recipe.recipeName() + "|@ " + status + " "
                        + recipe.stepsCompleted() + "/" + recipe.stepsTotal() + " steps in " + recipe.durationMs() + "ms"));
        for (String e : recipe.errors()) {
            error("  " + e);
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
