package com.plang.dispatch.cli;

import com.plang.core.engine.CompilationException;
import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.Diagnostic;
import com.plang.core.grammar.ParseException;
import com.plang.core.runtime.ExecutionTrace;
import com.plang.core.runtime.PolicyResult;
import com.plang.core.runtime.StageResult;
import com.plang.core.runtime.TerminalState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the PLang CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANG v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANG]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void diagnostic(Diagnostic diagnostic) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + diagnostic.format() + "|@"));
    }

    public static void stage(StageResult stage) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [STAGE " + stage.index() + "]|@ " + stage.phase()
                        + " net=" + actionLabel(stage.netAction()) + " steps=" + stage.steps()));
        for (PolicyResult result : stage.results()) {
            String status = result.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
            String line = "  " + status + " " + result.policy() + " -> " + actionLabel(result.action())
                    + " (" + result.steps() + " steps)";
            if (result.error() != null) {
                line += " @|fg(red) " + result.error() + "|@";
            }
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    public static void decision(ExecutionTrace trace) {
        System.out.println("──────────────────────────────────");
        String color = switch (trace.finalAction()) {
            case ALLOW -> "fg(green)";
            case ROUTE -> "fg(cyan)";
            case ESCALATE -> "fg(yellow)";
            case DENY -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold," + color + " " + trace.finalAction() + "|@ (" + trace.terminalState() + ", "
                        + trace.stagesExecuted() + "/" + trace.stageCount() + " stages, "
                        + trace.totalSteps() + " steps, " + formatDuration(trace.durationMs()) + ")"));
        if (trace.terminalState() != TerminalState.COMPLETED && trace.terminalState() != TerminalState.DENIED) {
            error("Run ended early: " + trace.terminalState());
        }
    }

    /**
     * Prints a front-end or scheduling failure and returns the exit code for it.
     */
    public static int failure(RuntimeException e) {
        if (e instanceof ParseException pe) {
            error("Syntax error");
            diagnostic(pe.getDiagnostic());
        } else if (e instanceof CompilationException ce) {
            error("Compilation failed");
            ce.getDiagnostics().forEach(ConsoleOutput::diagnostic);
        } else {
            error(e.getMessage());
        }
        return 1;
    }

    private static String actionLabel(ActionKind action) {
        return action != null ? action.name() : "-";
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
