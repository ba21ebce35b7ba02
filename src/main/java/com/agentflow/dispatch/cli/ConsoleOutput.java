package com.agentflow.dispatch.cli;

import com.agentflow.core.events.WorkflowEvent;
import com.agentflow.core.model.ExecutionSummary;
import com.agentflow.core.model.TaskResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Agentflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskResult(TaskResult result) {
        String status = result.isCompleted() ? "@|fg(green) DONE|@" : "@|fg(red) FAIL|@";
        String retries = result.retryCount() > 0 ? " (retries: " + result.retryCount() + ")" : "";
        String error = result.error() != null ? ": " + result.error() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + result.taskId() + retries + error));
    }

    public static void event(WorkflowEvent event) {
        String prefix = switch (event.type()) {
            case WORKFLOW_STARTED, WORKFLOW_RESUMED, WORKFLOW_PAUSED -> "@|fg(cyan) [WORKFLOW]|@";
            case WAVE_STARTED, WAVE_COMPLETED -> "@|bold,fg(yellow) [WAVE]|@";
            case TASK_STARTED, TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case TASK_RETRYING -> "@|fg(magenta) [RETRY]|@";
            case TASK_FAILED -> "@|fg(red) [TASK]|@";
            case WORKFLOW_COMPLETED, WORKFLOW_STOPPED -> "@|fg(green),bold [COMPLETE]|@";
            case WORKFLOW_FAILED -> "@|fg(red),bold [FAILED]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + subject + event.payload()));
    }

    public static void summary(ExecutionSummary s, int waves) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Workflow Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + s.total() + " total, @|fg(green) " + s.completed() + " completed|@, @|fg(red) "
                + s.failed() + " failed|@, " + s.pending() + " not run"));
        System.out.println("  Waves: " + waves);
        if (s.durationMs() != null) {
            System.out.println("  Duration: " + formatDuration(s.durationMs()));
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
