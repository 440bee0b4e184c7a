package com.parallax.dispatch.cli;

import com.parallax.core.events.JobEvent;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.JobStatus;
import com.parallax.core.model.TaskException;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Parallax CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PARALLAX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PARALLAX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void slot(int slot, int units, double load, String taskIds) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [SLOT " + slot + "]|@ " + units + " unit" + (units != 1 ? "s" : "")
                + ", load " + formatLoad(load) + ": " + taskIds));
    }

    public static void unit(int batchId, String taskIds, Double cost) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [UNIT " + batchId + "]|@ tasks " + taskIds
                + " cost " + (cost != null ? formatLoad(cost) : "?")));
    }

    public static void watchEvent(JobEvent event) {
        String prefix = switch (event.eventType()) {
            case JobEvent.JOB_SUBMITTED -> "@|fg(cyan) [JOB]|@";
            case JobEvent.BATCH_DISPATCHED, JobEvent.BATCH_COMPLETED -> "@|fg(blue) [BATCH]|@";
            case JobEvent.TASK_FAILED -> "@|fg(red) [TASK " + event.taskId() + "]|@";
            case JobEvent.JOB_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case JobEvent.JOB_CANCELLED -> "@|fg(yellow),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.eventType() + " " + event.payload()));
    }

    public static void jobSummary(JobResult<?> result, long elapsedMs) {
        System.out.println("──────────────────────────────────");
        String color = result.status() == JobStatus.COMPLETED ? "fg(green)"
                : result.status() == JobStatus.CANCELLED ? "fg(yellow)" : "fg(red)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Job " + result.jobId() + "|@ @|" + color + " " + result.status() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + result.taskCount() + ", @|fg(green) " + result.succeeded() + " succeeded|@, @|fg(red) "
                + result.failed() + " failed|@" + (result.notRun() > 0 ? ", " + result.notRun() + " not run" : "")));
        for (TaskException failure : result.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + failure.getMessage()));
        }
        System.out.println("  Duration: " + formatDuration(elapsedMs));
    }

    static String formatLoad(double load) {
        return load == Math.rint(load) ? String.valueOf((long) load) : String.format(Locale.ROOT, "%.2f", load);
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
