package com.onboarding.dispatch.cli;

import com.onboarding.core.model.Mission;
import com.onboarding.core.model.StepResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the onboarding CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ONBOARDING COORDINATOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ONBOARDING]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void step(StepResult result) {
        String status = switch (result.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS|@";
            case SKIPPED -> "@|fg(yellow) SKIPPED|@";
            case FAILURE -> "@|fg(red) FAILURE|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [STEP " + result.stepIndex() + "]|@ " + status + " " + result.kind()
                        + " (" + result.elapsedMs() + "ms) " + result.detail()));
    }

    public static void mission(Mission mission) {
        System.out.println();
        System.out.println("MISSION " + mission.missionId());
        System.out.println("Trace:    " + mission.traceId());
        System.out.println("Employee: " + mission.employeeId());
        System.out.println("Project:  " + mission.projectId());
        System.out.println("Modes:    " + String.join(" -> ",
                mission.modes().stream().map(Enum::name).toList()));
        if (mission.protocolVersion() != null) {
            System.out.println("Protocol: v" + mission.protocolVersion() + " (" + mission.stepCount() + " steps)");
        }
        if (mission.assignmentVerdict() != null) {
            var verdict = mission.assignmentVerdict();
            System.out.println("Role:     " + verdict.role() + (verdict.authorized() ? "" : " (not authorized)"));
        }
        if (!mission.stepResults().isEmpty()) {
            System.out.println();
            mission.stepResults().forEach(ConsoleOutput::step);
        }
        if (!mission.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + mission.errors().size() + "):");
            for (String e : mission.errors()) {
                ConsoleOutput.error("  " + e);
            }
        }
    }
}
