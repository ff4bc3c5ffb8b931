package com.onboarding.dispatch.cli;

import com.onboarding.core.engine.MissionEngine;
import com.onboarding.core.model.Mission;
import com.onboarding.core.model.MissionMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: onboarding onboard [--employee &lt;email&gt;] [--project &lt;id&gt;]
 * <p>
 * Runs one onboarding mission to completion and prints its outcome.
 * Exits with 0 when the mission completed and 1 otherwise.
 */
@Command(name = "onboard", mixinStandardHelpOptions = true, description = "Onboard an employee to a project")
@Component
public class OnboardCommand implements Callable<Integer> {

    @Option(names = {"--employee", "-e"}, description = "Employee id (corporate email)")
    private String employeeId;

    @Option(names = {"--project", "-p"}, description = "Project id")
    private String projectId;

    private final MissionEngine missionEngine;
    private final TriggerProperties triggerProperties;

    public OnboardCommand(MissionEngine missionEngine, TriggerProperties triggerProperties) {
        this.missionEngine = missionEngine;
        this.triggerProperties = triggerProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String employee = orDefault(employeeId, triggerProperties.getEmployeeId());
        String project = orDefault(projectId, triggerProperties.getProjectId());
        if (employee.isBlank() || project.isBlank()) {
            ConsoleOutput.error("Both --employee and --project are required (or set onboarding.trigger.*)");
            return 2;
        }

        ConsoleOutput.info("Onboarding " + employee + " to " + project + "...");
        Mission mission;
        try {
            mission = missionEngine.runMission(employee, project);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Mission could not run: " + e.getMessage());
            return 1;
        }

        ConsoleOutput.mission(mission);
        System.out.println();
        if (mission.mode() == MissionMode.COMPLETED) {
            ConsoleOutput.success("Mission complete.");
            return 0;
        }
        ConsoleOutput.error("Mission failed: " + mission.failureReason());
        return 1;
    }

    private static String orDefault(String value, String fallback) {
        if (value != null && !value.isBlank()) {
            return value;
        }
        return fallback != null ? fallback : "";
    }
}
