package com.onboarding.dispatch.cli;

import com.onboarding.core.CollaboratorUnreachableException;
import com.onboarding.core.model.MissionContext;
import com.onboarding.core.protocol.ProtocolStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: onboarding protocol &lt;project-id&gt;
 * <p>
 * Prints the current protocol of a project.
 */
@Command(name = "protocol", mixinStandardHelpOptions = true, description = "Show a project's onboarding protocol")
@Component
public class ProtocolCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final ProtocolStore protocolStore;

    public ProtocolCommand(ProtocolStore protocolStore) {
        this.protocolStore = protocolStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var protocol = protocolStore.get(projectId, MissionContext.administrative("cli", projectId));
            if (protocol.isEmpty()) {
                ConsoleOutput.error("No protocol stored for " + projectId);
                return 1;
            }
            var p = protocol.get();
            System.out.println();
            System.out.println("PROTOCOL " + p.projectId() + " v" + p.version());
            System.out.println("Created by " + p.createdBy() + " at " + p.createdAt());
            System.out.println();
            for (int i = 0; i < p.steps().size(); i++) {
                var step = p.steps().get(i);
                System.out.printf("  %d. [%-16s] %s%s %s%n", i, step.kind(), step.targetSystem(),
                        step.fatalOnFailure() ? " (fatal)" : "", step.parameters());
            }
            return 0;
        } catch (CollaboratorUnreachableException e) {
            ConsoleOutput.error("Protocol store unavailable: " + e.getMessage());
            return 1;
        }
    }
}
