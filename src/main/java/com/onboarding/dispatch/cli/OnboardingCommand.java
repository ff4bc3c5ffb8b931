package com.onboarding.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: onboard, protocol, health, serve.
 */
@Command(
        name = "onboarding",
        mixinStandardHelpOptions = true,
        version = "Onboarding Coordinator 0.1.0",
        description = "Coordinates employee onboarding to projects",
        subcommands = {
                OnboardCommand.class,
                ProtocolCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OnboardingCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
