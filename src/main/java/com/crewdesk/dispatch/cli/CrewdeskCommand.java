package com.crewdesk.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Crewdesk.
 */
@Command(
        name = "crewdesk",
        mixinStandardHelpOptions = true,
        version = "Crewdesk 0.1.0",
        description = "Serial task dispatch for budgeted specialist agent teams",
        subcommands = {
                SubmitCommand.class,
                StatusCommand.class,
                QueueCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CrewdeskCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
