package com.provenant.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Provenant.
 */
@Command(
        name = "provenant",
        mixinStandardHelpOptions = true,
        version = "Provenant 0.1.0",
        description = "Reproducible-build verification and quorum-authorized signing",
        subcommands = {
                ServeCommand.class,
                VerifyCommand.class,
                AuditVerifyCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ProvenantCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
