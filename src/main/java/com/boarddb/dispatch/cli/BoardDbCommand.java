package com.boarddb.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for boarddb.
 * Routes to subcommands: build, check, select.
 */
@Command(
        name = "boarddb",
        mixinStandardHelpOptions = true,
        version = "boarddb 0.1.0",
        description = "Generates and queries the board database of a Kconfig-based source tree",
        subcommands = {
                BuildCommand.class,
                CheckCommand.class,
                SelectCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BoardDbCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
