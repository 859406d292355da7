package com.boarddb.dispatch.cli;

import com.boarddb.config.BoardDbProperties;
import com.boarddb.core.database.OutputFreshnessChecker;
import com.boarddb.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: boarddb check
 * <p>
 * Reports whether the board database is up to date without touching it.
 * Exits with 0 when it is, 1 when it is missing or stale.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Check whether the board database is up to date")
@Component
public class CheckCommand implements Callable<Integer> {

    @Mixin
    private TreeOptions tree = new TreeOptions();

    private final OutputFreshnessChecker checker;
    private final BoardDbProperties properties;

    public CheckCommand(OutputFreshnessChecker checker, BoardDbProperties properties) {
        this.checker = checker;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("check");
        try {
            Path output = tree.output(properties);
            if (checker.isUpToDate(output, tree.configDir(properties), tree.srcDir(properties))) {
                ConsoleOutput.success(output + " is up to date");
                return 0;
            }
            ConsoleOutput.error(output + " is missing or out of date");
            return 1;
        } finally {
            MdcContext.clear();
        }
    }
}
