package com.boarddb.dispatch.cli;

import com.boarddb.config.BoardDbProperties;
import com.boarddb.core.engine.BoardDatabaseService;
import com.boarddb.core.engine.BuildOutcome;
import com.boarddb.core.engine.BuildRequest;
import com.boarddb.core.logging.MdcContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: boarddb build
 * <p>
 * Regenerates the board database when any defconfig, Kconfig or MAINTAINERS
 * file changed since it was written. Exits with 1 when warnings were raised;
 * the database is written either way.
 */
@Command(name = "build", mixinStandardHelpOptions = true, description = "Generate the board database if needed")
@Component
public class BuildCommand implements Callable<Integer> {

    @Mixin
    private TreeOptions tree = new TreeOptions();

    @Option(names = {"--jobs", "-j"}, description = "Number of scan workers (default: boarddb.jobs)")
    private Integer jobs;

    @Option(names = {"--force", "-f"}, description = "Regenerate even if the database is up to date")
    private boolean force;

    @Option(names = {"--quiet", "-q"}, description = "Print nothing when there is nothing to do")
    private boolean quiet;

    @Option(names = {"--warn-targets"}, description = "Warn about missing or duplicate TARGET_xxx options")
    private boolean warnTargets;

    private final BoardDatabaseService service;
    private final BoardDbProperties properties;

    public BuildCommand(BoardDatabaseService service, BoardDbProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    @Override
    public Integer call() throws Exception {
        MdcContext.setCommand("build");
        try {
            Path output = tree.output(properties);
            var request = new BuildRequest(
                    output,
                    tree.configDir(properties),
                    tree.srcDir(properties),
                    jobs != null ? jobs : properties.getJobs(),
                    force,
                    warnTargets || properties.isWarnTargets());

            BuildOutcome outcome = service.ensureBoardList(request);
            if (!outcome.regenerated()) {
                if (!quiet) {
                    ConsoleOutput.info(output + " is up to date. Nothing to do.");
                }
                return 0;
            }
            ConsoleOutput.warnings(outcome.warnings());
            if (!quiet) {
                ConsoleOutput.success("Wrote " + outcome.boardCount() + " boards to " + output);
            }
            return outcome.ok() ? 0 : 1;
        } finally {
            MdcContext.clear();
        }
    }
}
