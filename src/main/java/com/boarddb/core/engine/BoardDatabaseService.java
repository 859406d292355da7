package com.boarddb.core.engine;

import com.boarddb.core.database.BoardDatabaseWriter;
import com.boarddb.core.database.OutputFreshnessChecker;
import com.boarddb.core.maintainers.MaintainersDatabase;
import com.boarddb.core.metrics.BoardDbMetrics;
import com.boarddb.core.model.BoardParams;
import com.boarddb.core.model.ScanReport;
import com.boarddb.core.scanner.ParallelScanOrchestrator;
import com.boarddb.core.scanner.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the board database: scans all defconfigs, merges in status and
 * maintainers from the MAINTAINERS files and writes the result.
 */
@Service
public class BoardDatabaseService {

    private static final Logger log = LoggerFactory.getLogger(BoardDatabaseService.class);

    static final String MAINTAINERS_FILE = "MAINTAINERS";

    /** MAINTAINERS files under this directory are test data, not ownership records. */
    private static final String SKIPPED_DIR = "tools/buildman";

    private final ParallelScanOrchestrator orchestrator;
    private final BoardDatabaseWriter writer;
    private final OutputFreshnessChecker freshnessChecker;
    private final BoardDbMetrics metrics;

    public BoardDatabaseService(ParallelScanOrchestrator orchestrator, BoardDatabaseWriter writer,
                                OutputFreshnessChecker freshnessChecker,
                                @Autowired(required = false) BoardDbMetrics metrics) {
        this.orchestrator = orchestrator;
        this.writer = writer;
        this.freshnessChecker = freshnessChecker;
        this.metrics = metrics;
    }

    /**
     * Generates the board database if it is missing or out of date.
     *
     * @param request what to build and where
     * @return whether the database was regenerated and the warnings raised
     * @throws IOException if a source tree cannot be read or the database cannot be written
     */
    public BuildOutcome ensureBoardList(BuildRequest request) throws IOException {
        if (!request.force()
                && freshnessChecker.isUpToDate(request.output(), request.configDir(), request.srcDir())) {
            log.info("{} is up to date", request.output());
            if (metrics != null) {
                metrics.recordEnsureResult(false);
            }
            return BuildOutcome.upToDate();
        }

        var built = buildBoardList(request.configDir(), request.srcDir(), request.jobs(), request.warnTargets());
        if (!built.warnings().isEmpty()) {
            log.warn("{} warning(s) while building {}", built.warnings().size(), request.output());
        }
        writer.write(built.params(), request.output());
        if (metrics != null) {
            metrics.recordEnsureResult(true);
        }
        return new BuildOutcome(true, built.params().size(), built.warnings());
    }

    /**
     * Scans the defconfigs and attaches status and maintainers to each board.
     *
     * @return the merged parameters; warnings are scan warnings followed by maintainer warnings
     */
    public ScanReport buildBoardList(Path configDir, Path srcDir, int jobs, boolean warnTargets) throws IOException {
        ScanReport scanned = orchestrator.scanAll(configDir, srcDir, jobs, warnTargets);
        var params = new ArrayList<>(scanned.params());
        List<String> maintainerWarnings = insertMaintainersInfo(srcDir, params);

        if (metrics != null) {
            metrics.recordWarnings("scan", scanned.warnings().size());
            metrics.recordWarnings("maintainers", maintainerWarnings.size());
        }

        var warnings = new ArrayList<String>(scanned.warnings());
        warnings.addAll(maintainerWarnings);
        return new ScanReport(params, warnings);
    }

    /**
     * Replaces each entry of {@code params} with a copy carrying its status and maintainers.
     *
     * @return sorted warnings about missing status or maintainers
     * @throws IOException if a MAINTAINERS file cannot be read
     */
    public List<String> insertMaintainersInfo(Path srcDir, List<BoardParams> params) throws IOException {
        var database = new MaintainersDatabase();
        for (Path file : findMaintainersFiles(srcDir)) {
            database.parseFile(srcDir, file);
        }
        log.info("Loaded status for {} targets from MAINTAINERS files", database.size());

        for (int i = 0; i < params.size(); i++) {
            BoardParams p = params.get(i);
            String maintainers = database.getMaintainers(p.target());
            String status = maintainers.isEmpty() ? BoardParams.UNSET : database.getStatus(p.target());
            params.set(i, p.withOwnership(status, maintainers));
        }
        return database.warnings().stream().sorted().toList();
    }

    static List<Path> findMaintainersFiles(Path srcDir) throws IOException {
        return SourceTree.regularFiles(srcDir,
                p -> MAINTAINERS_FILE.equals(p.getFileName().toString()) && !isSkipped(srcDir, p));
    }

    private static boolean isSkipped(Path srcDir, Path file) {
        Path dir = srcDir.relativize(file).getParent();
        return dir != null && dir.toString().replace('\\', '/').contains(SKIPPED_DIR);
    }
}
