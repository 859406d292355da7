package com.boarddb.core.scanner;

import com.boarddb.core.model.BoardParams;
import com.boarddb.core.model.ScanReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ParallelScanOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path configDir() throws IOException {
        return Files.createDirectories(tempDir.resolve("configs"));
    }

    private void defconfig(String target, String content) throws IOException {
        Files.writeString(configDir().resolve(target + "_defconfig"), content);
    }

    private ParallelScanOrchestrator orchestrator() {
        return new ParallelScanOrchestrator(DefconfigEvaluator::new, Duration.ofMillis(30));
    }

    // ── Partitioning ─────────────────────────────────────────────────

    @Nested
    @DisplayName("partition")
    class Partition {

        @Test
        @DisplayName("shares are contiguous and cover every item once")
        void coversAll() {
            List<Integer> items = IntStream.range(0, 10).boxed().toList();
            List<List<Integer>> shares = ParallelScanOrchestrator.partition(items, 3);
            assertEquals(List.of(List.of(0, 1, 2), List.of(3, 4, 5), List.of(6, 7, 8, 9)), shares);
        }

        @Test
        @DisplayName("more jobs than items leaves some shares empty")
        void moreJobsThanItems() {
            List<List<String>> shares = ParallelScanOrchestrator.partition(List.of("a", "b"), 4);
            assertEquals(4, shares.size());
            assertEquals(List.of(List.of(), List.of("a"), List.of(), List.of("b")), shares);
        }

        @Test
        @DisplayName("a single job gets everything")
        void singleJob() {
            assertEquals(List.of(List.of("a", "b", "c")),
                    ParallelScanOrchestrator.partition(List.of("a", "b", "c"), 1));
        }
    }

    // ── Scanning ─────────────────────────────────────────────────────

    @Test
    @DisplayName("scans every defconfig exactly once with several jobs")
    void scansAllWithSeveralJobs() throws IOException {
        for (int i = 0; i < 25; i++) {
            defconfig("board" + i, "CONFIG_SYS_ARCH=\"arm\"\nCONFIG_SYS_BOARD=\"b" + i + "\"\n");
        }

        ScanReport report = orchestrator().scanAll(configDir(), tempDir, 4, false);

        assertEquals(25, report.params().size());
        var targets = report.params().stream().map(BoardParams::target).sorted().toList();
        var expected = IntStream.range(0, 25).mapToObj(i -> "board" + i).sorted().toList();
        assertEquals(expected, targets);
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    @DisplayName("ignores hidden files and files without the suffix")
    void ignoresHiddenAndOtherFiles() throws IOException {
        defconfig("visible", "");
        Files.writeString(configDir().resolve(".hidden_defconfig"), "");
        Files.writeString(configDir().resolve("README"), "");

        ScanReport report = orchestrator().scanAll(configDir(), tempDir, 2, false);

        assertEquals(List.of("visible"), report.params().stream().map(BoardParams::target).toList());
    }

    @Test
    @DisplayName("finds defconfigs in subdirectories")
    void findsNested() throws IOException {
        Path sub = Files.createDirectories(configDir().resolve("vendor"));
        Files.writeString(sub.resolve("deep_defconfig"), "");
        assertEquals(1, orchestrator().scanAll(configDir(), tempDir, 1, false).params().size());
    }

    @Test
    @DisplayName("warnings are de-duplicated and sorted")
    void warningsSortedAndUnique() throws IOException {
        defconfig("zeta", "");
        defconfig("alpha", "");

        ScanReport report = orchestrator().scanAll(configDir(), tempDir, 2, true);

        assertEquals(List.of(
                "WARNING: alpha_defconfig: No TARGET_ALPHA enabled",
                "WARNING: zeta_defconfig: No TARGET_ZETA enabled"), report.warnings());
    }

    @Test
    @DisplayName("empty configs directory yields an empty report")
    void emptyTree() throws IOException {
        ScanReport report = orchestrator().scanAll(configDir(), tempDir, 3, false);
        assertTrue(report.params().isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    @DisplayName("missing configs directory yields an empty report")
    void missingConfigDir() throws IOException {
        ScanReport report = orchestrator().scanAll(tempDir.resolve("configs"), tempDir, 2, false);
        assertTrue(report.params().isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    @DisplayName("rejects fewer than one job")
    void rejectsZeroJobs() throws IOException {
        Path dir = configDir();
        assertThrows(IllegalArgumentException.class, () -> orchestrator().scanAll(dir, tempDir, 0, false));
    }

    @Test
    @DisplayName("evaluator defaults reach every worker")
    void defaultsReachWorkers() throws IOException {
        defconfig("a", "");
        defconfig("b", "");
        var orchestrator = new ParallelScanOrchestrator(DefconfigEvaluator::new, Duration.ofMillis(30),
                Map.of("SYS_VENDOR", "acme"), null);

        ScanReport report = orchestrator.scanAll(configDir(), tempDir, 2, false);

        assertTrue(report.params().stream().allMatch(p -> "acme".equals(p.vendor())));
    }

    @Test
    @DisplayName("each worker closes its evaluator")
    void closesEvaluators() throws IOException {
        defconfig("a", "");
        defconfig("b", "");
        defconfig("c", "");
        var created = new AtomicInteger();
        var closed = new AtomicInteger();
        EvaluatorFactory factory = context -> {
            created.incrementAndGet();
            return new DefconfigEvaluator(context) {
                @Override
                public void close() {
                    closed.incrementAndGet();
                    super.close();
                }
            };
        };

        new ParallelScanOrchestrator(factory, Duration.ofMillis(30)).scanAll(configDir(), tempDir, 3, false);

        assertEquals(3, created.get());
        assertEquals(3, closed.get());
    }

    @Test
    @DisplayName("a failing worker leaves its share incomplete and reports it")
    void failingWorker() throws IOException {
        defconfig("a", "");
        defconfig("b", "");
        defconfig("c", "");
        defconfig("d", "");
        EvaluatorFactory factory = context -> new DefconfigEvaluator(context) {
            @Override
            public void load(Path fragment) throws IOException {
                if (fragment.getFileName().toString().startsWith("c")) {
                    throw new IOException("cannot read " + fragment.getFileName());
                }
                super.load(fragment);
            }
        };

        ScanReport report = new ParallelScanOrchestrator(factory, Duration.ofMillis(30))
                .scanAll(configDir(), tempDir, 2, false);

        // shares are [a, b] and [c, d]; the second worker stops at c
        assertEquals(List.of("a", "b"), report.params().stream().map(BoardParams::target).sorted().toList());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).contains("scan worker 1 failed"));
        assertTrue(report.warnings().get(0).contains("c_defconfig"));
    }

    @Test
    @DisplayName("a single worker reports fragments in sorted order")
    void singleWorkerKeepsOrder() throws IOException {
        for (String t : List.of("d", "b", "f", "a", "e", "c")) {
            defconfig(t, "");
        }

        ScanReport report = orchestrator().scanAll(configDir(), tempDir, 1, false);

        assertEquals(List.of("a", "b", "c", "d", "e", "f"),
                report.params().stream().map(BoardParams::target).toList());
    }

    @Test
    @DisplayName("rejects a non-positive poll interval")
    void rejectsZeroPollInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new ParallelScanOrchestrator(DefconfigEvaluator::new, Duration.ZERO));
    }
}
