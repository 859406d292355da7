package com.boarddb.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for board database generation.
 */
@Service
public class BoardDbMetrics {

    private final MeterRegistry registry;

    public BoardDbMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScanDuration(int jobs, long ms) {
        Timer.builder("boarddb.scan.duration")
                .tag("jobs", String.valueOf(jobs))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFragmentsScanned(int count) {
        Counter.builder("boarddb.fragments.scanned")
                .description("Defconfig fragments scanned")
                .register(registry)
                .increment(count);
    }

    /**
     * Records warnings raised while building the database.
     *
     * @param source "scan" or "maintainers"
     * @param count  number of warnings
     */
    public void recordWarnings(String source, int count) {
        Counter.builder("boarddb.warnings")
                .tag("source", source)
                .register(registry)
                .increment(count);
    }

    public void recordWorkerFailure() {
        Counter.builder("boarddb.scan.worker_failures")
                .description("Scan workers that stopped before finishing their share")
                .register(registry)
                .increment();
    }

    /**
     * @param regenerated true if the database was rewritten, false if it was already up to date
     */
    public void recordEnsureResult(boolean regenerated) {
        Counter.builder("boarddb.ensure.result")
                .tag("result", regenerated ? "regenerated" : "up_to_date")
                .register(registry)
                .increment();
    }
}
