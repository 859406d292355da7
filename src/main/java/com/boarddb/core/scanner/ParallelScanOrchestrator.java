package com.boarddb.core.scanner;

import com.boarddb.config.BoardDbProperties;
import com.boarddb.core.logging.MdcContext;
import com.boarddb.core.metrics.BoardDbMetrics;
import com.boarddb.core.model.BoardParams;
import com.boarddb.core.model.ScanOutcome;
import com.boarddb.core.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans all defconfig fragments of a source tree with a pool of workers.
 * <p>
 * The fragment list is cut into one contiguous share per job. Each worker owns
 * its evaluator and pushes every {@link ScanOutcome} onto its own result queue.
 * The coordinating thread keeps draining all queues, waiting at most the poll
 * interval between passes, until every worker has finished, and then drains
 * once more to pick up results delivered after the last pass.
 * <p>
 * A worker that fails stops scanning its share. The fragments it did not reach
 * are missing from the report and a warning names the worker.
 */
@Service
public class ParallelScanOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelScanOrchestrator.class);

    private final EvaluatorFactory evaluatorFactory;
    private final Duration pollInterval;
    private final Map<String, String> evaluatorDefaults;
    private final BoardDbMetrics metrics;

    @Autowired
    public ParallelScanOrchestrator(EvaluatorFactory evaluatorFactory, BoardDbProperties properties,
                                    @Autowired(required = false) BoardDbMetrics metrics) {
        this(evaluatorFactory, Duration.ofMillis(properties.getPollIntervalMs()),
                properties.getEvaluator().getDefaults(), metrics);
    }

    ParallelScanOrchestrator(EvaluatorFactory evaluatorFactory, Duration pollInterval) {
        this(evaluatorFactory, pollInterval, Map.of(), null);
    }

    ParallelScanOrchestrator(EvaluatorFactory evaluatorFactory, Duration pollInterval,
                             Map<String, String> evaluatorDefaults, BoardDbMetrics metrics) {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + pollInterval);
        }
        this.evaluatorFactory = evaluatorFactory;
        this.pollInterval = pollInterval;
        this.evaluatorDefaults = Map.copyOf(evaluatorDefaults);
        this.metrics = metrics;
    }

    /**
     * Collects board parameters for every fragment under {@code configDir}.
     *
     * @param configDir   directory containing the defconfig files
     * @param srcDir      source tree handed to the evaluators
     * @param jobs        number of workers to run
     * @param warnTargets whether to check each fragment for exactly one {@code TARGET_xxx}
     * @return the scanned parameters and the sorted, de-duplicated warnings
     * @throws IOException if the fragment directory cannot be walked
     */
    public ScanReport scanAll(Path configDir, Path srcDir, int jobs, boolean warnTargets) throws IOException {
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
        }
        List<Path> defconfigs = Defconfigs.findAll(configDir);
        List<List<Path>> shares = partition(defconfigs, jobs);
        log.info("Scanning {} defconfigs in {} with {} job(s)", defconfigs.size(), configDir, jobs);

        long startMs = System.currentTimeMillis();
        var queues = new ArrayList<BlockingQueue<ScanOutcome>>();
        var workers = new ArrayList<Future<Integer>>();
        var params = new ArrayList<BoardParams>();
        var warnings = new TreeSet<String>();

        ExecutorService pool = Executors.newFixedThreadPool(jobs, workerThreadFactory());
        for (int i = 0; i < shares.size(); i++) {
            final int index = i;
            final List<Path> share = shares.get(i);
            final BlockingQueue<ScanOutcome> queue = new LinkedBlockingQueue<>();
            queues.add(queue);
            workers.add(pool.submit(() -> runWorker(index, srcDir, share, queue, warnTargets)));
        }
        pool.shutdown();

        try {
            while (!pool.awaitTermination(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                drain(queues, params, warnings);
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for scan workers", e);
        }

        for (int i = 0; i < workers.size(); i++) {
            collectFailure(i, shares.get(i).size(), workers.get(i), warnings);
        }

        // results queued between the last drain and worker exit
        drain(queues, params, warnings);

        long elapsedMs = System.currentTimeMillis() - startMs;
        log.info("Scanned {} of {} defconfigs in {} ms", params.size(), defconfigs.size(), elapsedMs);
        if (metrics != null) {
            metrics.recordScanDuration(jobs, elapsedMs);
            metrics.recordFragmentsScanned(params.size());
        }
        return new ScanReport(params, List.copyOf(warnings));
    }

    /**
     * Splits {@code items} into {@code jobs} contiguous shares. Share {@code i}
     * covers {@code [total * i / jobs, total * (i + 1) / jobs)}.
     */
    static <T> List<List<T>> partition(List<T> items, int jobs) {
        int total = items.size();
        var shares = new ArrayList<List<T>>(jobs);
        for (int i = 0; i < jobs; i++) {
            int from = (int) ((long) total * i / jobs);
            int to = (int) ((long) total * (i + 1) / jobs);
            shares.add(items.subList(from, to));
        }
        return shares;
    }

    private Integer runWorker(int index, Path srcDir, List<Path> share,
                              BlockingQueue<ScanOutcome> queue, boolean warnTargets) throws IOException {
        MdcContext.setWorker(index);
        try (FragmentEvaluator evaluator = evaluatorFactory.create(new EvaluatorContext(srcDir, evaluatorDefaults))) {
            var scanner = new FragmentScanner(evaluator);
            log.debug("Worker {} starting on {} defconfigs", index, share.size());
            for (Path defconfig : share) {
                MdcContext.setFragment(defconfig.getFileName().toString());
                queue.add(scanner.scan(defconfig, warnTargets));
            }
            MdcContext.clearFragment();
            return share.size();
        } finally {
            MdcContext.clear();
        }
    }

    private static void drain(List<BlockingQueue<ScanOutcome>> queues, List<BoardParams> params,
                              TreeSet<String> warnings) {
        var batch = new ArrayList<ScanOutcome>();
        for (BlockingQueue<ScanOutcome> queue : queues) {
            queue.drainTo(batch);
        }
        for (ScanOutcome outcome : batch) {
            params.add(outcome.params());
            warnings.addAll(outcome.warnings());
        }
    }

    private void collectFailure(int index, int shareSize, Future<Integer> worker, TreeSet<String> warnings) {
        try {
            worker.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Scan worker {} failed; its share of {} defconfigs is incomplete", index, shareSize, cause);
            warnings.add("WARNING: scan worker " + index + " failed: " + cause.getMessage());
            if (metrics != null) {
                metrics.recordWorkerFailure();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while collecting scan worker " + index, e);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "scan-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
