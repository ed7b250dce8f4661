package io.github.pierce.gdelt.batch;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.pierce.gdelt.BatchAbortedException;
import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.join.JoinEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs an {@link InstantPipeline} over every timestamp of a {@link BatchRequest} and merges
 * the results.
 *
 * <p>Failures are caught per instant. Under {@link OnErrorPolicy#RAISE} the first failure
 * aborts the run with a {@link BatchAbortedException} holding the partial result; under
 * {@link OnErrorPolicy#SKIP} it is recorded and the run continues.</p>
 *
 * <p>With a parallelism above one, instants run on a bounded pool and each worker thread gets
 * its own join engine from the supplied factory. Results are still folded in timestamp order,
 * so the output does not depend on scheduling.</p>
 */
public class BatchAggregator {

    private final InstantPipeline pipeline;
    private final Supplier<JoinEngine> joinEngineFactory;
    private final Logger log;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public BatchAggregator(InstantPipeline pipeline) {
        this(pipeline, null);
    }

    /**
     * @param joinEngineFactory creates one engine per worker in parallel runs; null shares the
     *                          pipeline's engine
     */
    public BatchAggregator(InstantPipeline pipeline, Supplier<JoinEngine> joinEngineFactory) {
        this(pipeline, joinEngineFactory, LoggerFactory.getLogger(BatchAggregator.class));
    }

    public BatchAggregator(InstantPipeline pipeline, Supplier<JoinEngine> joinEngineFactory, Logger log) {
        this.pipeline = pipeline;
        this.joinEngineFactory = joinEngineFactory;
        this.log = log;
    }

    /**
     * Asks the run in progress to stop. Instants already started finish and are kept;
     * the others are reported as cancelled.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public BatchResult run(BatchRequest request) {
        cancelRequested.set(false);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ProcessingInstant base = request.getBaseInstant();
        if (base.statisticsLevel() == StatisticsLevel.ALL && request.getMappingQuality() == null) {
            throw new ValidationException("Mapping quality configuration is required when statistics='all'");
        }
        List<String> timestamps = request.timestamps();
        log.info("Batch of {} timestamp(s) from {} to {}, join case {}, statistics {}",
                timestamps.size(), timestamps.get(0), timestamps.get(timestamps.size() - 1),
                base.joinCase().configName(), base.statisticsLevel().configName());

        BatchAccumulator accumulator = new BatchAccumulator(timestamps, base.statisticsLevel(),
                request.getReturnMode(), request.isFlattenMappingTables());

        if (request.getParallelism() > 1 && timestamps.size() > 1) {
            runParallel(request, timestamps, accumulator, stopwatch);
        } else {
            runSequential(request, timestamps, accumulator, stopwatch);
        }

        BatchResult result = accumulator.build(stopwatch.elapsed());
        logElapsed(result.getElapsed());
        log.info("Batch finished: {} processed, {} failed, {} cancelled",
                result.getProcessed().size(), result.getFailed().size(), result.getCancelled().size());
        return result;
    }

    private void runSequential(BatchRequest request, List<String> timestamps,
                               BatchAccumulator accumulator, Stopwatch stopwatch) {
        for (int i = 0; i < timestamps.size(); i++) {
            String ts = timestamps.get(i);
            if (cancelRequested.get()) {
                log.info("Batch cancelled before {}", ts);
                timestamps.subList(i, timestamps.size()).forEach(accumulator::addCancelled);
                return;
            }
            InstantOutcome outcome = runInstant(pipeline, request, ts);
            fold(request, accumulator, outcome, timestamps.subList(i + 1, timestamps.size()), stopwatch);
        }
    }

    private void runParallel(BatchRequest request, List<String> timestamps,
                             BatchAccumulator accumulator, Stopwatch stopwatch) {
        int threads = Math.min(request.getParallelism(), timestamps.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("gdelt-batch-%d").setDaemon(true).build());
        ThreadLocal<InstantPipeline> workerPipeline = ThreadLocal.withInitial(() ->
                joinEngineFactory != null ? pipeline.withJoinEngine(joinEngineFactory.get()) : pipeline);
        AtomicBoolean aborted = new AtomicBoolean();
        log.info("Running {} instants on {} worker threads", timestamps.size(), threads);

        List<Future<InstantOutcome>> futures = new ArrayList<>(timestamps.size());
        for (String ts : timestamps) {
            futures.add(executor.submit(() -> {
                if (cancelRequested.get() || aborted.get()) {
                    return InstantOutcome.cancelled(ts);
                }
                return runInstant(workerPipeline.get(), request, ts);
            }));
        }

        try {
            for (int i = 0; i < futures.size(); i++) {
                String ts = timestamps.get(i);
                InstantOutcome outcome = await(futures.get(i), ts);
                if (outcome.getState() == InstantState.FAILED && request.getOnError() == OnErrorPolicy.RAISE) {
                    aborted.set(true);
                }
                fold(request, accumulator, outcome, timestamps.subList(i + 1, timestamps.size()), stopwatch);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private InstantOutcome await(Future<InstantOutcome> future, String ts) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return InstantOutcome.cancelled(ts);
        } catch (ExecutionException e) {
            return InstantOutcome.failure(ts, e.getCause());
        }
    }

    private InstantOutcome runInstant(InstantPipeline instantPipeline, BatchRequest request, String ts) {
        try {
            ProcessingInstant instant = request.getBaseInstant().withTimestamp(ts);
            return InstantOutcome.success(instantPipeline.process(instant, request.getMappingQuality()));
        } catch (Exception e) {
            return InstantOutcome.failure(ts, e);
        }
    }

    private void fold(BatchRequest request, BatchAccumulator accumulator, InstantOutcome outcome,
                      List<String> remaining, Stopwatch stopwatch) {
        accumulator.add(outcome);
        if (outcome.getState() != InstantState.FAILED) {
            return;
        }
        log.error("Failed timestamp {}: {}", outcome.getTimestamp(), outcome.formatError());
        if (request.getOnError() == OnErrorPolicy.RAISE) {
            remaining.forEach(accumulator::addCancelled);
            BatchResult partial = accumulator.build(stopwatch.elapsed());
            logElapsed(partial.getElapsed());
            throw new BatchAbortedException(outcome.getTimestamp(), outcome.getError(), partial);
        }
    }

    private void logElapsed(Duration elapsed) {
        long seconds = elapsed.getSeconds();
        log.info("Total processing time: {}h {}m {}s ({} seconds)",
                seconds / 3600, (seconds % 3600) / 60, seconds % 60,
                String.format(Locale.ROOT, "%.2f", elapsed.toMillis() / 1000.0));
    }
}
