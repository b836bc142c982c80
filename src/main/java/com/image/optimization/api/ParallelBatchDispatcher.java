package com.image.optimization.api;

import com.image.optimization.logging.LogContext;
import com.image.optimization.metrics.GuardedMetricsService;
import com.image.optimization.metrics.MetricsService;
import com.image.optimization.progress.ProgressCallback;
import com.image.optimization.progress.ProgressTracker;
import com.image.optimization.result.BatchSummary;
import com.image.optimization.result.ProcessingResult;
import com.image.optimization.result.ResultAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool implementation of {@link BatchDispatcher}.
 *
 * <p>Starts {@code min(throttleLimit, items)} platform threads that drain a shared
 * queue of items. Each worker runs the processor inside {@link ErrorIsolation},
 * records the result, then reports progress. The summary is built once all
 * workers have joined.</p>
 *
 * <p>The configured {@link MetricsService} and {@link Clock} are wrapped so that a
 * failure in either is logged and never takes a worker down.</p>
 */
public class ParallelBatchDispatcher implements BatchDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ParallelBatchDispatcher.class);

    private final DispatchOptions options;
    private final MetricsService metrics;
    private final Clock clock;

    public ParallelBatchDispatcher() {
        this(DispatchOptions.defaults());
    }

    public ParallelBatchDispatcher(DispatchOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.metrics = GuardedMetricsService.wrap(options.getMetricsService());
        this.clock = FallbackClock.wrap(options.getClock());
    }

    @Override
    public DispatchOptions getOptions() {
        return options;
    }

    @Override
    public BatchSummary dispatch(List<WorkItem> items, ItemProcessor processor) {
        return dispatch(items, processor, null);
    }

    @Override
    public BatchSummary dispatch(List<WorkItem> items, ItemProcessor processor, ProgressCallback callback) {
        return submit(items, processor, callback).await();
    }

    @Override
    public BatchRun submit(List<WorkItem> items, ItemProcessor processor, ProgressCallback callback) {
        validate(items, processor);

        String batchId = LogContext.generateBatchId();
        int throttleLimit = options.getThrottleLimit();
        int total = items.size();

        ProgressTracker tracker = new ProgressTracker(total, callback, metrics, clock);
        BatchRun run = new BatchRun(batchId, tracker);

        if (total == 0) {
            log.info("batch.empty batchId={}", batchId);
            run.complete(BatchSummary.empty(throttleLimit));
            return run;
        }

        int threadsUsed = Math.min(throttleLimit, total);
        Queue<IndexedItem> queue = new ConcurrentLinkedQueue<>();
        for (int i = 0; i < total; i++) {
            queue.add(new IndexedItem(i, items.get(i)));
        }
        ResultAggregator aggregator = new ResultAggregator(total);
        Instant start = clock.instant();

        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.started items={} threads={} throttleLimit={} maxAttempts={}",
                    total, threadsUsed, throttleLimit, options.getRetryPolicy().maxAttempts());
        }

        tracker.start();
        run.markRunning();

        ExecutorService executor = Executors.newFixedThreadPool(threadsUsed, workerThreadFactory());
        List<CompletableFuture<Void>> workers = new ArrayList<>(threadsUsed);
        try {
            for (int workerId = 1; workerId <= threadsUsed; workerId++) {
                Worker worker = new Worker(workerId, run, queue, processor, aggregator, tracker);
                workers.add(CompletableFuture.runAsync(worker, executor));
            }
        } finally {
            executor.shutdown();
        }

        CompletableFuture.allOf(workers.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, failure) -> {
                    if (failure != null) {
                        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                                ? failure.getCause() : failure;
                        log.error("batch.aborted batchId={} error={}", batchId, cause.toString());
                        run.fail(cause);
                        return;
                    }
                    finish(run, aggregator, threadsUsed, start);
                });
        return run;
    }

    private void finish(BatchRun run, ResultAggregator aggregator, int threadsUsed, Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        try (LogContext ctx = LogContext.forBatch(run.batchId())) {
            boolean cancelled = run.closeForCancellation();
            BatchSummary summary = aggregator.summarize(threadsUsed, options.getThrottleLimit(),
                    elapsed, cancelled);
            metrics.recordBatchDuration(elapsed);
            metrics.recordBatchSize(summary.totalProcessed());
            metrics.recordBytesSaved(summary.bytesSaved());
            log.info("batch.completed summary={}", summary);
            run.complete(summary);
        } catch (RuntimeException e) {
            log.error("batch.summary.failed batchId={} error={}", run.batchId(), e.getMessage());
            run.fail(e);
        }
    }

    private static void validate(List<WorkItem> items, ItemProcessor processor) {
        if (items == null) {
            throw new IllegalArgumentException("items must not be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor must not be null");
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) {
                throw new IllegalArgumentException("items[" + i + "] must not be null");
            }
        }
    }

    private ThreadFactory workerThreadFactory() {
        String prefix = options.getWorkerThreadPrefix();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record IndexedItem(int index, WorkItem item) {}

    /**
     * Drains the shared queue until it is empty.
     */
    private class Worker implements Runnable {
        private final int workerId;
        private final BatchRun run;
        private final Queue<IndexedItem> queue;
        private final ItemProcessor processor;
        private final ResultAggregator aggregator;
        private final ProgressTracker tracker;

        Worker(int workerId, BatchRun run, Queue<IndexedItem> queue, ItemProcessor processor,
               ResultAggregator aggregator, ProgressTracker tracker) {
            this.workerId = workerId;
            this.run = run;
            this.queue = queue;
            this.processor = processor;
            this.aggregator = aggregator;
            this.tracker = tracker;
        }

        @Override
        public void run() {
            Thread current = Thread.currentThread();
            run.registerWorker(current);
            try {
                IndexedItem next;
                while ((next = queue.poll()) != null) {
                    process(next);
                }
            } finally {
                run.unregisterWorker(current);
                Thread.interrupted();
            }
        }

        private void process(IndexedItem next) {
            String fileName = next.item().fileName();

            ProcessingResult result;
            if (run.isCancellationRequested()) {
                Thread.interrupted();
                result = ProcessingResult.failure(fileName, ErrorIsolation.CANCELLED_MESSAGE, workerId, clock.instant());
            } else {
                try (LogContext ctx = LogContext.forItem(run.batchId(), fileName, workerId)) {
                    long startNanos = System.nanoTime();
                    result = ErrorIsolation.invokeProcessor(processor, next.item(), workerId,
                            options.getRetryPolicy(), metrics, clock);
                    metrics.recordItemDuration(Duration.ofNanos(System.nanoTime() - startNanos), result.success());
                    log.debug("item.completed success={} ratio={}", result.success(), result.compressionRatio());
                }
                // an interrupt is only meant for the item it hit
                Thread.interrupted();
            }
            metrics.incrementItemProcessed(result.success());
            aggregator.record(next.index(), result);
            tracker.onItemCompleted(fileName);
        }
    }
}
