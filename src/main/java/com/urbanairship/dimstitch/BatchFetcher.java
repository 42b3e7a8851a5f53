package com.urbanairship.dimstitch;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.urbanairship.dimstitch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class BatchFetcher implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(BatchFetcher.class);

    private final ThreadPoolExecutor executorService;
    private final Fetcher fetcher;
    private final FetchFailurePolicy failurePolicy;
    private final AtomicInteger inFlight = new AtomicInteger();

    private final Timer fetchTimer;
    private final Histogram rowsPerBatch;
    private final Meter failedBatches;
    private final Meter skippedBatches;

    /**
     * This utility class fetches every batch of a run in parallel against one Fetcher and waits for
     * all of them before handing back the rows, so stitching only starts once everything is in.
     *
     * @param fetcher       fetcher that requests will be executed against, must be thread safe
     * @param threads       how many batches may be fetched at once. Keep this small, the reporting API
     *                      has per-user concurrency quotas.
     * @param failurePolicy what to do when a batch fails
     */
    public BatchFetcher(Fetcher fetcher, int threads, FetchFailurePolicy failurePolicy) {
        Preconditions.checkArgument(threads > 0, "Need at least one fetch thread, got %s", threads);
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("batch fetcher %d")
                .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                    @Override
                    public void uncaughtException(Thread t, Throwable e) {
                        log.error("Uncaught error from batch fetcher thread", e);
                    }
                })
                .build();

        this.executorService = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<Runnable>(), threadFactory);
        this.fetcher = fetcher;
        this.failurePolicy = Preconditions.checkNotNull(failurePolicy);

        fetchTimer = Metrics.timer(BatchFetcher.class, "fetchLatency");
        rowsPerBatch = Metrics.histogram(BatchFetcher.class, "rowsPerBatch");
        failedBatches = Metrics.meter(BatchFetcher.class, "failedBatches");
        skippedBatches = Metrics.meter(BatchFetcher.class, "skippedBatches");
        Metrics.gauge(BatchFetcher.class, "fetchesInFlight", new Gauge<Integer>() {
            @Override
            public Integer getValue() {
                return inFlight.get();
            }
        });
    }

    /**
     * Fetch every batch and wait for them all.
     *
     * @return one RowSet per batch, in the order the batches were given. Under
     * {@link FetchFailurePolicy#BEST_EFFORT} a batch that failed has no RowSet.
     * @throws FetchException       for the first failed batch under {@link FetchFailurePolicy#FAIL_FAST},
     *                              or if the first batch failed, since it is the base of the stitch. The other
     *                              fetches are cancelled.
     * @throws InterruptedException if interrupted while waiting. The other fetches are cancelled.
     */
    public List<RowSet> fetchAll(List<BatchSpec> batchSpecs, DateRange dateRange, Optional<String> filter)
            throws FetchException, InterruptedException {
        Preconditions.checkArgument(!batchSpecs.isEmpty(), "No batches to fetch");

        CompletionService<RowSet> completionService = new ExecutorCompletionService<>(executorService);
        Map<Future<RowSet>, BatchSpec> futures = Maps.newLinkedHashMap();
        for (BatchSpec batchSpec : batchSpecs) {
            futures.put(completionService.submit(new FetchCallable(batchSpec, dateRange, filter)), batchSpec);
        }

        Map<BatchSpec, RowSet> fetched = Maps.newHashMap();
        try {
            for (int i = 0; i < batchSpecs.size(); i++) {
                Future<RowSet> future = completionService.take();
                BatchSpec batchSpec = futures.get(future);
                try {
                    fetched.put(batchSpec, future.get());
                } catch (ExecutionException e) {
                    FetchException fetchException = unwrap(batchSpec, e);
                    failedBatches.mark();

                    boolean isBase = batchSpec.equals(batchSpecs.get(0));
                    if (failurePolicy == FetchFailurePolicy.FAIL_FAST || isBase) {
                        log.error("Fetch failed for " + batchSpec + ", cancelling the other batches", fetchException);
                        throw fetchException;
                    }

                    skippedBatches.mark();
                    log.warn("Skipping " + batchSpec + " after it failed, the output will be incomplete",
                            fetchException);
                }
            }
        } finally {
            // Nothing left to cancel on the happy path
            for (Future<RowSet> future : futures.keySet()) {
                future.cancel(true);
            }
        }

        List<RowSet> rowSets = new ArrayList<>(fetched.size());
        for (BatchSpec batchSpec : batchSpecs) {
            RowSet rowSet = fetched.get(batchSpec);
            if (rowSet != null) {
                rowSets.add(rowSet);
            }
        }
        return rowSets;
    }

    private static FetchException unwrap(BatchSpec batchSpec, ExecutionException e) throws InterruptedException {
        if (e.getCause() instanceof FetchException) {
            return (FetchException) e.getCause();
        }
        if (e.getCause() instanceof InterruptedException) {
            throw (InterruptedException) e.getCause();
        }

        return new FetchException(batchSpec, e.getCause());
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private class FetchCallable implements Callable<RowSet> {
        private final BatchSpec batchSpec;
        private final DateRange dateRange;
        private final Optional<String> filter;

        private FetchCallable(BatchSpec batchSpec, DateRange dateRange, Optional<String> filter) {
            this.batchSpec = batchSpec;
            this.dateRange = dateRange;
            this.filter = filter;
        }

        @Override
        public RowSet call() throws Exception {
            inFlight.incrementAndGet();
            Timer.Context timer = fetchTimer.time();
            try {
                List<Row> rows = fetcher.fetch(batchSpec, dateRange, filter);
                rowsPerBatch.update(rows.size());
                log.info("Fetched " + rows.size() + " rows for " + batchSpec);
                return new RowSet(batchSpec, rows);
            } finally {
                timer.stop();
                inFlight.decrementAndGet();
            }
        }
    }
}
