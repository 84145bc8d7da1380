package de.mirkosertic.filevault.indexsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded thread pool running per-owner reconciliation units.
 * A pool size of 1 processes owners one after another.
 */
public class SyncWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(SyncWorkerPool.class);

    private final ThreadPoolExecutor executor;

    public SyncWorkerPool(final int poolSize) {
        final int threads = Math.max(1, poolSize);

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "index-sync-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("SyncWorkerPool initialized with {} threads", threads);
    }

    /**
     * Run all tasks and wait until every one of them has finished.
     */
    public <T> List<Future<T>> invokeAll(final Collection<? extends Callable<T>> tasks) throws InterruptedException {
        return executor.invokeAll(tasks);
    }

    /**
     * Shutdown the pool. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down SyncWorkerPool");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("SyncWorkerPool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SyncWorkerPool to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
