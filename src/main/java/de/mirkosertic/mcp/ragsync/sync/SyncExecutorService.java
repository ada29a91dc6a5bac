package de.mirkosertic.mcp.ragsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that hashes and syncs files during a full scan, off the watcher and request threads.
 */
public class SyncExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SyncExecutorService.class);

    private final ThreadPoolExecutor executor;

    public SyncExecutorService(final int threads) {
        final int poolSize = Math.max(1, threads);
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "sync-scan-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        // CallerRunsPolicy throttles the scanning thread instead of rejecting files
        this.executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("SyncExecutorService initialized with {} threads", poolSize);
    }

    public Future<?> submit(final Runnable task) {
        return executor.submit(task);
    }

    public void shutdown() {
        logger.info("Shutting down SyncExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("SyncExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for SyncExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
