package de.mirkosertic.mcp.ragsync.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Turns bursts of raw watcher notifications into single normalized {@link FileEvent}s.
 * <p>
 * Two mechanisms work together:
 * <ul>
 *   <li>Duplicate suppression: an event whose {@code (type, path)} was accepted less than the duplicate
 *       window ago is dropped. Accept times live in a Caffeine cache that expires entries after the
 *       history TTL, so memory stays bounded without a manual cleanup loop.</li>
 *   <li>Debouncing: accepted events are buffered; the first one schedules a flush after the debounce delay.
 *       The flush merges all buffered events per path (see {@link FileEventType#mergeWith}) and hands one
 *       event per path to the sink in arrival order.</li>
 * </ul>
 */
public class FileEventDebouncer implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(FileEventDebouncer.class);

    private final Consumer<FileEvent> sink;
    private final SyncStatisticsTracker statistics;
    private final long debounceMs;
    private final long duplicateWindowNanos;
    private final Ticker ticker;
    private final Cache<EventKey, Long> eventHistory;

    private final ConcurrentLinkedQueue<FileEvent> pendingEvents = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);
    private final ScheduledExecutorService debounceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "watch-debounce");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean stopped = false;

    public FileEventDebouncer(final Consumer<FileEvent> sink, final SyncStatisticsTracker statistics,
                              final long debounceMs, final long duplicateWindowMs, final long historyTtlMs) {
        this(sink, statistics, debounceMs, duplicateWindowMs, historyTtlMs, Ticker.systemTicker());
    }

    FileEventDebouncer(final Consumer<FileEvent> sink, final SyncStatisticsTracker statistics,
                       final long debounceMs, final long duplicateWindowMs, final long historyTtlMs,
                       final Ticker ticker) {
        this.sink = sink;
        this.statistics = statistics;
        this.debounceMs = debounceMs;
        this.duplicateWindowNanos = TimeUnit.MILLISECONDS.toNanos(duplicateWindowMs);
        this.ticker = ticker;
        this.eventHistory = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(Math.max(historyTtlMs, duplicateWindowMs)))
                .scheduler(Scheduler.systemScheduler())
                .ticker(ticker)
                .build();
    }

    @Override
    public void onFileCreated(final Path file) {
        submit(FileEvent.created(file));
    }

    @Override
    public void onFileModified(final Path file) {
        submit(FileEvent.modified(file));
    }

    @Override
    public void onFileDeleted(final Path file) {
        submit(FileEvent.deleted(file));
    }

    void submit(final FileEvent event) {
        if (stopped) {
            return;
        }
        statistics.incrementEventsReceived();

        final long now = ticker.read();
        final AtomicBoolean accepted = new AtomicBoolean(false);
        eventHistory.asMap().compute(new EventKey(event.type(), event.path()), (key, lastAccepted) -> {
            if (lastAccepted != null && now - lastAccepted < duplicateWindowNanos) {
                return lastAccepted;
            }
            accepted.set(true);
            return now;
        });

        if (!accepted.get()) {
            statistics.incrementEventsSuppressed();
            logger.debug("Suppressed duplicate {} event for {}", event.type(), event.path());
            return;
        }

        pendingEvents.add(event);
        scheduleFlush();
    }

    private void scheduleFlush() {
        if (flushScheduled.compareAndSet(false, true)) {
            try {
                debounceScheduler.schedule(this::flush, debounceMs, TimeUnit.MILLISECONDS);
            } catch (final RejectedExecutionException e) {
                // Scheduler already shut down, stop() flushes what is left
                flushScheduled.set(false);
            }
        }
    }

    void flush() {
        try {
            final Map<Path, FileEventType> merged = new LinkedHashMap<>();
            FileEvent event;
            while ((event = pendingEvents.poll()) != null) {
                merged.merge(event.path(), event.type(), FileEventType::mergeWith);
            }
            if (merged.isEmpty()) {
                return;
            }
            logger.debug("Emitting {} debounced file events", merged.size());
            for (final Map.Entry<Path, FileEventType> entry : merged.entrySet()) {
                sink.accept(new FileEvent(entry.getValue(), entry.getKey()));
            }
        } catch (final RuntimeException e) {
            logger.error("Error emitting debounced file events", e);
        } finally {
            flushScheduled.set(false);
            // Events that arrived during the flush get their own window
            if (!pendingEvents.isEmpty() && !stopped) {
                scheduleFlush();
            }
        }
    }

    /**
     * Number of remembered {@code (type, path)} pairs, after evicting expired ones.
     */
    public long historySize() {
        eventHistory.cleanUp();
        return eventHistory.estimatedSize();
    }

    /**
     * Stop accepting events, cancel the pending timer and emit whatever is still buffered.
     */
    public void stop() {
        stopped = true;
        debounceScheduler.shutdownNow();
        try {
            if (!debounceScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Debounce scheduler did not terminate in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        flush();
        eventHistory.invalidateAll();
    }

    private record EventKey(FileEventType type, Path path) {
    }
}
