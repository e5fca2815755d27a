package com.khaounen.authguard.security.sweep;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts expired entries from the guard's stores to bound memory.
 * Request-path decisions never depend on this having run.
 */
@Slf4j
public class ExpiredEntrySweeper implements SmartLifecycle {

    private final List<ExpirableStore> stores;
    private final Duration interval;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;

    public ExpiredEntrySweeper(List<ExpirableStore> stores, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sweep interval must be positive");
        }
        this.stores = List.copyOf(stores);
        this.interval = interval;
    }

    /**
     * Runs one pass over all stores.
     *
     * @return total number of entries evicted
     */
    public int sweep() {
        int evicted = 0;
        for (ExpirableStore store : stores) {
            try {
                evicted += store.evictExpired();
            } catch (RuntimeException ex) {
                log.warn("sweep of {} failed: {}", store.getClass().getSimpleName(), ex.getMessage(), ex);
            }
        }
        if (evicted > 0) {
            log.debug("sweep evicted {} expired entries", evicted);
        }
        return evicted;
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "auth-guard-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMillis = interval.toMillis();
        task = executor.scheduleAtFixedRate(this::sweepSafely, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("expired entry sweeper started, interval={}", interval);
    }

    @Override
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        task.cancel(false);
        executor.shutdownNow();
        task = null;
        executor = null;
        log.info("expired entry sweeper stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    public Duration getInterval() {
        return interval;
    }

    // an exception escaping a scheduled task cancels every later run
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.warn("sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
