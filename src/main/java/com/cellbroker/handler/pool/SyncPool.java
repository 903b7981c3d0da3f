package com.cellbroker.handler.pool;

import com.cellbroker.exception.QueueException;
import com.cellbroker.handler.Handler;
import com.cellbroker.model.Queue;
import com.cellbroker.queue.QueueClient;
import com.cellbroker.queue.QueueSubscription;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps one running {@link Handler} per key of the current config snapshot.
 *
 * FLOW (reconcileOnce):
 *   collect()  → key → queue the pool should be consuming
 *   running key no longer wanted → stop + remove
 *   wanted key with no handler   → subscribe + create + start
 *   wanted key already running   → untouched
 *
 * Reconciliation runs on one thread. signal() requests a run; signals that arrive
 * while a run is pending collapse into it. A handler that dies on its own removes
 * itself from the map and its key is held back for a backoff (1s, doubling up to
 * 1 min) before a scheduled run recreates it.
 */
@Slf4j
public abstract class SyncPool<K> implements AutoCloseable {

    static final Duration RESTART_BACKOFF = Duration.ofSeconds(1);
    static final Duration MAX_RESTART_BACKOFF = Duration.ofMinutes(1);

    private final String poolName;
    private final QueueClient queueClient;
    private final ConcurrentMap<K, Handler> handlers = new ConcurrentHashMap<>();
    private final ConcurrentMap<K, Restart> restarts = new ConcurrentHashMap<>();
    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService syncExecutor;

    protected SyncPool(String poolName, QueueClient queueClient) {
        this.poolName = poolName;
        this.queueClient = queueClient;
        this.syncExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, poolName + "-sync");
            t.setDaemon(true);
            return t;
        });
    }

    /** The queues the pool should consume right now, by key. */
    protected abstract Map<K, Queue> collect();

    /** Builds (but does not start) the handler for one key. */
    protected abstract Handler createHandler(K key, QueueSubscription subscription);

    public void start() {
        log.info("Starting {} pool", poolName);
        signal();
    }

    public void signal() {
        if (closed.get() || !pending.compareAndSet(false, true)) {
            return;
        }
        try {
            syncExecutor.execute(() -> {
                pending.set(false);
                int errors = reconcileOnce();
                if (errors > 0) {
                    log.warn("{} pool sync finished with {} failed key(s)", poolName, errors);
                }
            });
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.debug("{} pool is shutting down, sync request ignored", poolName);
        }
    }

    /**
     * Converges the running handlers onto the current snapshot.
     *
     * @return how many keys could not be started
     */
    public int reconcileOnce() {
        Map<K, Queue> wanted = collect();
        restarts.keySet().retainAll(wanted.keySet());

        handlers.forEach((key, handler) -> {
            if (!wanted.containsKey(key) && handlers.remove(key, handler)) {
                log.info("Stopping handler no longer in the config: pool={}, key={}", poolName, key);
                handler.stop();
            }
        });

        int errors = 0;
        for (Map.Entry<K, Queue> entry : wanted.entrySet()) {
            K key = entry.getKey();
            if (handlers.containsKey(key)) {
                continue;
            }
            Restart restart = restarts.get(key);
            if (restart != null && Instant.now().isBefore(restart.notBefore)) {
                continue;
            }
            try {
                startHandler(key, entry.getValue());
            } catch (QueueException | RuntimeException e) {
                errors++;
                log.error("Failed to start handler: pool={}, key={}, error={}", poolName, key, e.getMessage());
            }
        }
        return errors;
    }

    private void startHandler(K key, Queue queue) throws QueueException {
        QueueSubscription subscription = queueClient.subscribe(queue);
        Handler handler = createHandler(key, subscription);
        Instant startedAt = Instant.now();
        handlers.put(key, handler);
        handler.start(err -> {
            // Only a handler that is still registered stopped unexpectedly.
            if (handlers.remove(key, handler)) {
                Duration backoff = holdBack(key, startedAt);
                log.error("Handler stopped unexpectedly: pool={}, key={}, restartIn={}, error={}",
                        poolName, key, backoff, err == null ? "none" : err.getMessage());
                scheduleSignal(backoff);
            }
        });
        log.info("Started handler: pool={}, key={}, topic={}", poolName, key, queue.getTopic());
    }

    private Duration holdBack(K key, Instant startedAt) {
        Instant now = Instant.now();
        Restart previous = restarts.get(key);
        Duration backoff;
        if (previous == null || Duration.between(startedAt, now).compareTo(MAX_RESTART_BACKOFF) > 0) {
            backoff = RESTART_BACKOFF;
        } else {
            backoff = previous.backoff.multipliedBy(2);
            if (backoff.compareTo(MAX_RESTART_BACKOFF) > 0) {
                backoff = MAX_RESTART_BACKOFF;
            }
        }
        restarts.put(key, new Restart(backoff, now.plus(backoff)));
        return backoff;
    }

    private void scheduleSignal(Duration delay) {
        try {
            syncExecutor.schedule(this::signal, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("{} pool is shutting down, restart not scheduled", poolName);
        }
    }

    public Set<K> keys() {
        return Set.copyOf(handlers.keySet());
    }

    public Optional<Handler> get(K key) {
        return Optional.ofNullable(handlers.get(key));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        syncExecutor.shutdownNow();
        try {
            if (!syncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} pool sync thread did not stop in time", poolName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        handlers.forEach((key, handler) -> {
            handlers.remove(key, handler);
            handler.stop();
        });
        log.info("{} pool closed", poolName);
    }

    private static final class Restart {
        final Duration backoff;
        final Instant notBefore;

        Restart(Duration backoff, Instant notBefore) {
            this.backoff = backoff;
            this.notBefore = notBefore;
        }
    }
}
