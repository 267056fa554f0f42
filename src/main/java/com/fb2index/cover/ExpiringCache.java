package com.fb2index.cover;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExpiringCache<K, V> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExpiringCache.class);

    private final Map<K, Entry<V>> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final Duration sweepInterval;
    private final Clock clock;

    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?> sweepTask;

    public ExpiringCache(Duration ttl, Duration sweepInterval) {
        this(ttl, sweepInterval, Clock.systemUTC());
    }

    public ExpiringCache(Duration ttl, Duration sweepInterval, Clock clock) {
        if (ttl.isNegative() || sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("ttl must be >= 0 and sweepInterval > 0");
        }
        this.ttl = ttl;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        lock.readLock().lock();
        try {
            Entry<V> entry = entries.get(key);
            if (entry == null || entry.expiredAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(K key, V value) {
        Instant expiresAt = clock.instant().plus(ttl);
        lock.writeLock().lock();
        try {
            entries.put(key, new Entry<>(value, expiresAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int sweep() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.expiredAt(now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "expiring-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = Math.max(1, sweepInterval.toMillis());
        sweepTask = sweeper.scheduleWithFixedDelay(this::sweepLogged, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    @Override
    public synchronized void close() {
        if (sweepTask == null) {
            return;
        }
        sweepTask.cancel(false);
        sweeper.shutdownNow();
        sweepTask = null;
        sweeper = null;
    }

    private void sweepLogged() {
        int removed = sweep();
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean expiredAt(Instant now) {
            return expiresAt.isBefore(now);
        }
    }
}
