package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertStatus;
import com.dnssentinel.core.alert.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded in-memory {@link AlertStorage}.
 *
 * <p>
 * When full, {@link #store(Alert)} first drops alerts past retention and then
 * the oldest alerts until there is room for the new one.
 * </p>
 *
 * @since 1.0.0
 */
public class MemoryAlertStorage implements AlertStorage {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryAlertStorage.class);

    private final int maxSize;
    private final Duration retention;
    private final Clock clock;

    private final Map<String, Alert> alerts = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param maxSize   capacity, must be positive
     * @param retention age after which alerts are dropped; zero keeps them
     * @param clock     time source for retention
     */
    public MemoryAlertStorage(int maxSize, Duration retention, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void store(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        lock.writeLock().lock();
        try {
            if (!alerts.containsKey(alert.getId()) && alerts.size() >= maxSize) {
                int removed = evict(maxSize - 1);
                LOG.debug("Memory storage at capacity {} - evicted {} alert(s)", maxSize, removed);
            }
            alerts.put(alert.getId(), alert);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Alert> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(alerts.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void update(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        lock.writeLock().lock();
        try {
            if (!alerts.containsKey(alert.getId())) {
                throw new NotFoundException("Alert", alert.getId());
            }
            alerts.put(alert.getId(), alert);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            if (alerts.remove(id) == null) {
                throw new NotFoundException("Alert", id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Alert> list(AlertFilter filter) {
        Objects.requireNonNull(filter, "Filter must not be null");
        lock.readLock().lock();
        try {
            return filter.apply(alerts.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Alert> getActive() {
        return list(AlertFilter.builder().status(AlertStatus.FIRED, AlertStatus.PENDING).build());
    }

    @Override
    public int cleanup() {
        lock.writeLock().lock();
        try {
            return evict(maxSize);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            alerts.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return alerts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal (caller holds the write lock)
    // ---------------------------------------------------------------

    private int evict(int targetSize) {
        int before = alerts.size();
        if (!retention.isZero()) {
            Instant cutoff = clock.instant().minus(retention);
            alerts.values().removeIf(a -> a.getTimestamp().isBefore(cutoff));
        }
        if (alerts.size() > targetSize) {
            alerts.values().stream()
                    .sorted(Comparator.comparing(Alert::getTimestamp).thenComparing(Alert::getId))
                    .limit(alerts.size() - (long) targetSize)
                    .map(Alert::getId)
                    .toList()
                    .forEach(alerts::remove);
        }
        return before - alerts.size();
    }
}
