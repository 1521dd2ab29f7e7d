package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertStatus;
import com.dnssentinel.core.alert.NotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link AlertStorage} backed by a single JSON array file.
 *
 * <h3>Format</h3>
 * <p>
 * The file holds every stored alert serialized with Jackson (ISO-8601
 * timestamps). Each mutation rewrites the file through a temporary sibling
 * that is then moved into place.
 * </p>
 *
 * <h3>Capacity</h3>
 * <p>
 * On store only the newest {@code maxSize} alerts are kept; {@link #cleanup()}
 * additionally applies retention.
 * </p>
 *
 * @since 1.0.0
 */
public class FileAlertStorage implements AlertStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileAlertStorage.class);
    private static final TypeReference<List<Alert>> ALERT_LIST = new TypeReference<>() {
    };

    private final Path path;
    private final int maxSize;
    private final Duration retention;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @throws StorageException if the parent directory cannot be created
     */
    public FileAlertStorage(Path path, int maxSize, Duration retention, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory: " + parent, e);
        }
        LOG.info("File alert storage at {}", path.toAbsolutePath());
    }

    @Override
    public void store(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        lock.writeLock().lock();
        try {
            List<Alert> alerts = readAll();
            alerts.removeIf(a -> a.getId().equals(alert.getId()));
            alerts.add(alert);
            if (alerts.size() > maxSize) {
                alerts = new ArrayList<>(AlertFilter.latest(maxSize).apply(alerts));
            }
            writeAll(alerts);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Alert> get(String id) {
        lock.readLock().lock();
        try {
            return readAll().stream().filter(a -> a.getId().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void update(Alert alert) {
        Objects.requireNonNull(alert, "Alert must not be null");
        lock.writeLock().lock();
        try {
            List<Alert> alerts = readAll();
            int index = indexOf(alerts, alert.getId());
            if (index < 0) {
                throw new NotFoundException("Alert", alert.getId());
            }
            alerts.set(index, alert);
            writeAll(alerts);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String id) {
        lock.writeLock().lock();
        try {
            List<Alert> alerts = readAll();
            int index = indexOf(alerts, id);
            if (index < 0) {
                throw new NotFoundException("Alert", id);
            }
            alerts.remove(index);
            writeAll(alerts);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Alert> list(AlertFilter filter) {
        Objects.requireNonNull(filter, "Filter must not be null");
        lock.readLock().lock();
        try {
            return filter.apply(readAll());
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
            List<Alert> alerts = readAll();
            int before = alerts.size();
            if (!retention.isZero()) {
                Instant cutoff = clock.instant().minus(retention);
                alerts.removeIf(a -> a.getTimestamp().isBefore(cutoff));
            }
            if (alerts.size() > maxSize) {
                alerts = new ArrayList<>(AlertFilter.latest(maxSize).apply(alerts));
            }
            int removed = before - alerts.size();
            if (removed > 0) {
                writeAll(alerts);
                LOG.info("Cleaned up {} alert(s) from {}", removed, path);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        LOG.debug("File alert storage closed: {}", path);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Alert> readAll() {
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        try {
            if (Files.size(path) == 0) {
                return new ArrayList<>();
            }
            List<Alert> alerts = mapper.readValue(path.toFile(), ALERT_LIST);
            return alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
        } catch (IOException e) {
            throw new StorageException("Failed to read alerts from " + path, e);
        }
    }

    private void writeAll(List<Alert> alerts) {
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), alerts);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write alerts to " + path, e);
        }
    }

    private static int indexOf(List<Alert> alerts, String id) {
        for (int i = 0; i < alerts.size(); i++) {
            if (alerts.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
