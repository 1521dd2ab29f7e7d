package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.NotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for alert history.
 *
 * <p>
 * Implementations must be thread-safe and honour the same filter, sort
 * (newest first) and limit semantics, which {@link AlertFilter#apply} provides.
 * </p>
 */
public interface AlertStorage extends AutoCloseable {

    /**
     * Store an alert, replacing any alert with the same ID. May evict the
     * oldest alerts when the backend is at capacity.
     *
     * @throws StorageException if the alert cannot be persisted
     */
    void store(Alert alert);

    Optional<Alert> get(String id);

    /**
     * @throws NotFoundException if no alert with that ID is stored
     * @throws StorageException  if the change cannot be persisted
     */
    void update(Alert alert);

    /**
     * @throws NotFoundException if no alert with that ID is stored
     */
    void delete(String id);

    List<Alert> list(AlertFilter filter);

    /**
     * @return alerts with status fired or pending, newest first
     */
    List<Alert> getActive();

    /**
     * Drop alerts past retention and, when over capacity, the oldest ones.
     *
     * @return number of alerts removed
     */
    int cleanup();

    @Override
    void close();
}
