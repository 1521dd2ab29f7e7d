package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.config.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Factory that selects an {@link AlertStorage} backend from configuration.
 *
 * @since 1.0.0
 */
public final class AlertStorages {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStorages.class);

    private AlertStorages() {
    }

    /**
     * @throws IllegalArgumentException if the storage type is unknown
     * @throws StorageException         if a file backend cannot be prepared
     */
    public static AlertStorage create(StorageConfig config, Clock clock) {
        Objects.requireNonNull(config, "StorageConfig must not be null");
        String type = config.getType() != null ? config.getType() : "";
        LOG.debug("Creating {} alert storage (maxSize={}, retention={})",
                type, config.getMaxSize(), config.getRetention());
        switch (type) {
            case StorageConfig.TYPE_MEMORY:
                return new MemoryAlertStorage(config.getMaxSize(), config.retentionDuration(), clock);
            case StorageConfig.TYPE_FILE:
                return new FileAlertStorage(Path.of(config.getPath()), config.getMaxSize(),
                        config.retentionDuration(), clock);
            default:
                throw new IllegalArgumentException(
                        "Unknown storage type: '" + config.getType() + "'. Supported types: memory, file");
        }
    }
}
