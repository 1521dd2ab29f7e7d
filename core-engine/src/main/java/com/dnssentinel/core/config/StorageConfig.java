package com.dnssentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Alert storage backend settings ({@code alerts.storage}).
 *
 * @since 1.0.0
 */
public class StorageConfig {

    public static final String TYPE_MEMORY = "memory";
    public static final String TYPE_FILE = "file";

    private String type = TYPE_MEMORY;
    private String path = "data/alerts.json";
    private int maxSize = 1000;
    private String retention = "168h";
    private String cleanupInterval = "1h";

    void collectErrors(List<String> errors) {
        if (!TYPE_MEMORY.equals(type) && !TYPE_FILE.equals(type)) {
            errors.add("storage.type must be 'memory' or 'file', got: '" + type + "'");
        }
        if (TYPE_FILE.equals(type) && (path == null || path.isBlank())) {
            errors.add("storage.path is required for file storage");
        }
        if (maxSize < 1) {
            errors.add("storage.maxSize must be >= 1, got: " + maxSize);
        }
        if (!Durations.isValid(retention)) {
            errors.add("storage.retention is not a valid duration: '" + retention + "'");
        }
        if (!Durations.isValid(cleanupInterval)) {
            errors.add("storage.cleanupInterval is not a valid duration: '" + cleanupInterval + "'");
        }
    }

    public Duration retentionDuration() {
        return Durations.parse(retention);
    }

    public Duration cleanupIntervalDuration() {
        return Durations.parse(cleanupInterval);
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public String getRetention() {
        return retention;
    }

    public void setRetention(String retention) {
        this.retention = retention;
    }

    public String getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(String cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }
}
