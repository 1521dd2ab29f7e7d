package com.dnssentinel.core.analytics;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive metadata about a trained detector model.
 *
 * @since 1.0.0
 */
public final class ModelInfo {

    private final String name;
    private final String version;
    private final Instant trainedAt;
    private final int trainingSize;
    private final Map<String, Object> parameters;

    public ModelInfo(String name, String version, Instant trainedAt, int trainingSize,
                     Map<String, Object> parameters) {
        this.name = name;
        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingSize = trainingSize;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public int getTrainingSize() {
        return trainingSize;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "ModelInfo{name='" + name + "', version='" + version + "', trainedAt=" + trainedAt
                + ", trainingSize=" + trainingSize + '}';
    }
}
