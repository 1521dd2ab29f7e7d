package com.dnssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A deviation from the trained baseline, produced by an anomaly detector.
 *
 * <p>
 * Immutable. {@code score} is the standardized deviation that drove the
 * severity; {@code confidence} lies in [0, 1].
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code id}, {@code type}, {@code severity} and
 * {@code timestamp} are required. Jackson deserializes through the same
 * builder.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = Anomaly.Builder.class)
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final AnomalyType type;
    private final AnomalySeverity severity;
    private final double score;
    private final double confidence;
    private final Instant timestamp;
    private final String client;
    private final String domain;
    private final String description;
    private final Map<String, Object> metadata;

    private Anomaly(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        if (b.confidence < 0 || b.confidence > 1) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        this.score = b.score;
        this.confidence = b.confidence;
        this.client = b.client;
        this.domain = b.domain;
        this.description = b.description;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public AnomalyType getType() {
        return type;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getClient() {
        return client;
    }

    public String getDomain() {
        return domain;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private AnomalyType type;
        private AnomalySeverity severity;
        private double score;
        private double confidence;
        private Instant timestamp;
        private String client;
        private String domain;
        private String description;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder client(String client) {
            this.client = client;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if confidence is outside [0, 1]
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly anomaly))
            return false;
        return id.equals(anomaly.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", score=" + score +
                ", confidence=" + confidence +
                ", timestamp=" + timestamp +
                (client != null ? ", client='" + client + '\'' : "") +
                (domain != null ? ", domain='" + domain + '\'' : "") +
                '}';
    }
}
