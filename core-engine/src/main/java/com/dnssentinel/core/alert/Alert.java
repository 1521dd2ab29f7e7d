package com.dnssentinel.core.alert;

import com.dnssentinel.core.model.Anomaly;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An alert raised by rule evaluation or by anomaly ingestion.
 *
 * <h3>Mutation</h3>
 * <p>
 * After construction an alert changes only by appending notification records
 * ({@link #addNotification(NotificationRecord)}) or by a status transition
 * ({@link #markResolved(Instant)}, {@link #markSuppressed()}). Those methods
 * and the notification getter synchronize on the instance. The plain setters
 * exist for Jackson.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@code id}, {@code type}, {@code severity} and
 * {@code timestamp} are required and {@code status} defaults to
 * {@link AlertStatus#FIRED}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private AlertType type;
    private AlertSeverity severity;
    private AlertStatus status;
    private String title;
    private String description;

    /** When the alert fired. */
    private Instant timestamp;
    private Instant resolvedAt;

    /** Rule source {@code rule:<id>} or {@code ml-engine}. */
    private String source;
    private String client;
    private String domain;
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private List<String> tags = new ArrayList<>();

    private Anomaly anomaly;
    private Double mlScore;
    private Double mlConfidence;

    private List<NotificationRecord> notifications = new ArrayList<>();
    private Instant suppressUntil;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.status = b.status;
        this.title = b.title;
        this.description = b.description;
        this.source = b.source;
        this.client = b.client;
        this.domain = b.domain;
        this.metadata = new LinkedHashMap<>(b.metadata);
        this.tags = new ArrayList<>(b.tags);
        this.anomaly = b.anomaly;
        this.mlScore = b.mlScore;
        this.mlConfidence = b.mlConfidence;
        this.suppressUntil = b.suppressUntil;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void addNotification(NotificationRecord record) {
        notifications.add(Objects.requireNonNull(record, "record must not be null"));
    }

    /**
     * Transition to {@link AlertStatus#RESOLVED}.
     */
    public synchronized void markResolved(Instant at) {
        this.status = AlertStatus.RESOLVED;
        this.resolvedAt = Objects.requireNonNull(at, "resolvedAt must not be null");
    }

    public synchronized void markSuppressed() {
        this.status = AlertStatus.SUPPRESSED;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Alert}.
     */
    public static class Builder {
        private String id;
        private AlertType type;
        private AlertSeverity severity;
        private AlertStatus status = AlertStatus.FIRED;
        private String title;
        private String description;
        private Instant timestamp;
        private String source;
        private String client;
        private String domain;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> tags = new ArrayList<>();
        private Anomaly anomaly;
        private Double mlScore;
        private Double mlConfidence;
        private Instant suppressUntil;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
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

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder anomaly(Anomaly anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder mlScore(Double mlScore) {
            this.mlScore = mlScore;
            return this;
        }

        public Builder mlConfidence(Double mlConfidence) {
            this.mlConfidence = mlConfidence;
            return this;
        }

        public Builder suppressUntil(Instant suppressUntil) {
            this.suppressUntil = suppressUntil;
            return this;
        }

        /**
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (setters required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public AlertType getType() {
        return type;
    }

    public void setType(AlertType type) {
        this.type = type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(AlertSeverity severity) {
        this.severity = severity;
    }

    public synchronized AlertStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(AlertStatus status) {
        this.status = status;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }

    public synchronized void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getClient() {
        return client;
    }

    public void setClient(String client) {
        this.client = client;
    }

    public String getDomain() {
        return domain;
    }

    public void setDomain(String domain) {
        this.domain = domain;
    }

    /**
     * @return unmodifiable view of the metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public Anomaly getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(Anomaly anomaly) {
        this.anomaly = anomaly;
    }

    public Double getMlScore() {
        return mlScore;
    }

    public void setMlScore(Double mlScore) {
        this.mlScore = mlScore;
    }

    public Double getMlConfidence() {
        return mlConfidence;
    }

    public void setMlConfidence(Double mlConfidence) {
        this.mlConfidence = mlConfidence;
    }

    /**
     * @return a copy of the delivery records in attempt order
     */
    public synchronized List<NotificationRecord> getNotifications() {
        return List.copyOf(notifications);
    }

    public synchronized void setNotifications(List<NotificationRecord> notifications) {
        this.notifications = notifications != null ? new ArrayList<>(notifications) : new ArrayList<>();
    }

    public Instant getSuppressUntil() {
        return suppressUntil;
    }

    public void setSuppressUntil(Instant suppressUntil) {
        this.suppressUntil = suppressUntil;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", severity=" + severity +
                ", status=" + status +
                ", title='" + title + '\'' +
                ", source='" + source + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
