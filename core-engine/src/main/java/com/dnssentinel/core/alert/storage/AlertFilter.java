package com.dnssentinel.core.alert.storage;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertStatus;
import com.dnssentinel.core.alert.AlertType;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Filter set for {@link AlertStorage#list(AlertFilter)}.
 *
 * <p>
 * Unset criteria match everything; a limit of 0 means unlimited. Results are
 * sorted newest first (ties by ID, descending).
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertFilter {

    /** Newest first, then by ID descending. */
    static final Comparator<Alert> NEWEST_FIRST = Comparator
            .comparing(Alert::getTimestamp, Comparator.reverseOrder())
            .thenComparing(Alert::getId, Comparator.reverseOrder());

    private static final AlertFilter ALL = builder().build();

    private final Set<AlertStatus> statuses;
    private final AlertType type;
    private final AlertSeverity severity;
    private final String source;
    private final int limit;

    private AlertFilter(Builder b) {
        this.statuses = b.statuses.isEmpty() ? Set.of() : Set.copyOf(b.statuses);
        this.type = b.type;
        this.severity = b.severity;
        this.source = b.source;
        this.limit = b.limit;
    }

    public static AlertFilter all() {
        return ALL;
    }

    public static AlertFilter latest(int limit) {
        return builder().limit(limit).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(Alert alert) {
        return (statuses.isEmpty() || statuses.contains(alert.getStatus()))
                && (type == null || type == alert.getType())
                && (severity == null || severity == alert.getSeverity())
                && (source == null || source.equals(alert.getSource()));
    }

    /**
     * Filter, sort and limit {@code alerts}.
     */
    public List<Alert> apply(Collection<Alert> alerts) {
        Stream<Alert> stream = alerts.stream().filter(this::matches).sorted(NEWEST_FIRST);
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.toList();
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Fluent builder for {@link AlertFilter}.
     */
    public static class Builder {
        private final Set<AlertStatus> statuses = EnumSet.noneOf(AlertStatus.class);
        private AlertType type;
        private AlertSeverity severity;
        private String source;
        private int limit;

        /** Match any of the given statuses; may be called repeatedly. */
        public Builder status(AlertStatus... statuses) {
            this.statuses.addAll(List.of(statuses));
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

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
            }
            this.limit = limit;
            return this;
        }

        public AlertFilter build() {
            return new AlertFilter(this);
        }
    }

    @Override
    public String toString() {
        return "AlertFilter{statuses=" + statuses + ", type=" + type + ", severity=" + severity
                + ", source='" + source + "', limit=" + limit + '}';
    }
}
