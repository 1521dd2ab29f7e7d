package com.dnssentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time summary of network query activity handed from the collector to
 * the alert engine.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, or {@link #summarize(Collection, String, String, Instant)}
 * to derive a snapshot from a batch of {@link QueryRecord}s.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricsSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long totalQueries;
    private final int uniqueClients;
    private final String analysisMode;
    private final String dataSourceType;
    private final Instant timestamp;
    private final PerformanceMetrics performance;

    private MetricsSnapshot(Builder b) {
        this.totalQueries = b.totalQueries;
        this.uniqueClients = b.uniqueClients;
        this.analysisMode = b.analysisMode;
        this.dataSourceType = b.dataSourceType;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.performance = b.performance;
    }

    /**
     * Summarize a batch of records into a snapshot.
     *
     * <p>
     * Queries per second is derived from the batch's time span; the snapshot
     * carries no response-time figures because records do not include them.
     * </p>
     *
     * @param records        the batch; must not be {@code null}
     * @param analysisMode   free-form mode label
     * @param dataSourceType collector label (e.g. {@code file}, {@code api})
     * @param at             snapshot timestamp
     * @return a new snapshot
     */
    public static MetricsSnapshot summarize(Collection<QueryRecord> records, String analysisMode,
                                            String dataSourceType, Instant at) {
        Objects.requireNonNull(records, "records must not be null");
        long unique = records.stream().map(QueryRecord::getClient).distinct().count();

        Builder builder = builder()
                .totalQueries(records.size())
                .uniqueClients((int) unique)
                .analysisMode(analysisMode)
                .dataSourceType(dataSourceType)
                .timestamp(at);

        Optional<Instant> first = records.stream().map(QueryRecord::getTimestamp).min(Instant::compareTo);
        Optional<Instant> last = records.stream().map(QueryRecord::getTimestamp).max(Instant::compareTo);
        if (first.isPresent()) {
            long seconds = Duration.between(first.get(), last.get()).getSeconds();
            if (seconds > 0) {
                builder.performance(new PerformanceMetrics(0, (double) records.size() / seconds, 0));
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getTotalQueries() {
        return totalQueries;
    }

    public int getUniqueClients() {
        return uniqueClients;
    }

    public String getAnalysisMode() {
        return analysisMode;
    }

    public String getDataSourceType() {
        return dataSourceType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Optional<PerformanceMetrics> getPerformance() {
        return Optional.ofNullable(performance);
    }

    /**
     * Fluent builder for {@link MetricsSnapshot}. The timestamp defaults to
     * {@link Instant#now()}.
     */
    public static class Builder {
        private long totalQueries;
        private int uniqueClients;
        private String analysisMode = "";
        private String dataSourceType = "";
        private Instant timestamp = Instant.now();
        private PerformanceMetrics performance;

        public Builder totalQueries(long v) {
            this.totalQueries = v;
            return this;
        }

        public Builder uniqueClients(int v) {
            this.uniqueClients = v;
            return this;
        }

        public Builder analysisMode(String v) {
            this.analysisMode = v;
            return this;
        }

        public Builder dataSourceType(String v) {
            this.dataSourceType = v;
            return this;
        }

        public Builder timestamp(Instant v) {
            this.timestamp = v;
            return this;
        }

        public Builder performance(PerformanceMetrics v) {
            this.performance = v;
            return this;
        }

        public MetricsSnapshot build() {
            return new MetricsSnapshot(this);
        }
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{" +
                "totalQueries=" + totalQueries +
                ", uniqueClients=" + uniqueClients +
                ", analysisMode='" + analysisMode + '\'' +
                ", dataSourceType='" + dataSourceType + '\'' +
                ", timestamp=" + timestamp +
                ", performance=" + performance +
                '}';
    }
}
