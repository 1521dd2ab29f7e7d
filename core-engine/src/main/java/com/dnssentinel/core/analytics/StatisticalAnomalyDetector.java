package com.dnssentinel.core.analytics;

import com.dnssentinel.core.config.AnalyticsConfig.AnomalyDetectionSettings;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalySeverity;
import com.dnssentinel.core.model.AnomalyType;
import com.dnssentinel.core.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Z-score based anomaly detector over DNS query batches.
 *
 * <h3>Training</h3>
 * <p>
 * Records are bucketed by the configured granularity. The model keeps the
 * mean and sample standard deviation of bucket counts per hour of day and
 * overall, plus the share of queries held by every domain, client and hour of
 * day.
 * </p>
 *
 * <h3>Detection</h3>
 * <ul>
 * <li><b>volume_spike</b>: a bucket whose count exceeds
 * {@code mean + k * stddev}; score is the z-score, severity follows
 * {@link AnomalySeverity#fromZScore(double)}</li>
 * <li><b>unusual_domain</b> / <b>unusual_client</b>: an entity absent from
 * training with enough batch queries, or a known entity whose batch share is
 * an outlier under a binomial model of its training share</li>
 * <li><b>time_pattern</b>: an hour of day whose batch share is an outlier
 * against training; only evaluated when the batch reaches the training
 * minimum</li>
 * </ul>
 * <p>
 * Every anomaly is then filtered by {@code minConfidence}, regardless of type.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalAnomalyDetector.class);

    static final String MODEL_NAME = "statistical-baseline";
    static final String MODEL_VERSION = "1.0";

    private final AnomalyDetectionSettings settings;
    private final ZoneId zone;
    private final Clock clock;

    private volatile AnomalyDetectionModel model;

    public StatisticalAnomalyDetector(AnomalyDetectionSettings settings) {
        this(settings, ZoneOffset.UTC, Clock.systemUTC());
    }

    /**
     * @param settings detector configuration; must not be {@code null}
     * @param zone     zone used to derive hour of day
     * @param clock    source of training timestamps
     */
    public StatisticalAnomalyDetector(AnomalyDetectionSettings settings, ZoneId zone, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    @Override
    public void train(List<QueryRecord> records) {
        Objects.requireNonNull(records, "Training records must not be null");
        if (records.size() < settings.getMinTrainingSize()) {
            throw new InsufficientDataException("Training", settings.getMinTrainingSize(), records.size());
        }

        Duration bucketSize = settings.bucketDuration();
        NavigableMap<Instant, Long> buckets = TimeBuckets.counts(records, bucketSize);

        Map<Integer, List<Long>> countsByHour = new HashMap<>();
        buckets.forEach((start, count) -> countsByHour
                .computeIfAbsent(TimeBuckets.hourOfDay(start, zone), h -> new ArrayList<>())
                .add(count));
        Map<Integer, BucketStatistics> hourly = new HashMap<>();
        countsByHour.forEach((hour, counts) -> hourly.put(hour, BucketStatistics.of(counts)));

        long total = records.size();
        AnomalyDetectionModel trained = new AnomalyDetectionModel(
                bucketSize,
                hourly,
                BucketStatistics.of(buckets.values()),
                TimeBuckets.shares(TimeBuckets.countBy(records, QueryRecord::normalizedDomain), total),
                TimeBuckets.shares(TimeBuckets.countBy(records, QueryRecord::getClient), total),
                TimeBuckets.shares(TimeBuckets.countBy(records,
                        r -> TimeBuckets.hourOfDay(r.getTimestamp(), zone)), total),
                records.size(),
                clock.instant());
        this.model = trained;

        LOG.info("Trained anomaly model on {} records ({} buckets, {} domains, {} clients)",
                records.size(), buckets.size(), trained.getKnownDomains().size(),
                trained.getKnownClients().size());
    }

    @Override
    public boolean isTrained() {
        return model != null;
    }

    @Override
    public List<Anomaly> detectAnomalies(List<QueryRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        AnomalyDetectionModel current = model;
        if (current == null) {
            throw new ModelNotTrainedException("Anomaly detector has not been trained");
        }
        if (records.isEmpty()) {
            return List.of();
        }

        Set<AnomalyType> enabled = settings.enabledTypes();
        Instant batchEnd = records.stream().map(QueryRecord::getTimestamp).max(Instant::compareTo).orElseThrow();
        List<Anomaly> found = new ArrayList<>();

        if (enabled.contains(AnomalyType.VOLUME_SPIKE)) {
            detectVolumeSpikes(current, records, found);
        }
        if (enabled.contains(AnomalyType.UNUSUAL_DOMAIN)) {
            detectUnusualEntities(AnomalyType.UNUSUAL_DOMAIN,
                    TimeBuckets.countBy(records, QueryRecord::normalizedDomain), records.size(),
                    current.getDomainShares(), settings.getNewDomainMinQueries(), batchEnd, found);
        }
        if (enabled.contains(AnomalyType.UNUSUAL_CLIENT)) {
            detectUnusualEntities(AnomalyType.UNUSUAL_CLIENT,
                    TimeBuckets.countBy(records, QueryRecord::getClient), records.size(),
                    current.getClientShares(), settings.getNewClientMinQueries(), batchEnd, found);
        }
        if (enabled.contains(AnomalyType.TIME_PATTERN)) {
            detectTimePatterns(current, records, batchEnd, found);
        }

        List<Anomaly> result = found.stream()
                .filter(a -> a.getConfidence() >= settings.getMinConfidence())
                .toList();
        LOG.debug("Detected {} anomalies ({} before confidence filter) in {} records",
                result.size(), found.size(), records.size());
        return result;
    }

    @Override
    public Optional<ModelInfo> getModelInfo() {
        AnomalyDetectionModel current = model;
        if (current == null) {
            return Optional.empty();
        }
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("bucketSize", current.getBucketSize().toString());
        parameters.put("volumeSpikeMultiplier", settings.getVolumeSpikeMultiplier());
        parameters.put("outlierZScore", settings.getOutlierZScore());
        parameters.put("minConfidence", settings.getMinConfidence());
        parameters.put("baselineMean", current.getOverallVolume().getMean());
        parameters.put("baselineStdDev", current.getOverallVolume().getStdDev());
        return Optional.of(new ModelInfo(MODEL_NAME, MODEL_VERSION, current.getTrainedAt(),
                current.getSampleCount(), parameters));
    }

    /**
     * Classify {@code value} against a baseline using the z-score breakpoints.
     *
     * @return the severity tier, or empty when the value is not reportable
     */
    public static Optional<AnomalySeverity> classify(double value, double mean, double stdDev) {
        if (stdDev <= 0) {
            return value > mean ? Optional.of(AnomalySeverity.CRITICAL) : Optional.empty();
        }
        return AnomalySeverity.fromZScore((value - mean) / stdDev);
    }

    // ---------------------------------------------------------------
    // Volume spikes
    // ---------------------------------------------------------------

    private void detectVolumeSpikes(AnomalyDetectionModel current, List<QueryRecord> records,
                                    List<Anomaly> out) {
        double k = settings.getVolumeSpikeMultiplier();
        NavigableMap<Instant, Long> buckets = TimeBuckets.counts(records, current.getBucketSize());

        buckets.forEach((start, count) -> {
            BucketStatistics baseline = current.volumeBaseline(TimeBuckets.hourOfDay(start, zone));
            double stdDev = baseline.effectiveStdDev();
            if (count <= baseline.getMean() + k * stdDev) {
                return;
            }
            double z = (count - baseline.getMean()) / stdDev;
            AnomalySeverity.fromZScore(z).ifPresent(severity -> out.add(Anomaly.builder()
                    .id(AnomalyType.VOLUME_SPIKE.code() + "-" + start.getEpochSecond())
                    .type(AnomalyType.VOLUME_SPIKE)
                    .severity(severity)
                    .score(z)
                    .confidence(confidenceForZScore(z))
                    .timestamp(start)
                    .description(String.format(
                            "Query volume %d in bucket starting %s is %.1f standard deviations above baseline %.1f",
                            count, start, z, baseline.getMean()))
                    .putMetadata("bucket_start", start.toString())
                    .putMetadata("query_count", count)
                    .putMetadata("baseline_mean", baseline.getMean())
                    .putMetadata("baseline_stddev", stdDev)
                    .build()));
        });
    }

    // ---------------------------------------------------------------
    // Domains / clients
    // ---------------------------------------------------------------

    private void detectUnusualEntities(AnomalyType type, Map<String, Long> batchCounts, long total,
                                       Map<String, Double> trainingShares, int newEntityMinQueries,
                                       Instant at, List<Anomaly> out) {
        String label = type == AnomalyType.UNUSUAL_DOMAIN ? "Domain" : "Client";

        batchCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> {
                    String key = entry.getKey();
                    long count = entry.getValue();
                    Double share = trainingShares.get(key);

                    Anomaly.Builder builder = null;
                    if (share == null) {
                        if (count >= newEntityMinQueries) {
                            builder = newEntity(count, total, newEntityMinQueries)
                                    .description(String.format("%s %s was not seen during training (%d queries)",
                                            label, key, count));
                        }
                    } else {
                        double z = shareZScore(count, total, share);
                        if (z >= settings.getOutlierZScore()) {
                            Optional<AnomalySeverity> severity = AnomalySeverity.fromZScore(z);
                            if (severity.isPresent()) {
                                builder = Anomaly.builder()
                                        .severity(severity.get())
                                        .score(z)
                                        .confidence(confidenceForZScore(z))
                                        .description(String.format(
                                                "%s %s received %d queries, %.1f standard deviations above its usual %.2f%% share",
                                                label, key, count, z, share * 100))
                                        .putMetadata("training_share", share);
                            }
                        }
                    }

                    if (builder != null) {
                        builder.id(type.code() + "-" + key + "-" + at.getEpochSecond())
                                .type(type)
                                .timestamp(at)
                                .putMetadata("query_count", count);
                        if (type == AnomalyType.UNUSUAL_DOMAIN) {
                            builder.domain(key);
                        } else {
                            builder.client(key);
                        }
                        out.add(builder.build());
                    }
                });
    }

    /**
     * Entity absent from training: severity by its share of the batch, score
     * as a multiple of the minimum query count.
     */
    private static Anomaly.Builder newEntity(long count, long total, int minQueries) {
        double batchShare = (double) count / total;
        AnomalySeverity severity;
        double confidence;
        if (batchShare >= 0.25) {
            severity = AnomalySeverity.HIGH;
            confidence = 0.8;
        } else if (batchShare >= 0.10) {
            severity = AnomalySeverity.MEDIUM;
            confidence = 0.7;
        } else {
            severity = AnomalySeverity.LOW;
            confidence = 0.6;
        }
        return Anomaly.builder()
                .severity(severity)
                .score((double) count / minQueries)
                .confidence(confidence)
                .putMetadata("first_seen", true)
                .putMetadata("batch_share", batchShare);
    }

    // ---------------------------------------------------------------
    // Time of day
    // ---------------------------------------------------------------

    private void detectTimePatterns(AnomalyDetectionModel current, List<QueryRecord> records, Instant at,
                                    List<Anomaly> out) {
        if (records.size() < settings.getMinTrainingSize()) {
            LOG.trace("Skipping time pattern detection: {} records below minimum {}",
                    records.size(), settings.getMinTrainingSize());
            return;
        }
        Map<Integer, Long> byHour = TimeBuckets.countBy(records, r -> TimeBuckets.hourOfDay(r.getTimestamp(), zone));
        byHour.forEach((hour, count) -> {
            Double share = current.getHourShares().get(hour);
            if (share == null) {
                return;
            }
            double z = shareZScore(count, records.size(), share);
            if (z < settings.getOutlierZScore()) {
                return;
            }
            AnomalySeverity.fromZScore(z).ifPresent(severity -> out.add(Anomaly.builder()
                    .id(AnomalyType.TIME_PATTERN.code() + "-" + hour + "-" + at.getEpochSecond())
                    .type(AnomalyType.TIME_PATTERN)
                    .severity(severity)
                    .score(z)
                    .confidence(confidenceForZScore(z))
                    .timestamp(at)
                    .description(String.format("Activity at %02d:00 is %.1f standard deviations above its usual %.2f%% share",
                            hour, z, share * 100))
                    .putMetadata("hour", hour)
                    .putMetadata("query_count", count)
                    .build()));
        });
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    /**
     * Z-score of observing {@code count} out of {@code total} when the
     * expected share is {@code share} (binomial approximation).
     */
    static double shareZScore(long count, long total, double share) {
        double expected = total * share;
        double stdDev = Math.max(Math.sqrt(total * share * (1 - share)), 1.0);
        return (count - expected) / stdDev;
    }

    /**
     * Monotonically non-decreasing in {@code z}: 0.7 at z = 2, capped at 0.99.
     */
    static double confidenceForZScore(double z) {
        return Math.max(0, Math.min(0.99, 0.5 + z / 10.0));
    }
}
