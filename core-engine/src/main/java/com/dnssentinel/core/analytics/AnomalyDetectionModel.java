package com.dnssentinel.core.analytics;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Baseline learned by {@link StatisticalAnomalyDetector#train}.
 *
 * <p>
 * Immutable; retraining replaces the instance wholesale.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyDetectionModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Duration bucketSize;
    private final Map<Integer, BucketStatistics> hourOfDayVolume;
    private final BucketStatistics overallVolume;
    private final Map<String, Double> domainShares;
    private final Map<String, Double> clientShares;
    private final Map<Integer, Double> hourShares;
    private final int sampleCount;
    private final Instant trainedAt;

    AnomalyDetectionModel(Duration bucketSize,
                          Map<Integer, BucketStatistics> hourOfDayVolume,
                          BucketStatistics overallVolume,
                          Map<String, Double> domainShares,
                          Map<String, Double> clientShares,
                          Map<Integer, Double> hourShares,
                          int sampleCount,
                          Instant trainedAt) {
        this.bucketSize = bucketSize;
        this.hourOfDayVolume = Collections.unmodifiableMap(new HashMap<>(hourOfDayVolume));
        this.overallVolume = overallVolume;
        this.domainShares = Collections.unmodifiableMap(new HashMap<>(domainShares));
        this.clientShares = Collections.unmodifiableMap(new HashMap<>(clientShares));
        this.hourShares = Collections.unmodifiableMap(new HashMap<>(hourShares));
        this.sampleCount = sampleCount;
        this.trainedAt = trainedAt;
    }

    /**
     * Volume baseline for buckets starting at {@code hourOfDay}. Falls back to
     * the overall baseline when the hour has fewer than two training buckets.
     */
    public BucketStatistics volumeBaseline(int hourOfDay) {
        BucketStatistics hourly = hourOfDayVolume.get(hourOfDay);
        return hourly != null && hourly.getSamples() >= 2 ? hourly : overallVolume;
    }

    public Duration getBucketSize() {
        return bucketSize;
    }

    public BucketStatistics getOverallVolume() {
        return overallVolume;
    }

    public Set<String> getKnownDomains() {
        return domainShares.keySet();
    }

    public Set<String> getKnownClients() {
        return clientShares.keySet();
    }

    public Map<String, Double> getDomainShares() {
        return domainShares;
    }

    public Map<String, Double> getClientShares() {
        return clientShares;
    }

    public Map<Integer, Double> getHourShares() {
        return hourShares;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }
}
