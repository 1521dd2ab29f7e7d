package com.dnssentinel.core.analytics;

import com.dnssentinel.core.config.AnalyticsConfig;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Composes an {@link AnomalyDetector} and a {@link TrendAnalyzer} behind a
 * single processing call.
 *
 * <h3>Concurrency</h3>
 * <p>
 * {@link #train(List)} holds the write lock and {@link #process(List)} the
 * read lock, so retraining never overlaps detection while concurrent
 * processing calls proceed in parallel.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Within {@link #process(List)}, a failure of detection, analysis or
 * prediction is logged, recorded in {@link #getStatus()}, and leaves the
 * corresponding part of the result empty.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalyticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsEngine.class);

    static final int MAX_RECORDED_ERRORS = 20;

    private final AnalyticsConfig config;
    private final AnomalyDetector detector;
    private final TrendAnalyzer trendAnalyzer;
    private final Clock clock;

    private final ReentrantReadWriteLock modelLock = new ReentrantReadWriteLock();
    private final Deque<String> recentErrors = new ArrayDeque<>();

    private volatile Instant lastTraining;
    private volatile Instant lastAnalysis;

    /**
     * Engine with the statistical detector and analyzer.
     */
    public AnalyticsEngine(AnalyticsConfig config) {
        this(config, Clock.systemUTC());
    }

    public AnalyticsEngine(AnalyticsConfig config, Clock clock) {
        this(config,
                new StatisticalAnomalyDetector(config.getAnomalyDetection(), config.zoneId(), clock),
                new StatisticalTrendAnalyzer(config.getTrendAnalysis(), config.zoneId(), clock),
                clock);
    }

    public AnalyticsEngine(AnalyticsConfig config, AnomalyDetector detector, TrendAnalyzer trendAnalyzer,
                           Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Train the anomaly detector on a historical batch. A successful training
     * clears the recorded errors.
     *
     * @throws InsufficientDataException if the batch is too small
     */
    public void train(List<QueryRecord> records) {
        modelLock.writeLock().lock();
        try {
            detector.train(records);
            lastTraining = clock.instant();
            synchronized (recentErrors) {
                recentErrors.clear();
            }
        } catch (InsufficientDataException e) {
            recordError("training: " + e.getMessage());
            throw e;
        } finally {
            modelLock.writeLock().unlock();
        }
    }

    /**
     * Detect anomalies, analyze trends and forecast volume for a batch.
     *
     * @param records batch to process; must not be {@code null}
     * @return the combined result, never {@code null}
     */
    public AnalyticsResult process(List<QueryRecord> records) {
        Objects.requireNonNull(records, "Records must not be null");
        modelLock.readLock().lock();
        try {
            List<Anomaly> anomalies = detect(records);
            TrendAnalysis trend = null;
            TrendPrediction prediction = null;

            if (config.getTrendAnalysis().isEnabled()) {
                try {
                    trend = trendAnalyzer.analyzeTrends(records,
                            config.getTrendAnalysis().analysisWindowDuration());
                } catch (RuntimeException e) {
                    LOG.warn("Trend analysis skipped: {}", e.getMessage());
                    recordError("trend analysis: " + e.getMessage());
                }
                try {
                    prediction = trendAnalyzer.predictTrends(records,
                            config.getTrendAnalysis().forecastWindowDuration());
                } catch (RuntimeException e) {
                    LOG.warn("Trend prediction skipped: {}", e.getMessage());
                    recordError("trend prediction: " + e.getMessage());
                }
            }

            Instant now = clock.instant();
            lastAnalysis = now;
            AnalyticsResult result = new AnalyticsResult(anomalies, trend, prediction, now,
                    AnalyticsSummary.of(anomalies, trend));
            LOG.info("Processed {} records: {} anomalies, health score {}",
                    records.size(), anomalies.size(), result.getSummary().getHealthScore());
            return result;
        } finally {
            modelLock.readLock().unlock();
        }
    }

    public boolean isTrained() {
        return detector.isTrained();
    }

    public Optional<ModelInfo> getModelInfo() {
        return detector.getModelInfo();
    }

    public EngineStatus getStatus() {
        List<String> errors;
        synchronized (recentErrors) {
            errors = new ArrayList<>(recentErrors);
        }
        String status;
        if (!detector.isTrained()) {
            status = "untrained";
        } else if (!errors.isEmpty()) {
            status = "degraded";
        } else {
            status = "ready";
        }
        return new EngineStatus(detector.isTrained(), lastTraining, lastAnalysis, status, errors);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Anomaly> detect(List<QueryRecord> records) {
        if (!config.getAnomalyDetection().isEnabled()) {
            return List.of();
        }
        if (!detector.isTrained()) {
            LOG.warn("Anomaly detector not trained - skipping detection for {} records", records.size());
            return List.of();
        }
        try {
            return detector.detectAnomalies(records);
        } catch (RuntimeException e) {
            LOG.warn("Anomaly detection failed: {}", e.getMessage(), e);
            recordError("anomaly detection: " + e.getMessage());
            return List.of();
        }
    }

    private void recordError(String message) {
        synchronized (recentErrors) {
            recentErrors.addLast(message);
            while (recentErrors.size() > MAX_RECORDED_ERRORS) {
                recentErrors.removeFirst();
            }
        }
    }
}
