package com.dnssentinel.service;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertManager;
import com.dnssentinel.core.analytics.AnalyticsEngine;
import com.dnssentinel.core.analytics.AnalyticsResult;
import com.dnssentinel.core.analytics.InsufficientDataException;
import com.dnssentinel.core.config.SentinelConfig;
import com.dnssentinel.core.config.SentinelConfigLoader;
import com.dnssentinel.core.model.MetricsSnapshot;
import com.dnssentinel.core.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the DNS Sentinel service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON-lines query log
 *     → QueryRecordReader
 *     → AnalyticsEngine (anomalies, trends, forecast)
 *     → AlertManager (ML alerts, threshold rules, notifications)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via {@link ServiceConfig};
 * analytics and alerting come from YAML via {@link SentinelConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelService.class);

    private final ServiceConfig serviceConfig;
    private final SentinelConfig config;
    private final QueryRecordReader reader = new QueryRecordReader();
    private final AnalyticsEngine engine;
    private final AlertManager alertManager;
    private final HealthServer healthServer;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public SentinelService(ServiceConfig serviceConfig, SentinelConfig config, Clock clock) {
        this.serviceConfig = Objects.requireNonNull(serviceConfig, "serviceConfig must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.engine = new AnalyticsEngine(config.getAnalytics(), clock);
        this.alertManager = new AlertManager(config.getAlerts(), clock, null);
        this.healthServer = new HealthServer(alertManager::getStatus);
    }

    public static void main(String[] args) {
        ServiceConfig serviceConfig = ServiceConfig.fromEnvironment();
        LOG.info("Starting DNS Sentinel with config: {}", serviceConfig);

        SentinelConfig config = loadConfig(serviceConfig);
        SentinelService service = new SentinelService(serviceConfig, config, Clock.systemUTC());
        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "sentinel-shutdown"));
        service.start();

        if (!serviceConfig.isScheduled()) {
            service.close();
        }
    }

    /**
     * Start alerting and the health server, train on the training batch and
     * either run one cycle or schedule the evaluation loop.
     */
    public void start() {
        alertManager.initialize();
        healthServer.start(serviceConfig.getHealthPort());
        train();

        if (serviceConfig.isScheduled()) {
            Duration interval = config.getAlerts().getPerformance().evaluationIntervalDuration();
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "sentinel-evaluation"));
            scheduler.scheduleWithFixedDelay(this::runCycleSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Evaluation loop scheduled every {}", interval);
        } else {
            runCycle();
        }
    }

    /**
     * Train the engine; an undersized batch is logged and leaves the engine
     * untrained so only trend analysis and rules run.
     */
    void train() {
        List<QueryRecord> training = reader.read(Path.of(serviceConfig.getTrainingPath()));
        try {
            engine.train(training);
            LOG.info("Anomaly model trained on {} record(s)", training.size());
        } catch (InsufficientDataException e) {
            LOG.warn("Anomaly model not trained: {}", e.getMessage());
        }
    }

    /**
     * One evaluation cycle over the current records file.
     *
     * @return alerts created in this cycle
     */
    public List<Alert> runCycle() {
        List<QueryRecord> records = reader.read(Path.of(serviceConfig.getRecordsPath()));
        MetricsSnapshot metrics = MetricsSnapshot.summarize(records, serviceConfig.getAnalysisMode(),
                serviceConfig.getDataSource(), clock.instant());
        AnalyticsResult result = engine.process(records);
        List<Alert> alerts = alertManager.processData(metrics, result);
        LOG.info("Cycle complete: {} record(s), {} anomaly(ies), {} alert(s), health score {}",
                records.size(), result.getAnomalies().size(), alerts.size(),
                result.getSummary().getHealthScore());
        return alerts;
    }

    private void runCycleSafely() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            LOG.error("Evaluation cycle failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        alertManager.close();
        healthServer.stop();
    }

    AlertManager alertManager() {
        return alertManager;
    }

    HealthServer healthServer() {
        return healthServer;
    }

    private static SentinelConfig loadConfig(ServiceConfig serviceConfig) {
        String path = serviceConfig.getConfigPath();
        if (path != null && !path.isBlank()) {
            return SentinelConfigLoader.fromFile(path);
        }
        return SentinelConfigLoader.load();
    }
}
