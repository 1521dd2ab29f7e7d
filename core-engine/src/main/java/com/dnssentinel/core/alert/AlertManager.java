package com.dnssentinel.core.alert;

import com.dnssentinel.core.alert.notify.NotificationException;
import com.dnssentinel.core.alert.notify.NotificationHandler;
import com.dnssentinel.core.alert.notify.NotificationHandlers;
import com.dnssentinel.core.alert.storage.AlertFilter;
import com.dnssentinel.core.alert.storage.AlertStorage;
import com.dnssentinel.core.alert.storage.AlertStorages;
import com.dnssentinel.core.analytics.AnalyticsResult;
import com.dnssentinel.core.analytics.AnalyticsSummary;
import com.dnssentinel.core.config.AlertConfig;
import com.dnssentinel.core.config.StorageConfig;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalyType;
import com.dnssentinel.core.model.MetricsSnapshot;
import com.dnssentinel.core.model.PerformanceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Turns analytics output into alerts: ingests high-confidence anomalies,
 * evaluates threshold rules, persists alerts and dispatches notifications.
 *
 * <h3>Processing order</h3>
 * <p>
 * Within one {@link #processData} call every anomaly-derived alert is fired
 * before any rule is evaluated. A failing anomaly or rule is logged and
 * counted; it never aborts the rest of the batch.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Rules, active alerts and notification handlers
 * each sit behind their own read/write lock, so changing a rule never blocks
 * firing an alert. Notification sends run outside every lock, sequentially
 * per alert in the channel order of its rule.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #initialize()} builds storage, handlers and rules and starts the
 * periodic storage cleanup. {@link #close()} stops the manager, cancels the
 * cleanup and closes storage.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertManager.class);

    /** Anomalies at or above this confidence become alerts directly. */
    public static final double ML_CONFIDENCE_THRESHOLD = 0.7;
    public static final String ML_SOURCE = "ml-engine";
    static final String RULE_SOURCE_PREFIX = "rule:";
    static final String RULE_TAG = "rule-triggered";

    private final AlertConfig config;
    private final Clock clock;
    private final Function<StorageConfig, AlertStorage> storageFactory;
    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final ReentrantReadWriteLock rulesLock = new ReentrantReadWriteLock();

    private final Map<String, Alert> activeAlerts = new LinkedHashMap<>();
    private final ReentrantReadWriteLock activeLock = new ReentrantReadWriteLock();

    private final Map<NotificationChannel, NotificationHandler> handlers = new EnumMap<>(NotificationChannel.class);
    private final ReentrantReadWriteLock handlersLock = new ReentrantReadWriteLock();

    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();

    private volatile AlertStorage storage;
    private volatile boolean running;
    private volatile Instant lastEvaluation;
    private ScheduledExecutorService cleanupExecutor;

    public AlertManager(AlertConfig config) {
        this(config, Clock.systemUTC(), null);
    }

    /**
     * @param storageFactory builds the storage backend; {@code null} selects
     *                       the backend from configuration
     */
    public AlertManager(AlertConfig config, Clock clock, Function<StorageConfig, AlertStorage> storageFactory) {
        this.config = Objects.requireNonNull(config, "AlertConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.storageFactory = storageFactory != null ? storageFactory : sc -> AlertStorages.create(sc, clock);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Build storage, notification handlers and the configured rule set.
     * Does nothing when alerts are disabled.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public synchronized void initialize() {
        if (!config.isEnabled()) {
            LOG.info("Alerting is disabled - alert manager not started");
            return;
        }
        config.validate();

        this.storage = storageFactory.apply(config.getStorage());

        Map<NotificationChannel, NotificationHandler> created = NotificationHandlers.createAll(config.getNotifications());
        handlersLock.writeLock().lock();
        try {
            handlers.putAll(created);
        } finally {
            handlersLock.writeLock().unlock();
        }

        List<AlertRule> configured = config.toRules();
        rulesLock.writeLock().lock();
        try {
            configured.forEach(rule -> rules.put(rule.getId(), rule));
        } finally {
            rulesLock.writeLock().unlock();
        }

        Duration interval = config.getStorage().cleanupIntervalDuration();
        if (!interval.isZero()) {
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "alert-storage-cleanup");
                t.setDaemon(true);
                return t;
            });
            cleanupExecutor.scheduleAtFixedRate(this::runCleanup,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }

        running = true;
        LOG.info("Alert manager started: {} rule(s), storage={}, maxActiveAlerts={}, cooldownEnforced={}",
                configured.size(), config.getStorage().getType(), config.getMaxActiveAlerts(),
                config.isCooldownEnforced());
    }

    /**
     * Stop processing, cancel the storage cleanup and close storage.
     */
    @Override
    public synchronized void close() {
        if (!running && storage == null) {
            return;
        }
        running = false;
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            cleanupExecutor = null;
        }
        AlertStorage current = storage;
        storage = null;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close alert storage: {}", e.getMessage(), e);
            }
        }
        LOG.info("Alert manager stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    /**
     * Ingest one analytics cycle.
     *
     * @param metrics collector metrics; may be {@code null}
     * @param result  analytics output; may be {@code null}
     * @return alerts created by this call, anomaly-derived first
     */
    public List<Alert> processData(MetricsSnapshot metrics, AnalyticsResult result) {
        if (!running) {
            LOG.debug("Alert manager not running - ignoring data");
            return List.of();
        }
        List<Alert> created = new ArrayList<>();

        if (result != null) {
            for (Anomaly anomaly : result.getAnomalies()) {
                if (anomaly.getConfidence() < ML_CONFIDENCE_THRESHOLD) {
                    continue;
                }
                try {
                    Alert alert = anomalyAlert(anomaly);
                    created.add(alert);
                    fireQuietly(alert);
                } catch (RuntimeException e) {
                    errorCount.incrementAndGet();
                    LOG.warn("Failed to create alert for anomaly {}: {}", anomaly.getId(), e.getMessage(), e);
                }
            }
        }

        Map<String, Object> snapshot = buildSnapshot(metrics, result);
        for (AlertRule rule : getRules()) {
            if (!rule.isEnabled()) {
                continue;
            }
            try {
                Alert alert = evaluateRule(rule, snapshot);
                if (alert != null) {
                    created.add(alert);
                    fireQuietly(alert);
                }
            } catch (RuntimeException e) {
                errorCount.incrementAndGet();
                LOG.warn("Rule '{}' evaluation failed: {}", rule.getId(), e.getMessage(), e);
            }
        }

        lastEvaluation = clock.instant();
        LOG.debug("Processed data: {} alert(s) created", created.size());
        return created;
    }

    /**
     * Persist, activate and notify an alert.
     *
     * <p>
     * A storage failure is logged and does not stop the alert. When the
     * active index is full the alert is stored as
     * {@link AlertStatus#SUPPRESSED} and not notified. Every channel is
     * attempted even after a failure.
     * </p>
     *
     * @throws NotificationException the last channel failure, if any channel
     *                               failed
     */
    public void fireAlert(Alert alert) throws NotificationException {
        Objects.requireNonNull(alert, "Alert must not be null");

        persist(alert);
        if (!activate(alert)) {
            alert.markSuppressed();
            updateStored(alert);
            LOG.warn("Active alert limit {} reached - alert {} suppressed", config.getMaxActiveAlerts(), alert.getId());
            return;
        }
        LOG.info("Alert fired: [{}] {} (id={}, source={})",
                alert.getSeverity().code(), alert.getTitle(), alert.getId(), alert.getSource());

        NotificationException last = null;
        for (NotificationChannel channel : channelsFor(alert)) {
            NotificationHandler handler = handler(channel);
            try {
                if (handler == null) {
                    throw new NotificationException(channel, "no handler registered");
                }
                handler.send(alert);
                alert.addNotification(NotificationRecord.delivered(channel, clock.instant()));
            } catch (NotificationException e) {
                alert.addNotification(NotificationRecord.failed(channel, clock.instant(), e.getMessage()));
                LOG.warn("Notification for alert {} failed: {}", alert.getId(), e.getMessage());
                last = e;
            } catch (RuntimeException e) {
                alert.addNotification(NotificationRecord.failed(channel, clock.instant(), e.getMessage()));
                LOG.warn("Notification handler {} threw for alert {}", channel.code(), alert.getId(), e);
                last = new NotificationException(channel, "handler error: " + e.getMessage(), e);
            }
        }
        updateStored(alert);

        if (last != null) {
            throw last;
        }
    }

    /**
     * @throws NotFoundException if {@code id} is not an active alert
     */
    public void resolveAlert(String id) {
        Alert alert;
        activeLock.writeLock().lock();
        try {
            alert = activeAlerts.remove(id);
        } finally {
            activeLock.writeLock().unlock();
        }
        if (alert == null) {
            throw new NotFoundException("Active alert", id);
        }
        alert.markResolved(clock.instant());
        updateStored(alert);
        LOG.info("Alert resolved: {} ({})", alert.getId(), alert.getTitle());
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return active alerts, newest first
     */
    public List<Alert> getActiveAlerts() {
        activeLock.readLock().lock();
        try {
            List<Alert> result = new ArrayList<>(activeAlerts.values());
            result.sort(Comparator.comparing(Alert::getTimestamp).reversed());
            return result;
        } finally {
            activeLock.readLock().unlock();
        }
    }

    /**
     * @param limit maximum alerts to return; 0 for all
     * @return stored alerts of every status, newest first
     */
    public List<Alert> getAlertHistory(int limit) {
        AlertStorage current = storage;
        if (current == null) {
            return List.of();
        }
        return current.list(AlertFilter.latest(limit));
    }

    public List<AlertRule> getRules() {
        rulesLock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            rulesLock.readLock().unlock();
        }
    }

    /**
     * Insert or replace a rule by ID.
     */
    public void updateRule(AlertRule rule) {
        Objects.requireNonNull(rule, "Rule must not be null");
        AlertRule previous;
        rulesLock.writeLock().lock();
        try {
            previous = rules.put(rule.getId(), rule);
        } finally {
            rulesLock.writeLock().unlock();
        }
        LOG.info("Rule {}: {}", previous == null ? "added" : "updated", rule.getId());
    }

    /**
     * @throws NotFoundException if no rule has that ID
     */
    public void removeRule(String id) {
        AlertRule removed;
        rulesLock.writeLock().lock();
        try {
            removed = rules.remove(id);
        } finally {
            rulesLock.writeLock().unlock();
        }
        if (removed == null) {
            throw new NotFoundException("Rule", id);
        }
        lastFired.remove(id);
        LOG.info("Rule removed: {}", id);
    }

    /**
     * Register or replace the handler for its channel.
     */
    public void registerHandler(NotificationHandler handler) {
        Objects.requireNonNull(handler, "Handler must not be null");
        handlersLock.writeLock().lock();
        try {
            handlers.put(handler.channel(), handler);
        } finally {
            handlersLock.writeLock().unlock();
        }
    }

    /**
     * Send a test alert on one channel.
     *
     * @throws NotFoundException     if the channel has no handler
     * @throws NotificationException if the test alert was not delivered
     */
    public void testNotification(NotificationChannel channel) throws NotificationException {
        NotificationHandler handler = handler(channel);
        if (handler == null) {
            throw new NotFoundException("Notification channel", channel.code());
        }
        handler.testConnectivity();
        LOG.info("Test notification delivered on {}", channel.code());
    }

    /**
     * Live status; never throws.
     */
    public ManagerStatus getStatus() {
        int active;
        activeLock.readLock().lock();
        try {
            active = activeAlerts.size();
        } finally {
            activeLock.readLock().unlock();
        }
        int ruleCount;
        rulesLock.readLock().lock();
        try {
            ruleCount = rules.size();
        } finally {
            rulesLock.readLock().unlock();
        }

        int total = active;
        AlertStorage current = storage;
        if (current != null) {
            try {
                total = current.list(AlertFilter.all()).size();
            } catch (RuntimeException e) {
                LOG.warn("Could not count stored alerts: {}", e.getMessage());
            }
        }

        long errors = errorCount.get();
        ManagerHealth health = !running ? ManagerHealth.STOPPED
                : errors > 0 ? ManagerHealth.ERRORS : ManagerHealth.HEALTHY;
        return new ManagerStatus(running, active, total, ruleCount, lastEvaluation, errors, health);
    }

    // ---------------------------------------------------------------
    // Snapshot
    // ---------------------------------------------------------------

    /**
     * Flatten metrics and analytics into the field map rules are evaluated
     * against.
     */
    static Map<String, Object> buildSnapshot(MetricsSnapshot metrics, AnalyticsResult result) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        if (metrics != null) {
            snapshot.put("total_queries", metrics.getTotalQueries());
            snapshot.put("unique_clients", metrics.getUniqueClients());
            putIfPresent(snapshot, "analysis_mode", metrics.getAnalysisMode());
            putIfPresent(snapshot, "data_source_type", metrics.getDataSourceType());
            putIfPresent(snapshot, "timestamp", metrics.getTimestamp());
            metrics.getPerformance().ifPresent((PerformanceMetrics p) -> {
                snapshot.put("average_response_time", p.getAverageResponseTime());
                snapshot.put("queries_per_second", p.getQueriesPerSecond());
                snapshot.put("slow_queries", p.getSlowQueries());
            });
        }
        if (result != null) {
            List<Anomaly> anomalies = result.getAnomalies();
            AnalyticsSummary summary = result.getSummary();
            snapshot.put("anomaly_count", anomalies.size());
            snapshot.put("health_score", summary.getHealthScore());
            snapshot.put("high_severity_anomalies", summary.getHighSeverityCount());

            Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
            Set<String> types = new LinkedHashSet<>();
            for (Anomaly anomaly : anomalies) {
                byType.merge(anomaly.getType(), 1, Integer::sum);
                types.add(anomaly.getType().code());
            }
            for (AnomalyType type : AnomalyType.values()) {
                snapshot.put("anomaly_" + type.code(), byType.getOrDefault(type, 0));
            }
            snapshot.put("anomaly_types", List.copyOf(types));
        }
        return snapshot;
    }

    private static void putIfPresent(Map<String, Object> snapshot, String key, Object value) {
        if (value != null) {
            snapshot.put(key, value);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Alert evaluateRule(AlertRule rule, Map<String, Object> snapshot) {
        Instant now = clock.instant();
        if (config.isCooldownEnforced() && inCooldown(rule, now)) {
            LOG.trace("Rule '{}' in cooldown - skipped", rule.getId());
            return null;
        }
        if (!evaluator.evaluateConditions(rule.getConditions(), snapshot)) {
            return null;
        }
        if (!claimFiring(rule, now)) {
            LOG.trace("Rule '{}' fired concurrently - skipped", rule.getId());
            return null;
        }

        List<String> triggered = new ArrayList<>();
        rule.getConditions().forEach(c -> triggered.add(c.describe()));

        String description = rule.getDescription().isEmpty()
                ? "Rule '" + rule.getName() + "' triggered: " + String.join(" AND ", triggered)
                : rule.getDescription();
        Alert.Builder builder = Alert.builder()
                .id(nextId())
                .type(rule.getType())
                .severity(rule.getSeverity())
                .title(rule.getName())
                .description(description)
                .timestamp(now)
                .source(RULE_SOURCE_PREFIX + rule.getId())
                .metadata("rule_id", rule.getId())
                .metadata("rule_name", rule.getName())
                .metadata("triggered_conditions", triggered)
                .tags(rule.getTags())
                .tag(RULE_TAG);
        if (!rule.getCooldown().isZero()) {
            builder.suppressUntil(now.plus(rule.getCooldown()));
        }
        return builder.build();
    }

    /**
     * Record {@code now} as the rule's last firing unless another caller
     * already fired it within the cooldown.
     *
     * @return {@code true} when this caller owns the firing
     */
    private boolean claimFiring(AlertRule rule, Instant now) {
        if (!config.isCooldownEnforced()) {
            lastFired.put(rule.getId(), now);
            return true;
        }
        boolean[] claimed = new boolean[1];
        lastFired.compute(rule.getId(), (id, last) -> {
            if (last != null && !rule.getCooldown().isZero() && now.isBefore(last.plus(rule.getCooldown()))) {
                return last;
            }
            claimed[0] = true;
            return now;
        });
        return claimed[0];
    }

    private boolean inCooldown(AlertRule rule, Instant now) {
        Instant last = lastFired.get(rule.getId());
        return last != null && !rule.getCooldown().isZero() && now.isBefore(last.plus(rule.getCooldown()));
    }

    private Alert anomalyAlert(Anomaly anomaly) {
        String type = anomaly.getType().code();
        return Alert.builder()
                .id(nextId())
                .type(AlertType.ANOMALY)
                .severity(AlertSeverity.fromAnomalySeverity(anomaly.getSeverity()))
                .title("ML Anomaly Detected: " + type)
                .description(anomaly.getDescription())
                .timestamp(clock.instant())
                .source(ML_SOURCE)
                .client(anomaly.getClient())
                .domain(anomaly.getDomain())
                .metadata("anomaly_id", anomaly.getId())
                .metadata("anomaly_type", type)
                .metadata("ml_metadata", anomaly.getMetadata())
                .tag("ml")
                .tag("anomaly")
                .tag(type)
                .anomaly(anomaly)
                .mlScore(anomaly.getScore())
                .mlConfidence(anomaly.getConfidence())
                .build();
    }

    private void fireQuietly(Alert alert) {
        try {
            fireAlert(alert);
        } catch (NotificationException e) {
            LOG.warn("Alert {} fired with notification failure: {}", alert.getId(), e.getMessage());
        }
    }

    private boolean activate(Alert alert) {
        activeLock.writeLock().lock();
        try {
            if (activeAlerts.size() >= config.getMaxActiveAlerts()) {
                return false;
            }
            activeAlerts.put(alert.getId(), alert);
            return true;
        } finally {
            activeLock.writeLock().unlock();
        }
    }

    private List<NotificationChannel> channelsFor(Alert alert) {
        String source = alert.getSource();
        if (source != null && source.startsWith(RULE_SOURCE_PREFIX)) {
            String ruleId = source.substring(RULE_SOURCE_PREFIX.length());
            AlertRule rule;
            rulesLock.readLock().lock();
            try {
                rule = rules.get(ruleId);
            } finally {
                rulesLock.readLock().unlock();
            }
            if (rule != null && !rule.getChannels().isEmpty()) {
                return rule.getChannels();
            }
        }
        return List.of(NotificationChannel.LOG);
    }

    private NotificationHandler handler(NotificationChannel channel) {
        handlersLock.readLock().lock();
        try {
            return handlers.get(channel);
        } finally {
            handlersLock.readLock().unlock();
        }
    }

    private void persist(Alert alert) {
        AlertStorage current = storage;
        if (current == null) {
            return;
        }
        try {
            current.store(alert);
        } catch (RuntimeException e) {
            LOG.warn("Failed to store alert {}: {}", alert.getId(), e.getMessage(), e);
        }
    }

    private void updateStored(Alert alert) {
        AlertStorage current = storage;
        if (current == null) {
            return;
        }
        try {
            current.update(alert);
        } catch (RuntimeException e) {
            LOG.warn("Failed to update stored alert {}: {}", alert.getId(), e.getMessage());
        }
    }

    private void runCleanup() {
        AlertStorage current = storage;
        if (current == null) {
            return;
        }
        try {
            int removed = current.cleanup();
            if (removed > 0) {
                LOG.info("Storage cleanup removed {} alert(s)", removed);
            }
        } catch (RuntimeException e) {
            LOG.warn("Storage cleanup failed: {}", e.getMessage(), e);
        }
    }

    private String nextId() {
        return "alert_" + clock.millis() + "_" + sequence.incrementAndGet();
    }
}
