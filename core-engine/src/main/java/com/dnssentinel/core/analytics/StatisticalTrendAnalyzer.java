package com.dnssentinel.core.analytics;

import com.dnssentinel.core.config.AnalyticsConfig.TrendAnalysisSettings;
import com.dnssentinel.core.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Trend analyzer based on least-squares slope fitting and exponential
 * smoothing.
 *
 * <h3>Direction</h3>
 * <p>
 * The hourly series is classified {@code VOLATILE} when its sample variance
 * exceeds half its mean; otherwise by slope against +/-10% of the mean. Series
 * shorter than three buckets are {@code STABLE}.
 * </p>
 *
 * <h3>Forecast</h3>
 * <p>
 * Smoothed series {@code s[i] = a*x[i] + (1-a)*s[i-1]}; the trend is the mean
 * step over the last five smoothed points; point {@code i} is
 * {@code s[n-1] + trend*i} with a band of {@code sqrt(i) * uncertainty}.
 * Confidence is {@code 1 - MAPE} clamped to [0.1, 0.95].
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalTrendAnalyzer implements TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalTrendAnalyzer.class);

    public static final String METHODOLOGY = "Exponential Smoothing with Linear Trend";

    static final int DOMAIN_MIN_QUERIES = 5;
    static final int CLIENT_MIN_QUERIES = 10;
    static final double DOMAIN_CHANGE_THRESHOLD = 5.0;
    static final double CLIENT_CHANGE_THRESHOLD = 10.0;
    static final int MAX_DOMAIN_TRENDS = 20;
    static final int MAX_CLIENT_TRENDS = 15;
    static final int TREND_LOOKBACK = 5;

    private final TrendAnalysisSettings settings;
    private final ZoneId zone;
    private final Clock clock;

    public StatisticalTrendAnalyzer(TrendAnalysisSettings settings) {
        this(settings, ZoneOffset.UTC, Clock.systemUTC());
    }

    public StatisticalTrendAnalyzer(TrendAnalysisSettings settings, ZoneId zone, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    @Override
    public TrendAnalysis analyzeTrends(List<QueryRecord> records, Duration window) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(window, "Window must not be null");
        List<QueryRecord> inWindow = withinWindow(records, window);
        requireEnough("Trend analysis", inWindow.size());

        double[] series = values(TimeBuckets.counts(inWindow, TimeBuckets.HOUR));
        TrendDirection overall = overallDirection(series);

        List<DomainTrend> domains = domainTrends(inWindow);
        List<ClientTrend> clients = clientTrends(inWindow);
        Map<Integer, Double> hourly = hourlyPattern(inWindow);
        Map<DayOfWeek, Double> daily = dailyPattern(inWindow);
        List<TrendInsight> insights = generateInsights(hourly, daily, domains, clients);

        LOG.debug("Analyzed {} records: trend={}, {} domain trends, {} client trends, {} insights",
                inWindow.size(), overall, domains.size(), clients.size(), insights.size());
        return new TrendAnalysis(window, inWindow.size(), overall, domains, clients, hourly, daily,
                insights, clock.instant());
    }

    @Override
    public TrendPrediction predictTrends(List<QueryRecord> records, Duration forecastWindow) {
        Objects.requireNonNull(records, "Records must not be null");
        Objects.requireNonNull(forecastWindow, "Forecast window must not be null");
        requireEnough("Trend prediction", records.size());

        NavigableMap<Instant, Long> buckets = TimeBuckets.counts(records, TimeBuckets.HOUR);
        double[] raw = values(buckets);
        double[] smoothed = smooth(raw, settings.getSmoothingFactor());

        List<QueryForecast> forecasts = forecast(smoothed, buckets.lastKey(), forecastWindow.toHours());
        double confidence = forecastConfidence(raw, smoothed);

        LOG.debug("Forecast {} points from {} hourly buckets (confidence {})",
                forecasts.size(), raw.length, confidence);
        return new TrendPrediction(forecastWindow, forecasts, confidence, METHODOLOGY, clock.instant());
    }

    // ---------------------------------------------------------------
    // Overall direction
    // ---------------------------------------------------------------

    static TrendDirection overallDirection(double[] series) {
        int n = series.length;
        if (n < 3) {
            return TrendDirection.STABLE;
        }
        double mean = mean(series);
        double variance = 0;
        for (double v : series) {
            variance += (v - mean) * (v - mean);
        }
        variance /= (n - 1);

        double slope = leastSquaresSlope(series);
        if (variance > 0.5 * mean) {
            return TrendDirection.VOLATILE;
        }
        if (slope > 0.1 * mean) {
            return TrendDirection.INCREASING;
        }
        if (slope < -0.1 * mean) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    /**
     * Slope of the least-squares line through {@code (i, series[i])}.
     */
    static double leastSquaresSlope(double[] series) {
        int n = series.length;
        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += series[i];
            sumXY += i * series[i];
            sumXX += (double) i * i;
        }
        double denominator = n * sumXX - sumX * sumX;
        return denominator == 0 ? 0 : (n * sumXY - sumX * sumY) / denominator;
    }

    // ---------------------------------------------------------------
    // Per-entity trends
    // ---------------------------------------------------------------

    private List<DomainTrend> domainTrends(List<QueryRecord> records) {
        Map<String, List<QueryRecord>> byDomain = groupBy(records, QueryRecord::normalizedDomain);
        List<DomainTrend> trends = new ArrayList<>();
        byDomain.forEach((domain, list) -> {
            if (list.size() < DOMAIN_MIN_QUERIES) {
                return;
            }
            double change = changePercent(list);
            boolean blocked = list.stream().anyMatch(QueryRecord::isBlocked);
            trends.add(new DomainTrend(domain, direction(change, DOMAIN_CHANGE_THRESHOLD), change,
                    list.size(), blocked));
        });
        trends.sort(Comparator.comparingLong(DomainTrend::getQueries).reversed()
                .thenComparing(DomainTrend::getDomain));
        return trends.size() > MAX_DOMAIN_TRENDS ? trends.subList(0, MAX_DOMAIN_TRENDS) : trends;
    }

    private List<ClientTrend> clientTrends(List<QueryRecord> records) {
        Map<String, List<QueryRecord>> byClient = groupBy(records, QueryRecord::getClient);
        List<ClientTrend> trends = new ArrayList<>();
        byClient.forEach((client, list) -> {
            if (list.size() < CLIENT_MIN_QUERIES) {
                return;
            }
            double change = changePercent(list);
            trends.add(new ClientTrend(client, direction(change, CLIENT_CHANGE_THRESHOLD), change, list.size()));
        });
        trends.sort(Comparator.comparingLong(ClientTrend::getQueries).reversed()
                .thenComparing(ClientTrend::getClient));
        return trends.size() > MAX_CLIENT_TRENDS ? trends.subList(0, MAX_CLIENT_TRENDS) : trends;
    }

    /**
     * Endpoint slope (last bucket minus first, per elapsed hour) as a
     * percentage of the mean bucket count.
     */
    static double changePercent(List<QueryRecord> records) {
        NavigableMap<Instant, Long> buckets = TimeBuckets.counts(records, TimeBuckets.HOUR);
        if (buckets.size() < 2) {
            return 0;
        }
        double hours = Duration.between(buckets.firstKey(), buckets.lastKey()).toMinutes() / 60.0;
        if (hours == 0) {
            return 0;
        }
        double slope = (buckets.lastEntry().getValue() - buckets.firstEntry().getValue()) / hours;
        double meanPerBucket = (double) records.size() / buckets.size();
        return slope / meanPerBucket * 100;
    }

    private static TrendDirection direction(double changePercent, double threshold) {
        if (changePercent > threshold) {
            return TrendDirection.INCREASING;
        }
        if (changePercent < -threshold) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    // ---------------------------------------------------------------
    // Patterns
    // ---------------------------------------------------------------

    private Map<Integer, Double> hourlyPattern(List<QueryRecord> records) {
        Map<Integer, Double> pattern = new TreeMap<>();
        for (int hour = 0; hour < 24; hour++) {
            pattern.put(hour, 0.0);
        }
        double unit = 1.0 / records.size();
        for (QueryRecord record : records) {
            pattern.merge(TimeBuckets.hourOfDay(record.getTimestamp(), zone), unit, Double::sum);
        }
        return pattern;
    }

    private Map<DayOfWeek, Double> dailyPattern(List<QueryRecord> records) {
        Map<DayOfWeek, Double> pattern = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            pattern.put(day, 0.0);
        }
        double unit = 1.0 / records.size();
        for (QueryRecord record : records) {
            pattern.merge(record.getTimestamp().atZone(zone).getDayOfWeek(), unit, Double::sum);
        }
        return pattern;
    }

    // ---------------------------------------------------------------
    // Insights
    // ---------------------------------------------------------------

    private static List<TrendInsight> generateInsights(Map<Integer, Double> hourly, Map<DayOfWeek, Double> daily,
                                                       List<DomainTrend> domains, List<ClientTrend> clients) {
        List<TrendInsight> insights = new ArrayList<>();

        int peakHour = 0;
        int quietHour = 0;
        for (int hour = 1; hour < 24; hour++) {
            if (hourly.get(hour) > hourly.get(peakHour)) {
                peakHour = hour;
            }
            if (hourly.get(hour) < hourly.get(quietHour)) {
                quietHour = hour;
            }
        }
        if (hourly.get(peakHour) > 0.1) {
            insights.add(new TrendInsight(InsightType.PEAK_USAGE,
                    String.format(Locale.ROOT, "Peak usage occurs at %02d:00 with %.1f%% of daily queries",
                            peakHour, hourly.get(peakHour) * 100),
                    InsightImpact.HIGH, 0.9));
        }
        if (hourly.get(quietHour) < 0.01) {
            insights.add(new TrendInsight(InsightType.OFF_PEAK_USAGE,
                    String.format(Locale.ROOT, "Lowest usage at %02d:00 with %.1f%% of queries",
                            quietHour, hourly.get(quietHour) * 100),
                    InsightImpact.LOW, 0.8));
        }

        double weekendAvg = (daily.get(DayOfWeek.SATURDAY) + daily.get(DayOfWeek.SUNDAY)) / 2;
        double weekdayAvg = 0;
        for (DayOfWeek day : List.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
                DayOfWeek.THURSDAY, DayOfWeek.FRIDAY)) {
            weekdayAvg += daily.get(day);
        }
        weekdayAvg /= 5;
        if (weekdayAvg > 0) {
            double ratio = weekendAvg / weekdayAvg;
            if (ratio < 0.7) {
                insights.add(new TrendInsight(InsightType.WEEKEND_PATTERN,
                        String.format(Locale.ROOT,
                                "Weekend usage is %.0f%% lower than weekdays, typical of a business network",
                                (1 - ratio) * 100),
                        InsightImpact.MEDIUM, 0.8));
            } else if (ratio > 1.3) {
                insights.add(new TrendInsight(InsightType.WEEKEND_PATTERN,
                        String.format(Locale.ROOT,
                                "Weekend usage is %.0f%% higher than weekdays, typical of a home network",
                                (ratio - 1) * 100),
                        InsightImpact.MEDIUM, 0.8));
            }
        }

        for (ClientTrend client : clients) {
            if (Math.abs(client.getChangePercent()) > 50) {
                insights.add(new TrendInsight(InsightType.ANOMALOUS_CLIENT,
                        String.format(Locale.ROOT, "Client %s shows %s activity (%.1f%% change)",
                                client.getClient(), client.getDirection().code(), client.getChangePercent()),
                        InsightImpact.HIGH, 0.7));
            }
        }
        for (DomainTrend domain : domains) {
            if (domain.getChangePercent() > 100 && domain.getQueries() > 20) {
                insights.add(new TrendInsight(InsightType.EMERGING_THREAT,
                        String.format(Locale.ROOT, "Domain %s shows rapid growth: %.1f%% change over %d queries",
                                domain.getDomain(), domain.getChangePercent(), domain.getQueries()),
                        InsightImpact.HIGH, 0.6));
            }
        }
        return insights;
    }

    // ---------------------------------------------------------------
    // Forecasting
    // ---------------------------------------------------------------

    static double[] smooth(double[] raw, double alpha) {
        double[] smoothed = new double[raw.length];
        if (raw.length == 0) {
            return smoothed;
        }
        smoothed[0] = raw[0];
        for (int i = 1; i < raw.length; i++) {
            smoothed[i] = alpha * raw[i] + (1 - alpha) * smoothed[i - 1];
        }
        return smoothed;
    }

    private List<QueryForecast> forecast(double[] smoothed, Instant lastBucket, long points) {
        int n = smoothed.length;
        if (n < 2) {
            return List.of();
        }
        int lookback = Math.min(TREND_LOOKBACK, n);
        double trend = (smoothed[n - 1] - smoothed[n - lookback]) / (lookback - 1);
        double last = smoothed[n - 1];

        List<QueryForecast> forecasts = new ArrayList<>();
        for (int i = 1; i <= points; i++) {
            double value = last + trend * i;
            double uncertainty = Math.sqrt(i) * settings.getForecastUncertainty();
            forecasts.add(new QueryForecast(
                    lastBucket.plus(TimeBuckets.HOUR.multipliedBy(i)),
                    Math.round(Math.max(0, value)),
                    Math.max(0, value - uncertainty),
                    Math.max(0, value + uncertainty)));
        }
        return forecasts;
    }

    /**
     * {@code 1 - MAPE} over points with a non-zero raw value, clamped to
     * [0.1, 0.95]; 0.5 when there is nothing to compare.
     */
    static double forecastConfidence(double[] raw, double[] smoothed) {
        if (raw.length != smoothed.length || raw.length < 2) {
            return 0.5;
        }
        double errorSum = 0;
        int valid = 0;
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] != 0) {
                errorSum += Math.abs(raw[i] - smoothed[i]) / raw[i];
                valid++;
            }
        }
        if (valid == 0) {
            return 0.5;
        }
        return Math.max(0.1, Math.min(0.95, 1 - errorSum / valid));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void requireEnough(String operation, int size) {
        if (size < settings.getMinDataPoints()) {
            throw new InsufficientDataException(operation, settings.getMinDataPoints(), size);
        }
    }

    private static List<QueryRecord> withinWindow(List<QueryRecord> records, Duration window) {
        if (window.isZero() || window.isNegative() || records.isEmpty()) {
            return records;
        }
        Instant latest = records.stream().map(QueryRecord::getTimestamp).max(Instant::compareTo).orElseThrow();
        Instant cutoff = latest.minus(window);
        return records.stream().filter(r -> r.getTimestamp().isAfter(cutoff)).toList();
    }

    private static double[] values(NavigableMap<Instant, Long> buckets) {
        return buckets.values().stream().mapToDouble(Long::doubleValue).toArray();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return values.length == 0 ? 0 : sum / values.length;
    }

    private static <K> Map<K, List<QueryRecord>> groupBy(List<QueryRecord> records,
                                                          Function<QueryRecord, K> key) {
        Map<K, List<QueryRecord>> groups = new HashMap<>();
        for (QueryRecord record : records) {
            groups.computeIfAbsent(key.apply(record), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }
}
