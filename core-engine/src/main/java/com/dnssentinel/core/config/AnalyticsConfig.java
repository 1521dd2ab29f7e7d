package com.dnssentinel.core.config;

import com.dnssentinel.core.model.AnomalyType;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Settings for the analytics engine ({@code analytics:} section of the YAML).
 *
 * <pre>
 * analytics:
 *   timeZone: UTC
 *   anomalyDetection:
 *     minConfidence: 0.7
 *     bucketSize: 1h
 *   trendAnalysis:
 *     smoothingFactor: 0.3
 *     forecastWindow: 6h
 * </pre>
 *
 * @since 1.0.0
 */
public class AnalyticsConfig {

    private String timeZone = "UTC";
    private AnomalyDetectionSettings anomalyDetection = new AnomalyDetectionSettings();
    private TrendAnalysisSettings trendAnalysis = new TrendAnalysisSettings();

    /**
     * Validate both sub-sections, collecting every problem.
     *
     * @throws IllegalStateException if any value is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            ZoneId.of(timeZone);
        } catch (DateTimeException | NullPointerException e) {
            errors.add("Invalid timeZone: '" + timeZone + "'");
        }
        anomalyDetection.collectErrors(errors);
        trendAnalysis.collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Analytics configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public AnomalyDetectionSettings getAnomalyDetection() {
        return anomalyDetection;
    }

    public void setAnomalyDetection(AnomalyDetectionSettings anomalyDetection) {
        this.anomalyDetection = anomalyDetection != null ? anomalyDetection : new AnomalyDetectionSettings();
    }

    public TrendAnalysisSettings getTrendAnalysis() {
        return trendAnalysis;
    }

    public void setTrendAnalysis(TrendAnalysisSettings trendAnalysis) {
        this.trendAnalysis = trendAnalysis != null ? trendAnalysis : new TrendAnalysisSettings();
    }

    // ---------------------------------------------------------------
    // Anomaly detection
    // ---------------------------------------------------------------

    /**
     * Statistical anomaly detector knobs.
     */
    public static class AnomalyDetectionSettings {

        private boolean enabled = true;
        /** Post-filter: anomalies below this confidence are dropped. */
        private double minConfidence = 0.7;
        private int minTrainingSize = 10;
        private String bucketSize = "1h";
        /** Volume spike threshold k in {@code mean + k * stddev}. */
        private double volumeSpikeMultiplier = 2.0;
        /** Minimum z-score for a known domain/client/hour share to count as outlier. */
        private double outlierZScore = 3.0;
        private int newDomainMinQueries = 5;
        private int newClientMinQueries = 10;
        private List<String> anomalyTypes = new ArrayList<>(List.of(
                "volume_spike", "unusual_domain", "unusual_client", "time_pattern"));

        void collectErrors(List<String> errors) {
            if (minConfidence < 0 || minConfidence > 1) {
                errors.add("anomalyDetection.minConfidence must be in [0, 1], got: " + minConfidence);
            }
            if (minTrainingSize < 1) {
                errors.add("anomalyDetection.minTrainingSize must be >= 1, got: " + minTrainingSize);
            }
            if (!Durations.isValid(bucketSize) || Durations.parse(bucketSize).isZero()) {
                errors.add("anomalyDetection.bucketSize must be a positive duration, got: '" + bucketSize + "'");
            }
            if (volumeSpikeMultiplier <= 0) {
                errors.add("anomalyDetection.volumeSpikeMultiplier must be > 0");
            }
            if (outlierZScore <= 0) {
                errors.add("anomalyDetection.outlierZScore must be > 0");
            }
            if (newDomainMinQueries < 1 || newClientMinQueries < 1) {
                errors.add("anomalyDetection new-entity minimums must be >= 1");
            }
            for (String type : anomalyTypes) {
                try {
                    AnomalyType.fromCode(type);
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
        }

        public Duration bucketDuration() {
            return Durations.parse(bucketSize);
        }

        public Set<AnomalyType> enabledTypes() {
            Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
            anomalyTypes.forEach(code -> types.add(AnomalyType.fromCode(code)));
            return types;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public int getMinTrainingSize() {
            return minTrainingSize;
        }

        public void setMinTrainingSize(int minTrainingSize) {
            this.minTrainingSize = minTrainingSize;
        }

        public String getBucketSize() {
            return bucketSize;
        }

        public void setBucketSize(String bucketSize) {
            this.bucketSize = bucketSize;
        }

        public double getVolumeSpikeMultiplier() {
            return volumeSpikeMultiplier;
        }

        public void setVolumeSpikeMultiplier(double volumeSpikeMultiplier) {
            this.volumeSpikeMultiplier = volumeSpikeMultiplier;
        }

        public double getOutlierZScore() {
            return outlierZScore;
        }

        public void setOutlierZScore(double outlierZScore) {
            this.outlierZScore = outlierZScore;
        }

        public int getNewDomainMinQueries() {
            return newDomainMinQueries;
        }

        public void setNewDomainMinQueries(int newDomainMinQueries) {
            this.newDomainMinQueries = newDomainMinQueries;
        }

        public int getNewClientMinQueries() {
            return newClientMinQueries;
        }

        public void setNewClientMinQueries(int newClientMinQueries) {
            this.newClientMinQueries = newClientMinQueries;
        }

        public List<String> getAnomalyTypes() {
            return anomalyTypes;
        }

        public void setAnomalyTypes(List<String> anomalyTypes) {
            this.anomalyTypes = anomalyTypes != null ? new ArrayList<>(anomalyTypes) : new ArrayList<>();
        }
    }

    // ---------------------------------------------------------------
    // Trend analysis
    // ---------------------------------------------------------------

    /**
     * Trend analyzer and forecaster knobs.
     */
    public static class TrendAnalysisSettings {

        private boolean enabled = true;
        private int minDataPoints = 20;
        /** Exponential smoothing factor alpha, in (0, 1). */
        private double smoothingFactor = 0.3;
        private String analysisWindow = "24h";
        private String forecastWindow = "6h";
        /** Uncertainty added per forecast hour, scaled by sqrt(i). */
        private double forecastUncertainty = 5.0;

        void collectErrors(List<String> errors) {
            if (minDataPoints < 1) {
                errors.add("trendAnalysis.minDataPoints must be >= 1, got: " + minDataPoints);
            }
            if (smoothingFactor <= 0 || smoothingFactor >= 1) {
                errors.add("trendAnalysis.smoothingFactor must be in (0, 1), got: " + smoothingFactor);
            }
            if (!Durations.isValid(analysisWindow)) {
                errors.add("trendAnalysis.analysisWindow is not a valid duration: '" + analysisWindow + "'");
            }
            if (!Durations.isValid(forecastWindow)) {
                errors.add("trendAnalysis.forecastWindow is not a valid duration: '" + forecastWindow + "'");
            }
            if (forecastUncertainty < 0) {
                errors.add("trendAnalysis.forecastUncertainty must be >= 0");
            }
        }

        public Duration analysisWindowDuration() {
            return Durations.parse(analysisWindow);
        }

        public Duration forecastWindowDuration() {
            return Durations.parse(forecastWindow);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinDataPoints() {
            return minDataPoints;
        }

        public void setMinDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
        }

        public double getSmoothingFactor() {
            return smoothingFactor;
        }

        public void setSmoothingFactor(double smoothingFactor) {
            this.smoothingFactor = smoothingFactor;
        }

        public String getAnalysisWindow() {
            return analysisWindow;
        }

        public void setAnalysisWindow(String analysisWindow) {
            this.analysisWindow = analysisWindow;
        }

        public String getForecastWindow() {
            return forecastWindow;
        }

        public void setForecastWindow(String forecastWindow) {
            this.forecastWindow = forecastWindow;
        }

        public double getForecastUncertainty() {
            return forecastUncertainty;
        }

        public void setForecastUncertainty(double forecastUncertainty) {
            this.forecastUncertainty = forecastUncertainty;
        }
    }
}
