package com.dnssentinel.core.analytics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of {@link TrendAnalyzer#predictTrends}.
 *
 * @since 1.0.0
 */
public final class TrendPrediction {

    private final Duration forecastWindow;
    private final List<QueryForecast> forecasts;
    private final double confidence;
    private final String methodology;
    private final Instant generatedAt;

    public TrendPrediction(Duration forecastWindow, List<QueryForecast> forecasts, double confidence,
                           String methodology, Instant generatedAt) {
        this.forecastWindow = forecastWindow;
        this.forecasts = List.copyOf(forecasts);
        this.confidence = confidence;
        this.methodology = methodology;
        this.generatedAt = generatedAt;
    }

    public Duration getForecastWindow() {
        return forecastWindow;
    }

    /** Hourly forecasts in strictly increasing timestamp order. */
    public List<QueryForecast> getForecasts() {
        return forecasts;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getMethodology() {
        return methodology;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @Override
    public String toString() {
        return "TrendPrediction{forecastWindow=" + forecastWindow + ", forecasts=" + forecasts.size()
                + ", confidence=" + confidence + ", methodology='" + methodology + "'}";
    }
}
