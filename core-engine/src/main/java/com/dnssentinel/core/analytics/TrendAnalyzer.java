package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.QueryRecord;

import java.time.Duration;
import java.util.List;

/**
 * Stateless trend analysis and forecasting over a batch of query records.
 */
public interface TrendAnalyzer {

    /**
     * Decompose query volume of the batch into patterns, per-entity trends
     * and insights.
     *
     * @param records batch to analyze
     * @param window  only records within this span of the latest record are
     *                considered; {@link Duration#ZERO} means the whole batch
     * @throws InsufficientDataException below the configured minimum
     */
    TrendAnalysis analyzeTrends(List<QueryRecord> records, Duration window);

    /**
     * Forecast hourly query volume.
     *
     * @param records        history to forecast from
     * @param forecastWindow one forecast point is produced per whole hour
     * @throws InsufficientDataException below the configured minimum
     */
    TrendPrediction predictTrends(List<QueryRecord> records, Duration forecastWindow);
}
