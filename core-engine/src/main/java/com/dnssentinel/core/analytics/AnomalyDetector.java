package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.QueryRecord;

import java.util.List;
import java.util.Optional;

/**
 * Contract for detectors that learn a baseline from historical query records
 * and classify new batches against it.
 *
 * <p>
 * Implementations are stateful but not internally synchronized: callers must
 * not invoke {@link #train(List)} concurrently with
 * {@link #detectAnomalies(List)} on the same instance.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Build a fresh model, replacing any prior one.
     *
     * @param records training batch
     * @throws InsufficientDataException if the batch is below the configured
     *                                   minimum; the previous model, if any,
     *                                   is kept
     */
    void train(List<QueryRecord> records);

    boolean isTrained();

    /**
     * Score a batch against the trained model.
     *
     * @param records batch to score
     * @return anomalies at or above the configured minimum confidence
     * @throws ModelNotTrainedException if {@link #train(List)} has not
     *                                  succeeded yet
     */
    List<Anomaly> detectAnomalies(List<QueryRecord> records);

    /**
     * @return metadata of the current model, empty when untrained
     */
    Optional<ModelInfo> getModelInfo();
}
