package com.agentmeta.evaluation.provider;

import com.agentmeta.common.model.PredictionOutcome;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Source of an agent's resolved predictions.
 */
public interface PredictionHistoryProvider {

    /**
     * @param agentName agent whose predictions are requested
     * @param window    trailing window counted back from now
     * @param limit     maximum number of predictions, newest kept
     * @return predictions newest-first
     */
    Flux<PredictionOutcome> getRecentPredictions(String agentName, Duration window, int limit);
}
