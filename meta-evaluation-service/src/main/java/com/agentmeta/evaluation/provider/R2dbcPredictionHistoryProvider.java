package com.agentmeta.evaluation.provider;

import com.agentmeta.common.model.PredictionOutcome;
import com.agentmeta.evaluation.model.AgentSignal;
import com.agentmeta.evaluation.repository.AgentSignalRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Reads prediction history from the {@code agent_signals} table shared with the agents.
 */
@Component
public class R2dbcPredictionHistoryProvider implements PredictionHistoryProvider {

    private final AgentSignalRepository signalRepository;
    private final Clock clock;

    public R2dbcPredictionHistoryProvider(AgentSignalRepository signalRepository, Clock clock) {
        this.signalRepository = signalRepository;
        this.clock            = clock;
    }

    @Override
    public Flux<PredictionOutcome> getRecentPredictions(String agentName, Duration window, int limit) {
        LocalDateTime since = LocalDateTime.ofInstant(clock.instant().minus(window), ZoneOffset.UTC);
        return signalRepository.findRecentByAgent(agentName, since, limit)
            .map(this::toOutcome);
    }

    private PredictionOutcome toOutcome(AgentSignal signal) {
        return new PredictionOutcome(
            signal.getConfidence(),
            signal.getPredictedDirection(),
            signal.getActualDirection(),
            signal.getTimestamp() != null ? signal.getTimestamp().toInstant(ZoneOffset.UTC) : null);
    }
}
