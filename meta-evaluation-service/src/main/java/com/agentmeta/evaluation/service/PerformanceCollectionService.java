package com.agentmeta.evaluation.service;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.roster.AgentRoster;
import com.agentmeta.common.scoring.AgentPerformanceScorer;
import com.agentmeta.common.synthetic.SyntheticEstimator;
import com.agentmeta.common.trace.TraceContextUtil;
import com.agentmeta.evaluation.config.MetaEvaluationConfig;
import com.agentmeta.evaluation.provider.PredictionHistoryProvider;
import com.agentmeta.evaluation.store.MetaEvaluationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Scores every roster agent against the current regime and appends one performance
 * record per agent.
 *
 * <p>One bad agent never aborts the cycle: a failed history lookup yields the
 * neutral-default record and a failed write drops only that agent's record.
 */
@Service
public class PerformanceCollectionService {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCollectionService.class);

    private final RegimeDetectionService regimeDetectionService;
    private final PredictionHistoryProvider predictionHistoryProvider;
    private final MetaEvaluationStore store;
    private final SyntheticEstimator syntheticEstimator;
    private final Clock clock;
    private final List<String> roster;
    private final Duration historyWindow;
    private final int historyLimit;
    private final Duration callTimeout;

    public PerformanceCollectionService(RegimeDetectionService regimeDetectionService,
                                        PredictionHistoryProvider predictionHistoryProvider,
                                        MetaEvaluationStore store,
                                        @Qualifier(MetaEvaluationConfig.PERFORMANCE_ESTIMATOR) SyntheticEstimator syntheticEstimator,
                                        Clock clock,
                                        @Value("${meta-evaluation.agents:}") String agents,
                                        @Value("${meta-evaluation.performance.history-window-days:7}") long windowDays,
                                        @Value("${meta-evaluation.performance.history-limit:100}") int historyLimit,
                                        @Value("${meta-evaluation.external-call-timeout-seconds:10}") long timeoutSeconds) {
        this.regimeDetectionService    = regimeDetectionService;
        this.predictionHistoryProvider = predictionHistoryProvider;
        this.store                     = store;
        this.syntheticEstimator        = syntheticEstimator;
        this.clock                     = clock;
        this.roster                    = AgentRoster.parse(agents);
        this.historyWindow             = Duration.ofDays(windowDays);
        this.historyLimit              = historyLimit;
        this.callTimeout               = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * One collection cycle: detect the regime, score and store every agent.
     *
     * @return the records produced this cycle, in roster order
     */
    public Mono<List<AgentPerformanceRecord>> collect() {
        return regimeDetectionService.detect()
            .map(RegimeSnapshot::regime)
            .flatMap(regime -> Flux.fromIterable(roster)
                .concatMap(agent -> scoreAgent(agent, regime)
                    .flatMap(record -> store.appendPerformance(record)
                        .onErrorResume(e -> Mono.deferContextual(ctx -> {
                            TraceContextUtil.withMdc(ctx, () ->
                                log.warn("Performance write failed (dropped). agent={} regime={} reason={}",
                                         agent, regime, e.toString()));
                            return Mono.empty();
                        }))
                        .thenReturn(record)))
                .collectList()
                .doOnNext(records -> log.info("PERFORMANCE_COLLECTED regime={} agents={} synthetic={}",
                    regime, records.size(), records.stream().filter(AgentPerformanceRecord::synthetic).count())));
    }

    /**
     * Scores a single agent. Never fails.
     */
    public Mono<AgentPerformanceRecord> scoreAgent(String agentName, MarketRegime regime) {
        return predictionHistoryProvider.getRecentPredictions(agentName, historyWindow, historyLimit)
            .take(historyLimit)
            .collectList()
            .timeout(callTimeout)
            .map(history -> {
                if (history.isEmpty()) {
                    log.debug("No prediction history — scoring from synthetic base. agent={}", agentName);
                }
                return AgentPerformanceScorer.score(agentName, regime, history, syntheticEstimator, clock.instant());
            })
            .onErrorResume(e -> {
                log.warn("Performance scoring failed — using neutral default. agent={} reason={}",
                         agentName, e.toString());
                return Mono.just(AgentPerformanceScorer.neutralDefault(agentName, regime, clock.instant()));
            });
    }

    public List<String> roster() {
        return roster;
    }
}
