package com.agentmeta.evaluation.service;

import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.model.RotationDecision;
import com.agentmeta.common.rotation.RotationDecisionEngine;
import com.agentmeta.common.trace.TraceContextUtil;
import com.agentmeta.evaluation.provider.ActiveAgentSetProvider;
import com.agentmeta.evaluation.store.MetaEvaluationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Set;

/**
 * Evaluates whether the weakest active agent should be rotated out for the
 * regime's best agent, and records the recommendation.
 *
 * <p>Decisions are recommendations only; the active agent set is not touched.
 */
@Service
public class RotationEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(RotationEvaluationService.class);

    private final RegimeDetectionService regimeDetectionService;
    private final AgentRankingService rankingService;
    private final ActiveAgentSetProvider activeAgentSetProvider;
    private final MetaEvaluationStore store;
    private final Clock clock;

    public RotationEvaluationService(RegimeDetectionService regimeDetectionService,
                                     AgentRankingService rankingService,
                                     ActiveAgentSetProvider activeAgentSetProvider,
                                     MetaEvaluationStore store,
                                     Clock clock) {
        this.regimeDetectionService = regimeDetectionService;
        this.rankingService         = rankingService;
        this.activeAgentSetProvider = activeAgentSetProvider;
        this.store                  = store;
        this.clock                  = clock;
    }

    /**
     * One rotation cycle against the currently detected regime.
     *
     * @return the recorded decision, or empty when no rotation is warranted
     */
    public Mono<RotationDecision> evaluate() {
        return regimeDetectionService.detect()
            .map(RegimeSnapshot::regime)
            .flatMap(this::evaluate);
    }

    /**
     * One rotation cycle against the given regime.
     */
    public Mono<RotationDecision> evaluate(MarketRegime regime) {
        Mono<Set<String>> activeAgents = activeAgentSetProvider.getActiveAgents()
            .defaultIfEmpty(Set.of())
            .onErrorResume(e -> {
                log.warn("Active agent set unavailable — skipping rotation. reason={}", e.toString());
                return Mono.just(Set.of());
            });

        return Mono.zip(rankingService.computeRankings(regime), activeAgents)
            .flatMap(t -> Mono.justOrEmpty(
                RotationDecisionEngine.evaluate(regime, t.getT1(), t.getT2(), clock.instant())))
            .flatMap(this::record)
            .doOnSuccess(decision -> {
                if (decision == null) {
                    log.info("ROTATION_NOT_REQUIRED regime={}", regime);
                }
            });
    }

    private Mono<RotationDecision> record(RotationDecision decision) {
        return store.appendRotationDecision(decision)
            .doOnSuccess(v -> log.info("ROTATION_RECOMMENDED decisionId={} from={} to={} improvement={} confidence={} regime={}",
                decision.decisionId(), decision.fromAgent(), decision.toAgent(),
                String.format("%.4f", decision.expectedImprovement()),
                String.format("%.4f", decision.confidence()), decision.regime()))
            .onErrorResume(e -> Mono.deferContextual(ctx -> {
                TraceContextUtil.withMdc(ctx, () ->
                    log.warn("Rotation decision write failed (dropped). decisionId={} reason={}",
                             decision.decisionId(), e.toString()));
                return Mono.empty();
            }))
            .thenReturn(decision);
    }
}
