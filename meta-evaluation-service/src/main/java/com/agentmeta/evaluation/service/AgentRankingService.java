package com.agentmeta.evaluation.service;

import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.ranking.AgentRankingEngine;
import com.agentmeta.common.roster.AgentRoster;
import com.agentmeta.common.synthetic.SyntheticEstimator;
import com.agentmeta.common.trace.TraceContextUtil;
import com.agentmeta.evaluation.config.MetaEvaluationConfig;
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
import java.time.Instant;
import java.util.List;

/**
 * Builds regime-scoped rankings from the performance records of the trailing window.
 *
 * <p>A regime without records, or whose records cannot be read, receives a synthetic
 * fallback ranking covering the whole roster so consumers always see a complete set.
 */
@Service
public class AgentRankingService {

    private static final Logger log = LoggerFactory.getLogger(AgentRankingService.class);

    private final MetaEvaluationStore store;
    private final SyntheticEstimator syntheticEstimator;
    private final Clock clock;
    private final List<String> roster;
    private final Duration rankingWindow;

    public AgentRankingService(MetaEvaluationStore store,
                               @Qualifier(MetaEvaluationConfig.RANKING_ESTIMATOR) SyntheticEstimator syntheticEstimator,
                               Clock clock,
                               @Value("${meta-evaluation.agents:}") String agents,
                               @Value("${meta-evaluation.ranking.window-hours:24}") long windowHours) {
        this.store              = store;
        this.syntheticEstimator = syntheticEstimator;
        this.clock              = clock;
        this.roster             = AgentRoster.parse(agents);
        this.rankingWindow      = Duration.ofHours(windowHours);
    }

    /**
     * Computes the ranking for one regime without storing it. Never fails.
     */
    public Mono<List<AgentRanking>> computeRankings(MarketRegime regime) {
        Instant now = clock.instant();
        return store.findPerformanceSince(regime, now.minus(rankingWindow))
            .collectList()
            .map(records -> {
                if (records.isEmpty()) {
                    log.debug("No performance records in window — synthetic ranking. regime={}", regime);
                    return AgentRankingEngine.fallback(regime, roster, syntheticEstimator, now);
                }
                return AgentRankingEngine.rank(regime, records, now);
            })
            .onErrorResume(e -> {
                log.warn("Performance read failed — synthetic ranking. regime={} reason={}", regime, e.toString());
                return Mono.just(AgentRankingEngine.fallback(regime, roster, syntheticEstimator, now));
            });
    }

    /**
     * One ranking cycle: recompute and replace the ranking set of every regime.
     *
     * @return number of regimes whose ranking set was replaced
     */
    public Mono<Integer> analyzeAllRegimes() {
        return Flux.fromArray(MarketRegime.values())
            .concatMap(regime -> computeRankings(regime)
                .flatMap(rankings -> store.replaceRankings(regime, rankings)
                    .thenReturn(1)
                    .onErrorResume(e -> Mono.deferContextual(ctx -> {
                        TraceContextUtil.withMdc(ctx, () ->
                            log.warn("Ranking replace failed (dropped). regime={} reason={}", regime, e.toString()));
                        return Mono.just(0);
                    }))
                    .doOnNext(stored -> {
                        if (stored > 0 && !rankings.isEmpty()) {
                            AgentRanking top = rankings.get(0);
                            log.debug("Ranking replaced. regime={} agents={} top={} score={} synthetic={}",
                                      regime, rankings.size(), top.agentName(),
                                      String.format("%.4f", top.compositeScore()), top.synthetic());
                        }
                    })))
            .reduce(0, Integer::sum)
            .doOnNext(replaced -> log.info("RANKINGS_UPDATED regimes={}", replaced));
    }
}
