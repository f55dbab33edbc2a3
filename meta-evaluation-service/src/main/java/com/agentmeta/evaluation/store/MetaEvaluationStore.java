package com.agentmeta.evaluation.store;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.model.RotationDecision;
import com.agentmeta.evaluation.dto.PerformanceSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Persistence contract of the meta-evaluation engine. The store is the only state
 * shared between evaluation cycles.
 *
 * <p>Implementations signal failures as reactive errors; absorbing them is the
 * caller's job.
 */
public interface MetaEvaluationStore {

    Mono<Void> appendPerformance(AgentPerformanceRecord record);

    Mono<Void> appendRegimeSnapshot(RegimeSnapshot snapshot);

    Mono<Void> appendRotationDecision(RotationDecision decision);

    /**
     * Atomically supersedes the ranking set of {@code regime} with {@code rankings}.
     * Readers observe either the old or the new set, never a mix.
     */
    Mono<Void> replaceRankings(MarketRegime regime, List<AgentRanking> rankings);

    /** Performance records of {@code regime} created at or after {@code since}, newest first. */
    Flux<AgentPerformanceRecord> findPerformanceSince(MarketRegime regime, Instant since);

    /** Empty when no snapshot was ever stored. */
    Mono<RegimeSnapshot> findLatestRegimeSnapshot();

    /** Best {@code limit} entries of the regime's current ranking set, ordered by rank. */
    Flux<AgentRanking> findTopRankings(MarketRegime regime, int limit);

    /** Newest {@code limit} rotation decisions, newest first. */
    Flux<RotationDecision> findRecentRotations(int limit);

    /** Aggregates across every regime; zeros when the window is empty. */
    Mono<PerformanceSummary> aggregatePerformanceSince(Instant since);
}
