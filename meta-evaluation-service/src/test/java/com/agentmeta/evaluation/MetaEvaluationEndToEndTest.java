package com.agentmeta.evaluation;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.PredictionOutcome;
import com.agentmeta.common.model.RotationDecision;
import com.agentmeta.common.roster.AgentRoster;
import com.agentmeta.common.synthetic.SyntheticEstimator;
import com.agentmeta.evaluation.dto.MetaEvaluationSummary;
import com.agentmeta.evaluation.provider.ActiveAgentSetProvider;
import com.agentmeta.evaluation.provider.MarketDataProvider;
import com.agentmeta.evaluation.provider.PredictionHistoryProvider;
import com.agentmeta.evaluation.service.AgentRankingService;
import com.agentmeta.evaluation.service.MetaEvaluationSummaryService;
import com.agentmeta.evaluation.service.PerformanceCollectionService;
import com.agentmeta.evaluation.service.RegimeDetectionService;
import com.agentmeta.evaluation.service.RotationEvaluationService;
import com.agentmeta.evaluation.store.InMemoryMetaEvaluationStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs one pass of every cycle against an in-memory store with stub collaborators.
 */
class MetaEvaluationEndToEndTest {

    private static final Instant NOW = Instant.parse("2024-03-15T14:30:00Z");
    private static final SyntheticEstimator MIDPOINT = (lower, upper) -> (lower + upper) / 2;

    private final InMemoryMetaEvaluationStore store = new InMemoryMetaEvaluationStore();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("no history, no market data, empty active set → synthetic state, no rotation")
    void coldStart() {
        Engine engine = new Engine((symbol, lookback) -> Mono.just(List.of()),
            (agent, window, limit) -> Flux.empty(),
            () -> Mono.just(Set.of()));

        engine.runAllCycles();

        assertEquals(10, store.performance().size());
        assertTrue(store.performance().stream().allMatch(AgentPerformanceRecord::synthetic));
        assertTrue(store.performance().stream().allMatch(r -> r.regime() == MarketRegime.NEUTRAL));
        for (MarketRegime regime : MarketRegime.values()) {
            assertEquals(10, store.rankings(regime).size(), "ranking size for " + regime);
        }
        assertTrue(store.rotations().isEmpty());
        assertEquals(1, store.snapshots().size());

        MetaEvaluationSummary summary = engine.summary.getSummary().block();
        assertEquals(MarketRegime.NEUTRAL, summary.currentRegime());
        assertEquals(0.6, summary.regimeConfidence(), 1e-9);
        assertEquals(10, summary.topAgents().size());
        assertTrue(summary.recentRotations().isEmpty());
        assertEquals(10, summary.performanceSummary().totalAgents());
    }

    @Test
    @DisplayName("sustained outage with a populated active set → still no rotation")
    void outageNeverRotates() {
        Engine engine = new Engine((symbol, lookback) -> Mono.error(new IllegalStateException("down")),
            (agent, window, limit) -> Flux.error(new IllegalStateException("down")),
            () -> Mono.just(AgentRoster.DEFAULT_ACTIVE_AGENTS));

        for (int i = 0; i < 3; i++) {
            engine.runAllCycles();
        }

        assertTrue(store.rotations().isEmpty());
        assertTrue(store.rankings(MarketRegime.NEUTRAL).stream().allMatch(AgentRanking::synthetic));
    }

    @Test
    @DisplayName("a strong idle agent replaces the weakest active agent")
    void rotatesOnObservedHistory() {
        Map<String, List<PredictionOutcome>> history = Map.of(
            "SentimentAgent", List.of(
                new PredictionOutcome(0.9, "up", "up", NOW.minusSeconds(600)),
                new PredictionOutcome(0.9, "down", "down", NOW.minusSeconds(1200))),
            "MomentumAgent", List.of(
                new PredictionOutcome(0.5, "up", "down", NOW.minusSeconds(600)),
                new PredictionOutcome(0.5, "down", "up", NOW.minusSeconds(1200))));

        Engine engine = new Engine((symbol, lookback) -> Mono.just(List.of()),
            (agent, window, limit) -> Flux.fromIterable(history.getOrDefault(agent, List.of())),
            () -> Mono.just(AgentRoster.DEFAULT_ACTIVE_AGENTS));

        engine.runAllCycles();

        assertEquals("SentimentAgent", store.rankings(MarketRegime.NEUTRAL).get(0).agentName());
        assertEquals(1, store.rotations().size());
        RotationDecision decision = store.rotations().get(0);
        assertEquals("MomentumAgent", decision.fromAgent());
        assertEquals("SentimentAgent", decision.toAgent());
        assertEquals(0.95, decision.confidence(), 1e-9);

        MetaEvaluationSummary summary = engine.summary.getSummary().block();
        assertEquals(1, summary.recentRotations().size());
        assertEquals("SentimentAgent", summary.topAgents().get(0).agentName());
    }

    private final class Engine {

        final RegimeDetectionService regime;
        final PerformanceCollectionService performance;
        final AgentRankingService ranking;
        final RotationEvaluationService rotation;
        final MetaEvaluationSummaryService summary;

        Engine(MarketDataProvider marketData, PredictionHistoryProvider predictions, ActiveAgentSetProvider active) {
            regime      = new RegimeDetectionService(marketData, store, clock, "SPY", 30, 5);
            performance = new PerformanceCollectionService(regime, predictions, store, MIDPOINT, clock, "", 7, 100, 5);
            ranking     = new AgentRankingService(store, MIDPOINT, clock, "", 24);
            rotation    = new RotationEvaluationService(regime, ranking, active, store, clock);
            summary     = new MetaEvaluationSummaryService(store, clock, 10, 5, 24);
        }

        void runAllCycles() {
            performance.collect().block();
            ranking.analyzeAllRegimes().block();
            rotation.evaluate().block();
            regime.refresh().block();
        }
    }
}
