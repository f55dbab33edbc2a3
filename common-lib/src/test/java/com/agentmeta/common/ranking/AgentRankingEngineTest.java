package com.agentmeta.common.ranking;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.roster.AgentRoster;
import com.agentmeta.common.synthetic.SeededSyntheticEstimator;
import com.agentmeta.common.synthetic.SyntheticEstimator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AgentRankingEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-15T14:30:00Z");
    private static final double EPS = 1e-9;

    @Test
    @DisplayName("compositeScore — weighted sum with latency bonus 1/(1+rt)")
    void compositeScore() {
        AgentPerformanceRecord r = record("A", 0.75, 1.0, 0.05, 0.75, 0.75, 1.0);
        // 0.1875 + 0.2 + 0.01 + 0.1125 + 0.075 + 0.05
        assertEquals(0.635, AgentRankingEngine.compositeScore(r), EPS);
    }

    @Nested
    @DisplayName("rank()")
    class RankTests {

        @Test
        @DisplayName("orders by composite score and assigns ranks 1..N")
        void ordersAndRanks() {
            List<AgentRanking> ranking = AgentRankingEngine.rank(MarketRegime.BULL, List.of(
                record("Low",  0.40, 0.0, -0.02, 0.40, 0.4, 2.0),
                record("High", 0.80, 1.2,  0.06, 0.80, 0.8, 0.5),
                record("Mid",  0.60, 0.4,  0.02, 0.60, 0.6, 1.0)), NOW);

            assertEquals(List.of("High", "Mid", "Low"), names(ranking));
            assertEquals(List.of(1, 2, 3), ranking.stream().map(AgentRanking::rank).collect(Collectors.toList()));
            assertTrue(ranking.stream().noneMatch(AgentRanking::synthetic));
            assertTrue(ranking.stream().allMatch(e -> e.regime() == MarketRegime.BULL && NOW.equals(e.timestamp())));
        }

        @Test
        @DisplayName("an agent with several records is ranked once, from its newest record")
        void newestRecordWins() {
            List<AgentRanking> ranking = AgentRankingEngine.rank(MarketRegime.BULL, List.of(
                record("A", 0.30, 0.0, -0.04, 0.30, 0.3, 1.0),
                record("B", 0.60, 0.4,  0.02, 0.60, 0.6, 1.0),
                record("A", 0.90, 1.6,  0.08, 0.90, 0.9, 1.0)), NOW);

            assertEquals(2, ranking.size());
            AgentRanking a = ranking.stream().filter(e -> e.agentName().equals("A")).findFirst().orElseThrow();
            assertEquals(0.30, a.accuracy(), EPS);
            assertEquals("B", ranking.get(0).agentName());
        }

        @Test
        @DisplayName("equal scores keep input order")
        void stableTies() {
            List<AgentRanking> ranking = AgentRankingEngine.rank(MarketRegime.NEUTRAL, List.of(
                record("First",  0.5, 0.0, 0.0, 0.5, 0.5, 1.0),
                record("Second", 0.5, 0.0, 0.0, 0.5, 0.5, 1.0),
                record("Third",  0.5, 0.0, 0.0, 0.5, 0.5, 1.0)), NOW);

            assertEquals(List.of("First", "Second", "Third"), names(ranking));
        }

        @Test
        @DisplayName("an entry built from a synthetic record stays synthetic")
        void syntheticFlagCarried() {
            AgentPerformanceRecord estimated = new AgentPerformanceRecord("Estimated", 0.55, 0.2, 0.01, 0.0,
                0.55, 0.55, 1.75, MarketRegime.BULL, true, NOW);
            List<AgentRanking> ranking = AgentRankingEngine.rank(MarketRegime.BULL, List.of(
                estimated, record("Observed", 0.60, 0.4, 0.02, 0.60, 0.6, 1.0)), NOW);

            assertTrue(ranking.stream().filter(e -> e.agentName().equals("Estimated")).allMatch(AgentRanking::synthetic));
            assertTrue(ranking.stream().filter(e -> e.agentName().equals("Observed")).noneMatch(AgentRanking::synthetic));
        }

        @Test
        @DisplayName("no records → empty ranking")
        void empty() {
            assertTrue(AgentRankingEngine.rank(MarketRegime.BEAR, Collections.emptyList(), NOW).isEmpty());
        }

        @Test
        @DisplayName("composite scores are non-increasing down the ranking")
        void nonIncreasing() {
            List<AgentRanking> ranking = AgentRankingEngine.rank(MarketRegime.BULL, List.of(
                record("A", 0.55, 0.2, 0.01, 0.55, 0.7, 0.3),
                record("B", 0.65, 0.6, 0.03, 0.65, 0.5, 2.5),
                record("C", 0.45, 0.0, -0.01, 0.45, 0.9, 0.1),
                record("D", 0.70, 0.8, 0.04, 0.70, 0.6, 1.5)), NOW);
            for (int i = 1; i < ranking.size(); i++) {
                assertTrue(ranking.get(i - 1).compositeScore() >= ranking.get(i).compositeScore());
            }
        }
    }

    @Nested
    @DisplayName("fallback()")
    class FallbackTests {

        @Test
        @DisplayName("covers the whole roster, every entry synthetic, scores in [0.4, 0.8]")
        void coversRoster() {
            SyntheticEstimator estimator = new SeededSyntheticEstimator(7L);
            List<AgentRanking> ranking = AgentRankingEngine.fallback(MarketRegime.VOLATILE,
                AgentRoster.DEFAULT_AGENTS, estimator, NOW);

            assertEquals(AgentRoster.DEFAULT_AGENTS.size(), ranking.size());
            assertEquals(AgentRoster.DEFAULT_AGENTS.stream().sorted().collect(Collectors.toList()),
                names(ranking).stream().sorted().collect(Collectors.toList()));
            for (int i = 0; i < ranking.size(); i++) {
                AgentRanking e = ranking.get(i);
                assertTrue(e.synthetic());
                assertEquals(i + 1, e.rank());
                assertTrue(e.compositeScore() >= 0.4 && e.compositeScore() < 0.8);
                assertTrue(e.responseTime() >= 0.5 && e.responseTime() < 2.0);
            }
        }

        @Test
        @DisplayName("composite score equals the draw; other metrics follow the scorer formulas")
        void derivedMetrics() {
            SyntheticEstimator midpoint = (lower, upper) -> (lower + upper) / 2;
            AgentRanking e = AgentRankingEngine.fallback(MarketRegime.BULL, List.of("A"), midpoint, NOW).get(0);
            assertEquals(0.6, e.compositeScore(), EPS);
            assertEquals(0.6, e.accuracy(), EPS);
            assertEquals(0.4, e.sharpeRatio(), EPS);
            assertEquals(0.02, e.totalReturn(), EPS);
            assertEquals(1.25, e.responseTime(), EPS);
        }
    }

    private static AgentPerformanceRecord record(String agent, double accuracy, double sharpe, double totalReturn,
                                                 double winRate, double confidence, double responseTime) {
        return new AgentPerformanceRecord(agent, accuracy, sharpe, totalReturn, 0.0, winRate, confidence,
            responseTime, MarketRegime.BULL, false, NOW);
    }

    private static List<String> names(List<AgentRanking> ranking) {
        return ranking.stream().map(AgentRanking::agentName).collect(Collectors.toList());
    }
}
