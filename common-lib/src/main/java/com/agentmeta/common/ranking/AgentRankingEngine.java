package com.agentmeta.common.ranking;

import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.scoring.AgentPerformanceScorer;
import com.agentmeta.common.synthetic.SyntheticEstimator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless ranking of agents inside one regime.
 *
 * <p><b>Composite score</b>:
 * <pre>
 *   composite = accuracy × 0.25 + sharpeRatio × 0.20 + totalReturn × 0.20
 *             + winRate × 0.15 + confidence × 0.10 + (1 / (1 + responseTime)) × 0.10
 * </pre>
 * The latency term lies in (0, 1] and rewards faster agents.
 *
 * <p>Entries are ordered by a stable sort on descending composite score, so equal
 * scores keep their input order, and ranks run 1..N without gaps.
 */
public final class AgentRankingEngine {

    static final double ACCURACY_WEIGHT   = 0.25;
    static final double SHARPE_WEIGHT     = 0.20;
    static final double RETURN_WEIGHT     = 0.20;
    static final double WIN_RATE_WEIGHT   = 0.15;
    static final double CONFIDENCE_WEIGHT = 0.10;
    static final double LATENCY_WEIGHT    = 0.10;

    private static final Comparator<AgentRanking> BY_SCORE_DESC =
        Comparator.comparingDouble(AgentRanking::compositeScore).reversed();

    private AgentRankingEngine() {}

    public static double compositeScore(AgentPerformanceRecord record) {
        return record.accuracy()     * ACCURACY_WEIGHT
             + record.sharpeRatio()  * SHARPE_WEIGHT
             + record.totalReturn()  * RETURN_WEIGHT
             + record.winRate()      * WIN_RATE_WEIGHT
             + record.confidence()   * CONFIDENCE_WEIGHT
             + (1.0 / (1.0 + record.responseTime())) * LATENCY_WEIGHT;
    }

    /**
     * Ranks the given performance records.
     *
     * <p>Records are expected newest-first; when an agent appears more than once
     * only its first (newest) record is ranked. An entry is synthetic when the record
     * it was built from is.
     *
     * @param regime  regime the ranking belongs to
     * @param records performance records for that regime, newest-first
     * @param now     timestamp stamped on every entry
     * @return ranked entries, best first; empty when {@code records} is empty
     */
    public static List<AgentRanking> rank(MarketRegime regime, List<AgentPerformanceRecord> records, Instant now) {
        Map<String, AgentPerformanceRecord> latestPerAgent = new LinkedHashMap<>();
        for (AgentPerformanceRecord record : records) {
            latestPerAgent.putIfAbsent(record.agentName(), record);
        }

        List<AgentRanking> entries = new ArrayList<>(latestPerAgent.size());
        for (AgentPerformanceRecord r : latestPerAgent.values()) {
            entries.add(new AgentRanking(r.agentName(), regime, 0, compositeScore(r),
                r.accuracy(), r.sharpeRatio(), r.totalReturn(), r.maxDrawdown(),
                r.winRate(), r.confidence(), r.responseTime(), r.synthetic(), now));
        }
        return assignRanks(entries);
    }

    /**
     * Synthetic ranking covering every roster agent, used when no performance
     * records exist for the regime. Every entry is flagged {@code synthetic}.
     */
    public static List<AgentRanking> fallback(MarketRegime regime, List<String> roster,
                                              SyntheticEstimator estimator, Instant now) {
        List<AgentRanking> entries = new ArrayList<>(roster.size());
        for (String agent : roster) {
            double base = estimator.fallbackRankingScore();
            entries.add(new AgentRanking(agent, regime, 0, base,
                base,
                AgentPerformanceScorer.sharpeRatio(base),
                AgentPerformanceScorer.totalReturn(base),
                AgentPerformanceScorer.maxDrawdown(base),
                base,
                base,
                estimator.fallbackRankingResponseTime(),
                true,
                now));
        }
        return assignRanks(entries);
    }

    private static List<AgentRanking> assignRanks(List<AgentRanking> entries) {
        // List.sort is a stable merge sort
        entries.sort(BY_SCORE_DESC);
        List<AgentRanking> ranked = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            ranked.add(entries.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
