package com.agentmeta.common.rotation;

import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RotationDecision;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether the weakest active agent should be swapped for the best-ranked one.
 *
 * <p>Decision steps:
 * <ol>
 *   <li>Fewer than two ranked agents → no decision.</li>
 *   <li>A ranking made only of synthetic entries → no decision.</li>
 *   <li>Best agent (rank 1) already active → no decision.</li>
 *   <li>Scan from worst to best; the first active agent is the candidate to remove.
 *       No active agent in the ranking → no decision.</li>
 *   <li>improvement = best score − candidate score; decide only when
 *       improvement &gt; {@value #IMPROVEMENT_THRESHOLD} by more than
 *       {@value #SCORE_TOLERANCE}, so a gap that prints as 10.00% never rotates.</li>
 * </ol>
 *
 * <p>Pure function of its arguments: the same ranking, active set and instant always
 * give the same result.
 */
public final class RotationDecisionEngine {

    static final double IMPROVEMENT_THRESHOLD = 0.10;
    static final double MAX_CONFIDENCE        = 0.95;
    static final double CONFIDENCE_SCALE      = 2.0;

    /** Score differences are sums of rounded doubles; 0.80 - 0.70 is 0.10000000000000009. */
    static final double SCORE_TOLERANCE = 1e-9;

    private static final DateTimeFormatter DECISION_ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private RotationDecisionEngine() {}

    /**
     * @param regime       regime the ranking was computed for
     * @param ranking      entries ordered best-first (rank 1 at index 0)
     * @param activeAgents agents currently deployed
     * @param now          decision time; also the source of the decision id
     * @return the recommended rotation, or empty when no swap is warranted
     */
    public static Optional<RotationDecision> evaluate(MarketRegime regime,
                                                      List<AgentRanking> ranking,
                                                      Set<String> activeAgents,
                                                      Instant now) {
        if (ranking == null || ranking.size() < 2 || activeAgents == null || activeAgents.isEmpty()) {
            return Optional.empty();
        }
        if (ranking.stream().allMatch(AgentRanking::synthetic)) {
            return Optional.empty();
        }

        AgentRanking best = ranking.get(0);
        if (activeAgents.contains(best.agentName())) {
            return Optional.empty();
        }

        AgentRanking candidate = null;
        for (int i = ranking.size() - 1; i >= 0; i--) {
            if (activeAgents.contains(ranking.get(i).agentName())) {
                candidate = ranking.get(i);
                break;
            }
        }
        if (candidate == null) {
            return Optional.empty();
        }

        double improvement = best.compositeScore() - candidate.compositeScore();
        if (!(improvement - IMPROVEMENT_THRESHOLD > SCORE_TOLERANCE)) {
            return Optional.empty();
        }

        return Optional.of(new RotationDecision(
            decisionId(now),
            candidate.agentName(),
            best.agentName(),
            String.format(Locale.ROOT, "Performance improvement: %.2f%%", improvement * 100),
            Math.min(MAX_CONFIDENCE, improvement * CONFIDENCE_SCALE),
            improvement,
            regime,
            now));
    }

    static String decisionId(Instant now) {
        return "rotation_" + DECISION_ID_FORMAT.format(now);
    }
}
