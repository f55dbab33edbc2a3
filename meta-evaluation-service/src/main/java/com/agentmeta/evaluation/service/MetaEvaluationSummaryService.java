package com.agentmeta.evaluation.service;

import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.model.RotationDecision;
import com.agentmeta.evaluation.dto.MetaEvaluationSummary;
import com.agentmeta.evaluation.dto.PerformanceSummary;
import com.agentmeta.evaluation.dto.RankedAgentView;
import com.agentmeta.evaluation.dto.RotationView;
import com.agentmeta.evaluation.store.MetaEvaluationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Assembles the consolidated summary from the store: latest regime, its top ranked
 * agents, the most recent rotation decisions and trailing performance aggregates.
 *
 * <p>The aggregate window ends at the newest stored snapshot, ranking or rotation rather
 * than at the wall clock, so a record never ages out between two reads and the payload
 * changes only when a cycle writes. The clock is the anchor only while none of those exist.
 *
 * <p>Read-only. Any read failure yields {@link MetaEvaluationSummary#defaulted()}.
 */
@Service
public class MetaEvaluationSummaryService {

    private static final Logger log = LoggerFactory.getLogger(MetaEvaluationSummaryService.class);

    private final MetaEvaluationStore store;
    private final Clock clock;
    private final int topAgents;
    private final int recentRotations;
    private final Duration statsWindow;

    public MetaEvaluationSummaryService(MetaEvaluationStore store,
                                        Clock clock,
                                        @Value("${meta-evaluation.summary.top-agents:10}") int topAgents,
                                        @Value("${meta-evaluation.summary.recent-rotations:5}") int recentRotations,
                                        @Value("${meta-evaluation.summary.window-hours:24}") long windowHours) {
        this.store           = store;
        this.clock           = clock;
        this.topAgents       = topAgents;
        this.recentRotations = recentRotations;
        this.statsWindow     = Duration.ofHours(windowHours);
    }

    public Mono<MetaEvaluationSummary> getSummary() {
        return store.findLatestRegimeSnapshot()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(latest -> {
                MarketRegime regime = latest.map(RegimeSnapshot::regime).orElse(MarketRegime.NEUTRAL);
                return Mono.zip(
                        store.findTopRankings(regime, topAgents).collectList(),
                        store.findRecentRotations(recentRotations).collectList())
                    .flatMap(t -> {
                        Instant lastUpdated = lastUpdated(latest, t.getT1(), t.getT2());
                        Instant windowEnd = lastUpdated != null ? lastUpdated : clock.instant();
                        return store.aggregatePerformanceSince(windowEnd.minus(statsWindow))
                            .defaultIfEmpty(PerformanceSummary.empty())
                            .map(performance -> assemble(latest, regime, t.getT1(), t.getT2(),
                                performance, lastUpdated));
                    });
            })
            .doOnNext(summary -> log.debug("Summary assembled. regime={} topAgents={} rotations={}",
                summary.currentRegime(), summary.topAgents().size(), summary.recentRotations().size()))
            .onErrorResume(e -> {
                log.warn("Summary read failed — returning defaulted payload. reason={}", e.toString());
                return Mono.just(MetaEvaluationSummary.defaulted());
            });
    }

    private static Instant lastUpdated(Optional<RegimeSnapshot> latest,
                                       List<AgentRanking> rankings,
                                       List<RotationDecision> rotations) {
        return Stream.of(
                latest.map(RegimeSnapshot::timestamp).stream(),
                rankings.stream().map(AgentRanking::timestamp),
                rotations.stream().map(RotationDecision::timestamp))
            .flatMap(s -> s)
            .filter(ts -> ts != null)
            .max(Instant::compareTo)
            .orElse(null);
    }

    private MetaEvaluationSummary assemble(Optional<RegimeSnapshot> latest,
                                           MarketRegime regime,
                                           List<AgentRanking> rankings,
                                           List<RotationDecision> rotations,
                                           PerformanceSummary performance,
                                           Instant lastUpdated) {
        List<RankedAgentView> top = rankings.stream()
            .map(r -> new RankedAgentView(r.agentName(), r.rank(), r.compositeScore(), r.accuracy()))
            .toList();
        List<RotationView> recent = rotations.stream()
            .map(d -> new RotationView(d.decisionId(), d.fromAgent(), d.toAgent(), d.reason(),
                d.confidence(), d.timestamp()))
            .toList();

        return new MetaEvaluationSummary(
            regime,
            latest.map(RegimeSnapshot::confidence).orElse(0.0),
            top,
            recent,
            performance,
            lastUpdated);
    }
}
