package com.agentmeta.evaluation.job;

import com.agentmeta.evaluation.service.AgentRankingService;
import com.agentmeta.evaluation.service.PerformanceCollectionService;
import com.agentmeta.evaluation.service.RegimeDetectionService;
import com.agentmeta.evaluation.service.RotationEvaluationService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs the four evaluation cycles side by side:
 *
 * <ul>
 *   <li>{@code performance}: score every roster agent and append the records</li>
 *   <li>{@code ranking}: rebuild the ranking set of every regime</li>
 *   <li>{@code rotation}: recommend swapping the weakest active agent</li>
 *   <li>{@code regime}: append a fresh regime snapshot</li>
 * </ul>
 *
 * <p>Cycles share nothing but the store. A failing or slow cycle does not delay the
 * others; each one reschedules itself after its own interval.
 */
@Component
public class MetaEvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MetaEvaluationOrchestrator.class);

    public static final String PERFORMANCE = "performance";
    public static final String RANKING     = "ranking";
    public static final String ROTATION    = "rotation";
    public static final String REGIME      = "regime";

    private final List<EvaluationCycle> cycles;
    private final boolean autoStart;

    public MetaEvaluationOrchestrator(PerformanceCollectionService performanceCollectionService,
                                      AgentRankingService rankingService,
                                      RotationEvaluationService rotationEvaluationService,
                                      RegimeDetectionService regimeDetectionService,
                                      @Value("${meta-evaluation.enabled:true}") boolean autoStart,
                                      @Value("${meta-evaluation.cycles.performance-interval-seconds:60}") long performanceSeconds,
                                      @Value("${meta-evaluation.cycles.ranking-interval-seconds:300}") long rankingSeconds,
                                      @Value("${meta-evaluation.cycles.rotation-interval-seconds:600}") long rotationSeconds,
                                      @Value("${meta-evaluation.cycles.regime-interval-seconds:120}") long regimeSeconds) {
        this.autoStart = autoStart;
        this.cycles = List.of(
            newCycle(PERFORMANCE, performanceSeconds, performanceCollectionService::collect),
            newCycle(RANKING,    rankingSeconds,     rankingService::analyzeAllRegimes),
            newCycle(ROTATION,   rotationSeconds,    rotationEvaluationService::evaluate),
            newCycle(REGIME,     regimeSeconds,      regimeDetectionService::refresh));
    }

    private static EvaluationCycle newCycle(String name, long seconds, Supplier<Mono<?>> iteration) {
        Duration interval = Duration.ofSeconds(seconds);
        // a failed iteration waits the same interval before retrying
        return new EvaluationCycle(name, interval, interval, iteration);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!autoStart) {
            log.info("Meta-evaluation cycles disabled (meta-evaluation.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        log.info("Meta-evaluation orchestrator starting. cycles={}",
                 cycles.stream().map(c -> c.name() + "@" + c.interval().toSeconds() + "s").toList());
        cycles.forEach(EvaluationCycle::start);
    }

    @PreDestroy
    public void stop() {
        cycles.forEach(EvaluationCycle::stop);
        log.info("Meta-evaluation orchestrator stopped.");
    }

    public boolean isRunning() {
        return cycles.stream().anyMatch(EvaluationCycle::isRunning);
    }

    public Optional<EvaluationCycle> cycle(String name) {
        return cycles.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public List<EvaluationCycle> cycles() {
        return cycles;
    }
}
