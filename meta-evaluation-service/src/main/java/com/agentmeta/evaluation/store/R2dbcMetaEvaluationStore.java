package com.agentmeta.evaluation.store;

import com.agentmeta.common.exception.MetaEvaluationException;
import com.agentmeta.common.model.AgentPerformanceRecord;
import com.agentmeta.common.model.AgentRanking;
import com.agentmeta.common.model.MarketRegime;
import com.agentmeta.common.model.RegimeSnapshot;
import com.agentmeta.common.model.RotationDecision;
import com.agentmeta.common.model.TrendDirection;
import com.agentmeta.evaluation.dto.PerformanceSummary;
import com.agentmeta.evaluation.model.AgentPerformanceEntity;
import com.agentmeta.evaluation.model.AgentRankingEntity;
import com.agentmeta.evaluation.model.RegimeAnalysisEntity;
import com.agentmeta.evaluation.model.RotationDecisionEntity;
import com.agentmeta.evaluation.repository.AgentPerformanceRepository;
import com.agentmeta.evaluation.repository.AgentRankingRepository;
import com.agentmeta.evaluation.repository.RegimeAnalysisRepository;
import com.agentmeta.evaluation.repository.RotationDecisionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * {@link MetaEvaluationStore} over Spring Data R2DBC repositories.
 *
 * <p>All timestamps are stored as UTC {@link LocalDateTime}. Ranking replacement
 * runs delete-then-insert inside one reactive transaction.
 */
@Component
public class R2dbcMetaEvaluationStore implements MetaEvaluationStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcMetaEvaluationStore.class);

    private static final TypeReference<Map<String, Double>> INDICATORS_TYPE = new TypeReference<>() {};

    private final AgentPerformanceRepository performanceRepository;
    private final AgentRankingRepository rankingRepository;
    private final RegimeAnalysisRepository regimeRepository;
    private final RotationDecisionRepository rotationRepository;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;

    public R2dbcMetaEvaluationStore(AgentPerformanceRepository performanceRepository,
                                    AgentRankingRepository rankingRepository,
                                    RegimeAnalysisRepository regimeRepository,
                                    RotationDecisionRepository rotationRepository,
                                    TransactionalOperator transactionalOperator,
                                    ObjectMapper objectMapper) {
        this.performanceRepository = performanceRepository;
        this.rankingRepository     = rankingRepository;
        this.regimeRepository      = regimeRepository;
        this.rotationRepository    = rotationRepository;
        this.transactionalOperator = transactionalOperator;
        this.objectMapper          = objectMapper;
    }

    // ── writes ──────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> appendPerformance(AgentPerformanceRecord record) {
        return Mono.fromCallable(() -> toEntity(record))
            .flatMap(performanceRepository::save)
            .then();
    }

    @Override
    public Mono<Void> appendRegimeSnapshot(RegimeSnapshot snapshot) {
        return Mono.fromCallable(() -> toEntity(snapshot))
            .flatMap(regimeRepository::save)
            .then();
    }

    @Override
    public Mono<Void> appendRotationDecision(RotationDecision decision) {
        return Mono.fromCallable(() -> toEntity(decision))
            .flatMap(rotationRepository::save)
            .then();
    }

    @Override
    public Mono<Void> replaceRankings(MarketRegime regime, List<AgentRanking> rankings) {
        List<AgentRankingEntity> entities = rankings.stream().map(this::toEntity).toList();
        Mono<Void> replace = rankingRepository.deleteByRegime(regime.label())
            .doOnNext(deleted -> log.debug("Superseded ranking rows. regime={} deleted={}", regime, deleted))
            .thenMany(rankingRepository.saveAll(entities))
            .then();
        return transactionalOperator.transactional(replace);
    }

    // ── reads ───────────────────────────────────────────────────────────────

    @Override
    public Flux<AgentPerformanceRecord> findPerformanceSince(MarketRegime regime, Instant since) {
        return performanceRepository.findByRegimeSince(regime.label(), toUtc(since))
            .map(this::toRecord);
    }

    @Override
    public Mono<RegimeSnapshot> findLatestRegimeSnapshot() {
        return regimeRepository.findFirstByOrderByCreatedAtDescIdDesc()
            .map(this::toSnapshot);
    }

    @Override
    public Flux<AgentRanking> findTopRankings(MarketRegime regime, int limit) {
        return rankingRepository.findTopByRegime(regime.label(), limit)
            .map(this::toRanking);
    }

    @Override
    public Flux<RotationDecision> findRecentRotations(int limit) {
        return rotationRepository.findRecent(limit)
            .map(this::toDecision);
    }

    @Override
    public Mono<PerformanceSummary> aggregatePerformanceSince(Instant since) {
        return performanceRepository.findByCreatedAtGreaterThanEqual(toUtc(since))
            .collectList()
            .map(rows -> {
                if (rows.isEmpty()) return PerformanceSummary.empty();
                long agents = rows.stream().map(AgentPerformanceEntity::getAgentName).distinct().count();
                return new PerformanceSummary(
                    agents,
                    rows.stream().mapToDouble(AgentPerformanceEntity::getAccuracy).average().orElse(0.0),
                    rows.stream().mapToDouble(AgentPerformanceEntity::getSharpeRatio).average().orElse(0.0),
                    rows.stream().mapToDouble(AgentPerformanceEntity::getTotalReturn).average().orElse(0.0),
                    rows.stream().mapToDouble(AgentPerformanceEntity::getResponseTime).average().orElse(0.0));
            });
    }

    // ── Entity Mapping ──────────────────────────────────────────────────────

    private AgentPerformanceEntity toEntity(AgentPerformanceRecord record) {
        AgentPerformanceEntity entity = new AgentPerformanceEntity();
        entity.setAgentName(record.agentName());
        entity.setAccuracy(record.accuracy());
        entity.setSharpeRatio(record.sharpeRatio());
        entity.setTotalReturn(record.totalReturn());
        entity.setMaxDrawdown(record.maxDrawdown());
        entity.setWinRate(record.winRate());
        entity.setConfidence(record.confidence());
        entity.setResponseTime(record.responseTime());
        entity.setRegime(record.regime().label());
        entity.setSynthetic(record.synthetic());
        entity.setCreatedAt(toUtc(record.timestamp()));
        return entity;
    }

    private AgentRankingEntity toEntity(AgentRanking ranking) {
        AgentRankingEntity entity = new AgentRankingEntity();
        entity.setAgentName(ranking.agentName());
        entity.setRegime(ranking.regime().label());
        entity.setRank(ranking.rank());
        entity.setCompositeScore(ranking.compositeScore());
        entity.setAccuracy(ranking.accuracy());
        entity.setSharpeRatio(ranking.sharpeRatio());
        entity.setTotalReturn(ranking.totalReturn());
        entity.setMaxDrawdown(ranking.maxDrawdown());
        entity.setWinRate(ranking.winRate());
        entity.setConfidence(ranking.confidence());
        entity.setResponseTime(ranking.responseTime());
        entity.setSynthetic(ranking.synthetic());
        entity.setCreatedAt(toUtc(ranking.timestamp()));
        return entity;
    }

    private RegimeAnalysisEntity toEntity(RegimeSnapshot snapshot) {
        RegimeAnalysisEntity entity = new RegimeAnalysisEntity();
        entity.setRegime(snapshot.regime().label());
        entity.setConfidence(snapshot.confidence());
        entity.setVolatility(snapshot.volatility());
        entity.setTrendStrength(snapshot.trendStrength());
        entity.setVolumeRatio(snapshot.volumeRatio());
        entity.setTrendDirection(snapshot.trendDirection().label());
        entity.setMarketIndicators(writeIndicators(snapshot.marketIndicators()));
        entity.setCreatedAt(toUtc(snapshot.timestamp()));
        return entity;
    }

    private RotationDecisionEntity toEntity(RotationDecision decision) {
        RotationDecisionEntity entity = new RotationDecisionEntity();
        entity.setDecisionId(decision.decisionId());
        entity.setFromAgent(decision.fromAgent());
        entity.setToAgent(decision.toAgent());
        entity.setReason(decision.reason());
        entity.setConfidence(decision.confidence());
        entity.setExpectedImprovement(decision.expectedImprovement());
        entity.setRegime(decision.regime().label());
        entity.setCreatedAt(toUtc(decision.timestamp()));
        return entity;
    }

    private AgentPerformanceRecord toRecord(AgentPerformanceEntity e) {
        return new AgentPerformanceRecord(e.getAgentName(), e.getAccuracy(), e.getSharpeRatio(),
            e.getTotalReturn(), e.getMaxDrawdown(), e.getWinRate(), e.getConfidence(),
            e.getResponseTime(), MarketRegime.fromLabel(e.getRegime()), e.isSynthetic(),
            toInstant(e.getCreatedAt()));
    }

    private AgentRanking toRanking(AgentRankingEntity e) {
        return new AgentRanking(e.getAgentName(), MarketRegime.fromLabel(e.getRegime()), e.getRank(),
            e.getCompositeScore(), e.getAccuracy(), e.getSharpeRatio(), e.getTotalReturn(),
            e.getMaxDrawdown(), e.getWinRate(), e.getConfidence(), e.getResponseTime(),
            e.isSynthetic(), toInstant(e.getCreatedAt()));
    }

    private RegimeSnapshot toSnapshot(RegimeAnalysisEntity e) {
        TrendDirection direction = e.getTrendDirection() != null
            ? TrendDirection.fromLabel(e.getTrendDirection())
            : TrendDirection.NEUTRAL;
        return new RegimeSnapshot(MarketRegime.fromLabel(e.getRegime()), e.getConfidence(),
            e.getVolatility(), e.getTrendStrength(), e.getVolumeRatio(), direction,
            readIndicators(e.getMarketIndicators()), toInstant(e.getCreatedAt()));
    }

    private RotationDecision toDecision(RotationDecisionEntity e) {
        return new RotationDecision(e.getDecisionId(), e.getFromAgent(), e.getToAgent(), e.getReason(),
            e.getConfidence(), e.getExpectedImprovement(), MarketRegime.fromLabel(e.getRegime()),
            toInstant(e.getCreatedAt()));
    }

    private String writeIndicators(Map<String, Double> indicators) {
        try {
            return objectMapper.writeValueAsString(indicators);
        } catch (JsonProcessingException e) {
            throw new MetaEvaluationException("store", "Failed to serialise market indicators", e);
        }
    }

    private Map<String, Double> readIndicators(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, INDICATORS_TYPE);
        } catch (JsonProcessingException e) {
            throw new MetaEvaluationException("store", "Failed to parse market indicators", e);
        }
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime utc) {
        return utc != null ? utc.toInstant(ZoneOffset.UTC) : null;
    }
}
