package com.agentmeta.evaluation.repository;

import com.agentmeta.evaluation.model.RegimeAnalysisEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface RegimeAnalysisRepository extends ReactiveCrudRepository<RegimeAnalysisEntity, Long> {

    Mono<RegimeAnalysisEntity> findFirstByOrderByCreatedAtDescIdDesc();
}
