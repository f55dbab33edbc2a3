package com.agentmeta.evaluation.repository;

import com.agentmeta.evaluation.model.RotationDecisionEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface RotationDecisionRepository extends ReactiveCrudRepository<RotationDecisionEntity, Long> {

    @Query("""
        SELECT * FROM meta_rotation_decisions
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<RotationDecisionEntity> findRecent(int limit);
}
