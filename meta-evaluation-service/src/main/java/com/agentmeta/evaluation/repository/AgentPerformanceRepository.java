package com.agentmeta.evaluation.repository;

import com.agentmeta.evaluation.model.AgentPerformanceEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface AgentPerformanceRepository extends ReactiveCrudRepository<AgentPerformanceEntity, Long> {

    /**
     * Performance rows of one regime newer than {@code since}, newest first.
     */
    @Query("""
        SELECT * FROM meta_agent_performance
        WHERE regime = :regime
          AND created_at >= :since
        ORDER BY created_at DESC, id DESC
        """)
    Flux<AgentPerformanceEntity> findByRegimeSince(String regime, LocalDateTime since);

    Flux<AgentPerformanceEntity> findByCreatedAtGreaterThanEqual(LocalDateTime since);
}
