package com.agentmeta.evaluation.repository;

import com.agentmeta.evaluation.model.AgentRankingEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AgentRankingRepository extends ReactiveCrudRepository<AgentRankingEntity, Long> {

    /**
     * Removes the current ranking set of a regime ahead of its replacement.
     *
     * @return number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM meta_agent_rankings WHERE regime = :regime")
    Mono<Integer> deleteByRegime(String regime);

    @Query("""
        SELECT * FROM meta_agent_rankings
        WHERE regime = :regime
        ORDER BY rank ASC
        LIMIT :limit
        """)
    Flux<AgentRankingEntity> findTopByRegime(String regime, int limit);
}
