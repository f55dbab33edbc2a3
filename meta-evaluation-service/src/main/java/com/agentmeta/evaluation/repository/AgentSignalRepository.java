package com.agentmeta.evaluation.repository;

import com.agentmeta.evaluation.model.AgentSignal;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface AgentSignalRepository extends ReactiveCrudRepository<AgentSignal, Long> {

    /**
     * Most recent predictions of one agent inside the trailing window.
     */
    @Query("""
        SELECT * FROM agent_signals
        WHERE agent_name = :agentName
          AND timestamp >= :since
        ORDER BY timestamp DESC
        LIMIT :limit
        """)
    Flux<AgentSignal> findRecentByAgent(String agentName, LocalDateTime since, int limit);
}
