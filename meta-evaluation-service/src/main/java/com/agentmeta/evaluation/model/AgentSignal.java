package com.agentmeta.evaluation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Prediction emitted by a live agent, written by the agents themselves.
 * Read-only from this service's point of view; {@code actualDirection} is
 * filled in once the outcome is known.
 */
@Data
@NoArgsConstructor
@Table("agent_signals")
public class AgentSignal {

    @Id
    private Long id;

    private String agentName;

    private String symbol;

    private double confidence;

    private String predictedDirection;

    private String actualDirection;

    private LocalDateTime timestamp;
}
