package com.agentmeta.evaluation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Current ranking row of an agent inside a regime. The whole set for a regime is
 * deleted and re-inserted on every ranking cycle.
 */
@Data
@NoArgsConstructor
@Table("meta_agent_rankings")
public class AgentRankingEntity {

    @Id
    private Long id;

    private String agentName;

    private String regime;

    private int rank;

    private double compositeScore;

    private double accuracy;

    private double sharpeRatio;

    private double totalReturn;

    private double maxDrawdown;

    private double winRate;

    private double confidence;

    private double responseTime;

    private boolean synthetic;

    private LocalDateTime createdAt;
}
