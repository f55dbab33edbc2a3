package com.agentmeta.evaluation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One row per agent per performance-collection cycle. Insert-only.
 *
 * <p>{@code regime} holds the lower-case regime label; {@code createdAt} is UTC.
 */
@Data
@NoArgsConstructor
@Table("meta_agent_performance")
public class AgentPerformanceEntity {

    @Id
    private Long id;

    private String agentName;

    private double accuracy;

    private double sharpeRatio;

    private double totalReturn;

    private double maxDrawdown;

    private double winRate;

    private double confidence;

    private double responseTime;

    private String regime;

    private boolean synthetic;

    private LocalDateTime createdAt;
}
