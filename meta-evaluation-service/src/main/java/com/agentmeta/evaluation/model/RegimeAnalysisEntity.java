package com.agentmeta.evaluation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only history of regime classifications.
 *
 * marketIndicators: JSON-serialised {@code Map<String, Double>} (rsi, macd, bollinger_position)
 */
@Data
@NoArgsConstructor
@Table("meta_regime_analysis")
public class RegimeAnalysisEntity {

    @Id
    private Long id;

    private String regime;

    private double confidence;

    private double volatility;

    private double trendStrength;

    private double volumeRatio;

    private String trendDirection;

    private String marketIndicators;

    private LocalDateTime createdAt;
}
