package com.agentmeta.evaluation.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("meta_rotation_decisions")
public class RotationDecisionEntity {

    @Id
    private Long id;

    private String decisionId;

    private String fromAgent;

    private String toAgent;

    private String reason;

    private double confidence;

    private double expectedImprovement;

    private String regime;

    private LocalDateTime createdAt;
}
