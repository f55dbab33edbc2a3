package com.agentmeta.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record RotationView(
    @JsonProperty("decisionId") String decisionId,
    @JsonProperty("fromAgent")  String fromAgent,
    @JsonProperty("toAgent")    String toAgent,
    @JsonProperty("reason")     String reason,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("createdAt")  Instant createdAt
) {}
