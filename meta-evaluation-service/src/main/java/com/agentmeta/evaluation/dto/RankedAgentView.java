package com.agentmeta.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RankedAgentView(
    @JsonProperty("agentName")      String agentName,
    @JsonProperty("rank")           int rank,
    @JsonProperty("compositeScore") double compositeScore,
    @JsonProperty("accuracy")       double accuracy
) {}
