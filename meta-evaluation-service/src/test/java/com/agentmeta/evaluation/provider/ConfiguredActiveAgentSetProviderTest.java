package com.agentmeta.evaluation.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredActiveAgentSetProviderTest {

    @Test
    @DisplayName("comma-separated names → trimmed set")
    void parses() {
        assertEquals(Set.of("ForecastAgent", "RiskAgent"),
            new ConfiguredActiveAgentSetProvider(" ForecastAgent, RiskAgent ").getActiveAgents().block());
    }

    @Test
    @DisplayName("explicitly blank → no active agent, not the default roster")
    void blankMeansNone() {
        assertTrue(new ConfiguredActiveAgentSetProvider("").getActiveAgents().block().isEmpty());
    }
}
