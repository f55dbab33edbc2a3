package com.agentmeta.common.roster;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names of the agents under evaluation, in declaration order.
 */
public final class AgentRoster {

    public static final List<String> DEFAULT_AGENTS = List.of(
        "ForecastAgent",
        "MomentumAgent",
        "VolatilityAgent",
        "SentimentAgent",
        "RiskAgent",
        "CorrelationAgent",
        "StrategyAgent",
        "RLStrategyAgent",
        "EventImpactAgent",
        "DayForecastAgent"
    );

    public static final Set<String> DEFAULT_ACTIVE_AGENTS = Set.of(
        "ForecastAgent",
        "MomentumAgent",
        "VolatilityAgent"
    );

    private AgentRoster() {}

    /**
     * Parses a comma-separated list of agent names, trimming blanks and dropping
     * duplicates while keeping first-seen order.
     *
     * @return the parsed names, or {@link #DEFAULT_AGENTS} when the input is blank
     */
    public static List<String> parse(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return DEFAULT_AGENTS;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String raw : commaSeparated.split(",")) {
            String name = raw.trim();
            if (!name.isEmpty()) names.add(name);
        }
        return List.copyOf(names);
    }
}
