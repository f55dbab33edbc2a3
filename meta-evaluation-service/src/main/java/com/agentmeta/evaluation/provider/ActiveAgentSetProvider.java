package com.agentmeta.evaluation.provider;

import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Read-only view of the agents currently deployed for live decisions.
 * The engine never mutates this set; rotation decisions are recommendations only.
 */
public interface ActiveAgentSetProvider {

    Mono<Set<String>> getActiveAgents();
}
