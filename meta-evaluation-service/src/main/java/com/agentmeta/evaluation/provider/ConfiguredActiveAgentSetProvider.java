package com.agentmeta.evaluation.provider;

import com.agentmeta.common.roster.AgentRoster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Active agent set taken from {@code meta-evaluation.active-agents}. An explicitly
 * empty value means no agent is active.
 */
@Component
public class ConfiguredActiveAgentSetProvider implements ActiveAgentSetProvider {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredActiveAgentSetProvider.class);

    private final Set<String> activeAgents;

    public ConfiguredActiveAgentSetProvider(
            @Value("${meta-evaluation.active-agents:ForecastAgent,MomentumAgent,VolatilityAgent}") String activeAgents) {
        this.activeAgents = activeAgents == null || activeAgents.isBlank()
            ? Set.of()
            : Set.copyOf(AgentRoster.parse(activeAgents));
        log.info("Active agent set configured. agents={}", this.activeAgents);
    }

    @Override
    public Mono<Set<String>> getActiveAgents() {
        return Mono.just(activeAgents);
    }
}
