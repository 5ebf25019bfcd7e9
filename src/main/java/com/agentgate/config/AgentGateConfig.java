package com.agentgate.config;

import com.agentgate.agent.Agent;
import com.agentgate.tools.Tool;

import java.util.Collection;

public record AgentGateConfig(
    PolicySettings policy,
    AgentSettings agent,
    ProviderSettings provider
) {
    public static AgentGateConfig defaults() {
        return new AgentGateConfig(PolicySettings.defaults(), AgentSettings.defaults(), ProviderSettings.defaults());
    }

    /** An agent on the configured provider, policy and working directory. */
    public Agent createAgent(Collection<? extends Tool> tools) {
        var dir = agent.resolvedWorkingDir();
        return new Agent(provider.createProvider(), tools, agent.systemPrompt(), policy.toPolicy(dir), dir);
    }
}
