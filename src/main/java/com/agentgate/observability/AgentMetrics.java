package com.agentgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics() {
        this(new SimpleMeterRegistry());
    }

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer llmLatency(String mode) {
        return Timer.builder("agentgate.llm.latency").tag("mode", mode).register(registry);
    }

    public Counter turns() {
        return Counter.builder("agentgate.turns").register(registry);
    }

    public Counter toolCalls(String tool) {
        return Counter.builder("agentgate.tool.calls").tag("tool", tool).register(registry);
    }

    public Counter toolRequests() {
        return Counter.builder("agentgate.tool.requests").register(registry);
    }

    public Counter denials(String source) {
        return Counter.builder("agentgate.tool.denials").tag("source", source).register(registry);
    }

    public Counter hookFailures(String event) {
        return Counter.builder("agentgate.hook.failures").tag("event", event).register(registry);
    }

    public Counter providerFallbacks() {
        return Counter.builder("agentgate.provider.fallbacks").register(registry);
    }

    public Counter runs(String stopReason) {
        return Counter.builder("agentgate.runs").tag("stop_reason", stopReason).register(registry);
    }

    public Counter tokensUsed() {
        return Counter.builder("agentgate.tokens.total").register(registry);
    }
}
