package com.agentgate.shared.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a blocking run: final answer, every event, totals and the
 * machine-readable stop reason.
 */
public record AgentResult(
    String response,
    List<Turn> turns,
    TokenUsage cost,
    List<AgentEvent> events,
    Duration duration,
    StopReason stopReason
) {
    public AgentResult {
        turns = turns != null ? List.copyOf(turns) : List.of();
        events = events != null ? List.copyOf(events) : List.of();
        cost = cost != null ? cost : TokenUsage.ZERO;
    }

    public int turnCount() {
        return turns.size();
    }

    public List<AgentEvent.ToolStart> toolCalls() {
        return events.stream()
                .filter(AgentEvent.ToolStart.class::isInstance)
                .map(AgentEvent.ToolStart.class::cast)
                .toList();
    }

    public List<String> textChunks() {
        return events.stream()
                .filter(AgentEvent.TextChunk.class::isInstance)
                .map(e -> ((AgentEvent.TextChunk) e).text())
                .toList();
    }

    public boolean isSuccess() {
        return stopReason == StopReason.COMPLETE;
    }
}
