package com.agentgate.shared.model;

import java.time.Instant;
import java.util.Map;

/**
 * Progress events emitted by one agent run, in order. Consumers switch on
 * {@link #type()}; each constant maps to exactly one record below.
 */
public sealed interface AgentEvent permits AgentEvent.Start, AgentEvent.TextChunk, AgentEvent.TextComplete,
        AgentEvent.ToolStart, AgentEvent.ToolEnd, AgentEvent.TurnComplete, AgentEvent.Warning, AgentEvent.Stop {

    Instant timestamp();

    EventType type();

    record Start(Instant timestamp, String task) implements AgentEvent {
        @Override public EventType type() { return EventType.START; }
    }

    record TextChunk(Instant timestamp, String text) implements AgentEvent {
        @Override public EventType type() { return EventType.TEXT_CHUNK; }
    }

    record TextComplete(Instant timestamp, String text) implements AgentEvent {
        @Override public EventType type() { return EventType.TEXT_COMPLETE; }
    }

    record ToolStart(Instant timestamp, String requestId, String toolName,
                     Map<String, Object> arguments) implements AgentEvent {
        @Override public EventType type() { return EventType.TOOL_START; }
    }

    record ToolEnd(Instant timestamp, String requestId, String toolName,
                   String result, String error) implements AgentEvent {
        @Override public EventType type() { return EventType.TOOL_END; }
    }

    record TurnComplete(Instant timestamp, Turn turn, int turnNumber) implements AgentEvent {
        @Override public EventType type() { return EventType.TURN_COMPLETE; }
    }

    record Warning(Instant timestamp, String message) implements AgentEvent {
        @Override public EventType type() { return EventType.WARNING; }
    }

    record Stop(Instant timestamp, StopReason reason, int totalTurns, TokenUsage cost) implements AgentEvent {
        @Override public EventType type() { return EventType.STOP; }
    }

    static Start start(String task) {
        return new Start(Instant.now(), task);
    }

    static TextChunk textChunk(String text) {
        return new TextChunk(Instant.now(), text);
    }

    static TextComplete textComplete(String text) {
        return new TextComplete(Instant.now(), text);
    }

    static ToolStart toolStart(ToolRequest request) {
        return new ToolStart(Instant.now(), request.id(), request.name(), request.arguments());
    }

    static ToolEnd toolEnd(ToolResult result) {
        return new ToolEnd(Instant.now(), result.requestId(), result.toolName(), result.value(), result.error());
    }

    static TurnComplete turnComplete(Turn turn, int turnNumber) {
        return new TurnComplete(Instant.now(), turn, turnNumber);
    }

    static Warning warning(String message) {
        return new Warning(Instant.now(), message);
    }

    static Stop stop(StopReason reason, int totalTurns, TokenUsage cost) {
        return new Stop(Instant.now(), reason, totalTurns, cost);
    }
}
