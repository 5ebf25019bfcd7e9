package com.agentgate.providers;

/** One streamed text delta; {@code done} marks the last event of a stream. */
public record ChatEvent(String delta, boolean done) {}
