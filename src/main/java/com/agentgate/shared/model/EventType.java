package com.agentgate.shared.model;

public enum EventType {
    START, TEXT_CHUNK, TEXT_COMPLETE, TOOL_START, TOOL_END, TURN_COMPLETE, WARNING, STOP
}
