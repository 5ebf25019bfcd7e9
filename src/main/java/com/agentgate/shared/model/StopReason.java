package com.agentgate.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StopReason {
    COMPLETE("complete"),
    MAX_TURNS("max_turns"),
    COST_LIMIT("cost_limit"),
    HOOK_REQUESTED_STOP("hook_requested_stop"),
    ERROR("error"),
    CANCELLED("cancelled");

    private final String wireName;

    StopReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
