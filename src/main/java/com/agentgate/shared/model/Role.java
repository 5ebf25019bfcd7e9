package com.agentgate.shared.model;

public enum Role {
    USER, ASSISTANT, SYSTEM
}
