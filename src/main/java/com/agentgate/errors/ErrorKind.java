package com.agentgate.errors;

public enum ErrorKind {
    PERMISSION_DENIED,
    TOOL_EXECUTION,
    BUDGET_EXCEEDED,
    TURN_LIMIT,
    PROVIDER,
    HOOK,
    SESSION
}
