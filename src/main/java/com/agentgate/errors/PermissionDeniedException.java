package com.agentgate.errors;

public class PermissionDeniedException extends AgentException {

    private final String toolName;
    private final boolean interrupt;

    public PermissionDeniedException(String toolName, String reason) {
        this(toolName, reason, false);
    }

    public PermissionDeniedException(String toolName, String reason, boolean interrupt) {
        super(ErrorKind.PERMISSION_DENIED, reason);
        this.toolName = toolName;
        this.interrupt = interrupt;
    }

    public String toolName() { return toolName; }

    /** True when the denial should also end the run. */
    public boolean interrupt() { return interrupt; }
}
