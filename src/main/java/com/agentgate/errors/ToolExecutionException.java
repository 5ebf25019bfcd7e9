package com.agentgate.errors;

public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(ErrorKind.TOOL_EXECUTION, message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(ErrorKind.TOOL_EXECUTION, message, cause);
    }
}
