package com.agentgate.errors;

/**
 * Root of the engine's unchecked exceptions. The {@link ErrorKind} lets callers
 * branch without catching each subclass.
 */
public class AgentException extends RuntimeException {

    private final ErrorKind kind;

    public AgentException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
