package com.agentgate.errors;

public class SessionException extends AgentException {

    public SessionException(String message) {
        super(ErrorKind.SESSION, message);
    }

    public SessionException(String message, Throwable cause) {
        super(ErrorKind.SESSION, message, cause);
    }
}
