package com.agentgate.errors;

public class HookException extends AgentException {

    public HookException(String message) {
        super(ErrorKind.HOOK, message);
    }

    public HookException(String message, Throwable cause) {
        super(ErrorKind.HOOK, message, cause);
    }
}
