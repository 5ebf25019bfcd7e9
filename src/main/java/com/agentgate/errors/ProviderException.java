package com.agentgate.errors;

public class ProviderException extends AgentException {

    public ProviderException(String message) {
        super(ErrorKind.PROVIDER, message);
    }

    public ProviderException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER, message, cause);
    }
}
