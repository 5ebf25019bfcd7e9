package com.agentgate.security;

public sealed interface PermissionResult permits PermissionResult.Allow, PermissionResult.Deny {

    boolean allowed();

    record Allow(String message) implements PermissionResult {
        @Override public boolean allowed() { return true; }
    }

    /** {@code interrupt} ends the whole run, not only this call. */
    record Deny(String reason, boolean interrupt) implements PermissionResult {
        @Override public boolean allowed() { return false; }
    }

    static Allow allow() {
        return new Allow(null);
    }

    static Allow allow(String message) {
        return new Allow(message);
    }

    static Deny deny(String reason) {
        return new Deny(reason, false);
    }

    static Deny deny(String reason, boolean interrupt) {
        return new Deny(reason, interrupt);
    }
}
