package com.agentgate.hooks;

@FunctionalInterface
public interface HookCallback {
    /** Returns {@code null} to abstain. */
    HookResult handle(HookInput input) throws Exception;
}
