package com.agentgate.hooks;

/**
 * What a callback returns. A callback that has nothing to say returns
 * {@code null} and the next matching hook is asked.
 */
public sealed interface HookResult permits HookResult.PreToolUse, HookResult.PostToolUse, HookResult.Stop,
        HookResult.SessionStart, HookResult.SessionEnd, HookResult.SubagentStop, HookResult.PreCompact,
        HookResult.UserPromptSubmit {

    enum Permission { ALLOW, DENY }

    HookEvent event();

    /** True when the hook asks the run to end after the current step. */
    default boolean stopRequested() {
        return false;
    }

    record PreToolUse(Permission permission, String reason, boolean proceed) implements HookResult {
        public PreToolUse {
            if (permission == null) permission = Permission.ALLOW;
        }

        public static PreToolUse allow() {
            return new PreToolUse(Permission.ALLOW, null, true);
        }

        public static PreToolUse deny(String reason) {
            return new PreToolUse(Permission.DENY, reason, true);
        }

        /** Deny this call and end the run after the current step. */
        public static PreToolUse denyAndStop(String reason) {
            return new PreToolUse(Permission.DENY, reason, false);
        }

        public boolean denied() {
            return permission == Permission.DENY;
        }

        @Override public HookEvent event() { return HookEvent.PRE_TOOL_USE; }
        @Override public boolean stopRequested() { return !proceed; }
    }

    record PostToolUse(boolean proceed) implements HookResult {
        @Override public HookEvent event() { return HookEvent.POST_TOOL_USE; }
        @Override public boolean stopRequested() { return !proceed; }
    }

    record Stop(boolean handled) implements HookResult {
        @Override public HookEvent event() { return HookEvent.STOP; }
    }

    record SessionStart(boolean handled) implements HookResult {
        @Override public HookEvent event() { return HookEvent.SESSION_START; }
    }

    record SessionEnd(boolean handled) implements HookResult {
        @Override public HookEvent event() { return HookEvent.SESSION_END; }
    }

    record SubagentStop(boolean handled) implements HookResult {
        @Override public HookEvent event() { return HookEvent.SUBAGENT_STOP; }
    }

    record PreCompact(boolean proceed, String summary) implements HookResult {
        @Override public HookEvent event() { return HookEvent.PRE_COMPACT; }
    }

    record UserPromptSubmit(boolean proceed) implements HookResult {
        @Override public HookEvent event() { return HookEvent.USER_PROMPT_SUBMIT; }
        @Override public boolean stopRequested() { return !proceed; }
    }
}
