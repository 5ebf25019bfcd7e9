package com.agentgate.hooks;

public enum HookEvent {
    PRE_TOOL_USE("PreToolUse"),
    POST_TOOL_USE("PostToolUse"),
    STOP("Stop"),
    SESSION_START("SessionStart"),
    SESSION_END("SessionEnd"),
    SUBAGENT_STOP("SubagentStop"),
    PRE_COMPACT("PreCompact"),
    USER_PROMPT_SUBMIT("UserPromptSubmit");

    private final String wireName;

    HookEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static HookEvent fromWireName(String name) {
        for (var e : values()) {
            if (e.wireName.equals(name) || e.name().equalsIgnoreCase(name)) return e;
        }
        throw new IllegalArgumentException("Invalid hook event: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
