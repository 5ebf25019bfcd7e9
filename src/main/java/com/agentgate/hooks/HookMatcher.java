package com.agentgate.hooks;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * One registered hook: the event it listens to, an optional tool-name
 * pattern, the callback and its deadline. A zero timeout runs the callback
 * inline on the loop thread.
 */
public record HookMatcher(HookEvent event, Pattern toolPattern, HookCallback callback, Duration timeout) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public HookMatcher {
        if (event == null) throw new IllegalArgumentException("event must not be null");
        if (callback == null) throw new IllegalArgumentException("callback must not be null");
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");
    }

    public HookMatcher(HookEvent event, String toolPattern, HookCallback callback) {
        this(event, toolPattern == null ? null : Pattern.compile(toolPattern), callback, DEFAULT_TIMEOUT);
    }

    /** No pattern matches everything; a pattern never matches an event without a tool. */
    public boolean matches(HookEvent firedEvent, String toolName) {
        if (firedEvent != event) return false;
        if (toolPattern == null) return true;
        return toolName != null && toolPattern.matcher(toolName).find();
    }

    public HookMatcher withTimeout(Duration newTimeout) {
        return new HookMatcher(event, toolPattern, callback, newTimeout);
    }

    public HookMatcher inline() {
        return withTimeout(Duration.ZERO);
    }

    public static HookMatcher preToolUse(String toolPattern, HookCallbacks.PreToolUse cb) {
        return new HookMatcher(HookEvent.PRE_TOOL_USE, toolPattern, input -> {
            var in = (HookInput.PreToolUse) input;
            return cb.apply(in.toolName(), in.toolInput(), in.context());
        });
    }

    public static HookMatcher postToolUse(String toolPattern, HookCallbacks.PostToolUse cb) {
        return new HookMatcher(HookEvent.POST_TOOL_USE, toolPattern, input -> {
            var in = (HookInput.PostToolUse) input;
            return cb.apply(in.toolName(), in.result(), in.error(), in.context());
        });
    }

    public static HookMatcher stop(HookCallbacks.Stop cb) {
        return new HookMatcher(HookEvent.STOP, null, input -> {
            var in = (HookInput.Stop) input;
            return cb.apply(in.reason(), in.context());
        });
    }

    public static HookMatcher sessionStart(HookCallbacks.SessionStart cb) {
        return new HookMatcher(HookEvent.SESSION_START, null,
                input -> cb.apply(input.context()));
    }

    public static HookMatcher sessionEnd(HookCallbacks.SessionEnd cb) {
        return new HookMatcher(HookEvent.SESSION_END, null, input -> {
            var in = (HookInput.SessionEnd) input;
            return cb.apply(in.reason(), in.context());
        });
    }

    public static HookMatcher subagentStop(HookCallbacks.SubagentStop cb) {
        return new HookMatcher(HookEvent.SUBAGENT_STOP, null, input -> {
            var in = (HookInput.SubagentStop) input;
            return cb.apply(in.agentName(), in.task(), in.result(), in.context());
        });
    }

    public static HookMatcher preCompact(HookCallbacks.PreCompact cb) {
        return new HookMatcher(HookEvent.PRE_COMPACT, null, input -> {
            var in = (HookInput.PreCompact) input;
            return cb.apply(in.turnsToCompact(), in.turnsToKeep(), in.context());
        });
    }

    public static HookMatcher userPromptSubmit(HookCallbacks.UserPromptSubmit cb) {
        return new HookMatcher(HookEvent.USER_PROMPT_SUBMIT, null, input -> {
            var in = (HookInput.UserPromptSubmit) input;
            return cb.apply(in.prompt(), in.context());
        });
    }
}
