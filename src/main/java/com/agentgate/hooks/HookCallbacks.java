package com.agentgate.hooks;

import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.Turn;

import java.util.List;
import java.util.Map;

/** Typed callback shapes, one per event; adapt with the {@link HookMatcher} factories. */
public final class HookCallbacks {

    private HookCallbacks() {}

    @FunctionalInterface
    public interface PreToolUse {
        HookResult.PreToolUse apply(String toolName, Map<String, Object> toolInput, HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface PostToolUse {
        HookResult.PostToolUse apply(String toolName, String result, String error, HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface Stop {
        HookResult.Stop apply(StopReason reason, HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface SessionStart {
        HookResult.SessionStart apply(HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface SessionEnd {
        HookResult.SessionEnd apply(StopReason reason, HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface SubagentStop {
        HookResult.SubagentStop apply(String agentName, String task, String result, HookContext context) throws Exception;
    }

    @FunctionalInterface
    public interface PreCompact {
        HookResult.PreCompact apply(List<Turn> turnsToCompact, List<Turn> turnsToKeep, HookContext context)
                throws Exception;
    }

    @FunctionalInterface
    public interface UserPromptSubmit {
        HookResult.UserPromptSubmit apply(String prompt, HookContext context) throws Exception;
    }
}
