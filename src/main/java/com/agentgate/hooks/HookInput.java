package com.agentgate.hooks;

import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.Turn;

import java.util.List;
import java.util.Map;

/** Arguments of one hook firing, one record per event. */
public sealed interface HookInput permits HookInput.PreToolUse, HookInput.PostToolUse, HookInput.Stop,
        HookInput.SessionStart, HookInput.SessionEnd, HookInput.SubagentStop, HookInput.PreCompact,
        HookInput.UserPromptSubmit {

    HookEvent event();

    HookContext context();

    /** Tool the event concerns, {@code null} for events that are not about a tool. */
    default String toolName() {
        return null;
    }

    record PreToolUse(String toolName, Map<String, Object> toolInput, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.PRE_TOOL_USE; }
    }

    record PostToolUse(String toolName, String result, String error, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.POST_TOOL_USE; }
    }

    record Stop(StopReason reason, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.STOP; }
    }

    record SessionStart(HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.SESSION_START; }
    }

    record SessionEnd(StopReason reason, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.SESSION_END; }
    }

    record SubagentStop(String agentName, String task, String result, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.SUBAGENT_STOP; }
    }

    record PreCompact(List<Turn> turnsToCompact, List<Turn> turnsToKeep, HookContext context) implements HookInput {
        public PreCompact {
            turnsToCompact = List.copyOf(turnsToCompact);
            turnsToKeep = List.copyOf(turnsToKeep);
        }

        @Override public HookEvent event() { return HookEvent.PRE_COMPACT; }
    }

    record UserPromptSubmit(String prompt, HookContext context) implements HookInput {
        @Override public HookEvent event() { return HookEvent.USER_PROMPT_SUBMIT; }
    }
}
