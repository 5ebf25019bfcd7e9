package com.agentgate.sessions;

import com.agentgate.shared.model.Turn;

import java.util.List;

/**
 * Everything needed to resume a conversation: history, system prompt and the
 * names of the tools that were registered. The permission policy is not part
 * of a session; a resumed agent uses the policy it was built with.
 */
public record SessionSnapshot(
    int formatVersion,
    String savedAt,
    String provider,
    String model,
    String workingDir,
    String systemPrompt,
    List<String> toolNames,
    List<Turn> turns
) {
    public static final int CURRENT_FORMAT_VERSION = 1;

    public SessionSnapshot {
        toolNames = toolNames != null ? List.copyOf(toolNames) : List.of();
        turns = turns != null ? List.copyOf(turns) : List.of();
    }
}
