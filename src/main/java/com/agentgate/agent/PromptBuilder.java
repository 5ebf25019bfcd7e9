package com.agentgate.agent;

import com.agentgate.shared.model.Role;
import com.agentgate.shared.model.Turn;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/** System-prompt and summarization-prompt text. */
public final class PromptBuilder {

    public static final String SUMMARY_HEADER = "## Previous Conversation Summary";
    public static final String SUB_AGENTS_HEADER = "# Available Sub-Agents";

    private static final int FALLBACK_TURN_CHARS = 200;

    private PromptBuilder() {}

    public static String withSummary(String systemPrompt, String summary) {
        var base = systemPrompt != null ? systemPrompt : "";
        return base + "\n\n" + SUMMARY_HEADER + "\n" + summary;
    }

    public static String summarizationPrompt(List<Turn> turns) {
        var conversation = turns.stream()
                .map(PromptBuilder::describe)
                .collect(Collectors.joining("\n\n"));
        return "Summarize the following conversation excerpt concisely. Focus on:\n"
                + "1. Key decisions made\n"
                + "2. Important findings or results\n"
                + "3. Files created, modified, or discussed\n"
                + "4. Any errors encountered and how they were resolved\n"
                + "5. Current state/progress of the task\n\n"
                + "Keep the summary under 500 words. Be factual and specific.\n\n"
                + "Conversation to summarize:\n---\n"
                + conversation
                + "\n---\n\nSummary:";
    }

    /** Text-only summary used when the model cannot produce one. */
    public static String fallbackSummary(List<Turn> turns) {
        var parts = turns.stream()
                .map(t -> roleLabel(t) + ": " + truncate(textOrPlaceholder(t), FALLBACK_TURN_CHARS))
                .collect(Collectors.joining("\n\n"));
        return "[Compacted " + turns.size() + " earlier turns - LLM summary unavailable]\n\n" + parts;
    }

    public static String leadPrompt(String basePrompt, Collection<AgentDefinition> subAgents) {
        var sb = new StringBuilder();
        if (basePrompt != null) sb.append(basePrompt).append("\n\n");
        if (!subAgents.isEmpty()) {
            sb.append(SUB_AGENTS_HEADER).append("\n\n")
              .append("You can delegate specialized tasks to these sub-agents using the\n")
              .append("`").append(DelegateTool.NAME).append("` tool:\n\n");
            for (var def : subAgents) {
                sb.append("## ").append(def.name()).append("\n")
                  .append(def.description()).append("\n\n");
            }
            sb.append("When delegating, provide a clear task description. The sub-agent\n")
              .append("will complete the task and return results to you.\n");
        }
        return sb.toString();
    }

    /** The part of a lead prompt before the sub-agent section, or {@code null} if empty. */
    public static String basePrompt(String fullPrompt) {
        if (fullPrompt == null || fullPrompt.isEmpty()) return null;
        var idx = fullPrompt.indexOf(SUB_AGENTS_HEADER);
        if (idx < 0) return fullPrompt;
        var base = fullPrompt.substring(0, idx).stripTrailing();
        return base.isEmpty() ? null : base;
    }

    static String truncate(String text, int max) {
        if (text.length() <= max) return text;
        return text.substring(0, max - 3) + "...";
    }

    private static String describe(Turn turn) {
        var tools = turn.toolRequests();
        var toolInfo = turn.role() == Role.ASSISTANT && !tools.isEmpty()
                ? " [Tools: " + tools.stream().map(t -> t.name()).collect(Collectors.joining(", ")) + "]"
                : "";
        return roleLabel(turn) + toolInfo + ": " + textOrPlaceholder(turn);
    }

    private static String roleLabel(Turn turn) {
        return turn.role() == Role.ASSISTANT ? "Assistant" : "User";
    }

    private static String textOrPlaceholder(Turn turn) {
        var text = turn.text();
        return text.isEmpty() ? "[no text]" : text;
    }
}
