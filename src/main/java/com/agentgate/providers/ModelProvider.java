package com.agentgate.providers;

import com.agentgate.shared.model.Role;
import com.agentgate.shared.model.TokenUsage;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.ToolResult;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.Tool;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Conversation with one language model. The provider owns the turn history;
 * the agent loop drives it and executes the tools the model requests.
 */
public interface ModelProvider {
    String id();
    String model();

    String systemPrompt();
    void setSystemPrompt(String systemPrompt);

    List<Turn> turns();
    void setTurns(List<Turn> turns);

    /** Cumulative tokens and cost over every call made through this provider. */
    TokenUsage usage();

    void registerTools(Collection<Tool> tools);

    /** Streams the reply to {@code prompt}; a {@code null} prompt continues after tool results. */
    ChatStream stream(String prompt);

    /** Blocking counterpart of {@link #stream}; the assistant turn is appended to history. */
    String chat(String prompt);

    void addToolResults(List<ToolResult> results);

    /** One-off completion outside the history, used for conversation summaries. */
    String summarize(String prompt);

    /** Fresh provider on the same model and transport with an empty history. */
    ModelProvider fork(String systemPrompt);

    void onToolRequest(Consumer<ToolRequest> listener);
    void onToolResult(Consumer<ToolResult> listener);

    default Optional<Turn> lastTurn(Role role) {
        var all = turns();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).role() == role) return Optional.of(all.get(i));
        }
        return Optional.empty();
    }
}
