package com.agentgate.providers;

import com.agentgate.shared.model.TokenUsage;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.ToolResult;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * History, usage and listener bookkeeping shared by transports. Subclasses
 * only turn a conversation into a reply.
 *
 * <p>The user turn of a call is committed together with the assistant
 * reply, so a failed stream followed by a blocking retry leaves exactly one
 * copy of the prompt in history.
 */
public abstract class AbstractModelProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractModelProvider.class);

    static final String SUMMARY_SYSTEM_PROMPT =
            "You summarize conversations between a user and an AI assistant accurately and concisely.";

    /** Text deltas of a reply; {@link #completion()} is valid once exhausted. */
    protected interface ReplyStream extends Iterator<String> {
        Completion completion();
    }

    private final String model;
    private String systemPrompt;
    private final List<Turn> turns = new ArrayList<>();
    private final List<Tool> tools = new ArrayList<>();
    private TokenUsage usage = TokenUsage.ZERO;
    private final List<Consumer<ToolRequest>> requestListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ToolResult>> resultListeners = new CopyOnWriteArrayList<>();

    protected AbstractModelProvider(String model, String systemPrompt) {
        this.model = model;
        this.systemPrompt = systemPrompt;
    }

    protected abstract ReplyStream openStream(String systemPrompt, List<Turn> conversation, List<Tool> tools);

    protected abstract Completion complete(String systemPrompt, List<Turn> conversation, List<Tool> tools);

    /** New instance on the same transport and model, with no history or tools. */
    protected abstract AbstractModelProvider copy();

    @Override public String model() { return model; }

    @Override public synchronized String systemPrompt() { return systemPrompt; }

    @Override public synchronized void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

    @Override public synchronized List<Turn> turns() { return List.copyOf(turns); }

    @Override
    public synchronized void setTurns(List<Turn> newTurns) {
        turns.clear();
        if (newTurns != null) turns.addAll(newTurns);
    }

    @Override public synchronized TokenUsage usage() { return usage; }

    @Override
    public synchronized void registerTools(Collection<Tool> newTools) {
        for (var tool : newTools) {
            tools.removeIf(t -> t.name().equals(tool.name()));
            tools.add(tool);
        }
    }

    protected synchronized List<Tool> tools() {
        return List.copyOf(tools);
    }

    @Override
    public ChatStream stream(String prompt) {
        var reply = openStream(systemPrompt(), pending(prompt), tools());
        return new ChatStream() {
            private Turn turn;

            @Override public boolean hasNext() { return turn == null && reply.hasNext(); }

            @Override
            public ChatEvent next() {
                if (!hasNext()) throw new NoSuchElementException();
                var delta = reply.next();
                return new ChatEvent(delta, !reply.hasNext());
            }

            @Override
            public Turn turn() {
                if (turn == null) {
                    while (reply.hasNext()) reply.next();
                    turn = commit(prompt, reply.completion());
                }
                return turn;
            }
        };
    }

    @Override
    public String chat(String prompt) {
        var completion = complete(systemPrompt(), pending(prompt), tools());
        return commit(prompt, completion).text();
    }

    @Override
    public void addToolResults(List<ToolResult> results) {
        if (results == null || results.isEmpty()) return;
        synchronized (this) {
            turns.add(Turn.toolResults(results));
        }
        for (var result : results) publish(resultListeners, result);
    }

    @Override
    public String summarize(String prompt) {
        var completion = complete(SUMMARY_SYSTEM_PROMPT, List.of(Turn.user(prompt)), List.of());
        synchronized (this) {
            usage = usage.plus(completion.usage());
        }
        return completion.text();
    }

    @Override
    public ModelProvider fork(String systemPrompt) {
        var child = copy();
        child.setSystemPrompt(systemPrompt);
        return child;
    }

    @Override public void onToolRequest(Consumer<ToolRequest> listener) { requestListeners.add(listener); }

    @Override public void onToolResult(Consumer<ToolResult> listener) { resultListeners.add(listener); }

    private synchronized List<Turn> pending(String prompt) {
        var conversation = new ArrayList<>(turns);
        if (prompt != null) conversation.add(Turn.user(prompt));
        return conversation;
    }

    private Turn commit(String prompt, Completion completion) {
        var turn = completion.toTurn();
        synchronized (this) {
            if (prompt != null) turns.add(Turn.user(prompt));
            turns.add(turn);
            usage = usage.plus(completion.usage());
        }
        for (var request : turn.toolRequests()) publish(requestListeners, request);
        return turn;
    }

    private static <T> void publish(List<Consumer<T>> listeners, T value) {
        for (var listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                log.warn("Tool listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
