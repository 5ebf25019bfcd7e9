package com.agentgate.agent;

import com.agentgate.events.EventSink;
import com.agentgate.events.EventStream;
import com.agentgate.hooks.HookMatcher;
import com.agentgate.hooks.HookPipeline;
import com.agentgate.observability.AgentMetrics;
import com.agentgate.providers.ModelProvider;
import com.agentgate.security.PermissionGate;
import com.agentgate.security.Policy;
import com.agentgate.sessions.JsonSessionStore;
import com.agentgate.sessions.SessionSnapshot;
import com.agentgate.sessions.SessionStore;
import com.agentgate.shared.model.AgentEvent;
import com.agentgate.shared.model.AgentResult;
import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.TokenUsage;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.Tool;
import com.agentgate.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An LLM conversation with tools, a permission policy and lifecycle hooks.
 * One run at a time; history and cumulative cost carry over between runs.
 *
 * <pre>{@code
 * try (var agent = new Agent(provider, ToolBundles.fileTools(), "You are terse.", Policy.standard(dir), dir)) {
 *     agent.addHook(Hooks.blockDangerousBash());
 *     var result = agent.runSync("List the files here");
 * }
 * }</pre>
 */
public class Agent implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Agent.class);
    private static final AtomicInteger RUN_THREADS = new AtomicInteger();

    private final ModelProvider provider;
    private final Policy policy;
    private final Path workingDir;
    private final ToolRegistry tools = new ToolRegistry();
    private final HookPipeline hooks = new HookPipeline();
    private final BudgetTracker budget = new BudgetTracker();
    private final AgentLoop loop;
    private final ConversationCompactor compactor;
    private final AtomicBoolean running = new AtomicBoolean();
    private SessionStore sessionStore = new JsonSessionStore();
    private AgentMetrics metrics;

    public Agent(ModelProvider provider) {
        this(provider, Policy.standard(currentDir()), currentDir());
    }

    public Agent(ModelProvider provider, Policy policy, Path workingDir) {
        this(provider, List.of(), null, policy, workingDir);
    }

    public Agent(ModelProvider provider, Collection<? extends Tool> tools, String systemPrompt,
                 Policy policy, Path workingDir) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.workingDir = (workingDir != null ? workingDir : currentDir()).toAbsolutePath().normalize();
        this.policy = policy != null ? policy : Policy.standard(this.workingDir);
        if (systemPrompt != null) provider.setSystemPrompt(systemPrompt);
        this.loop = new AgentLoop(provider, this.tools, new PermissionGate(this.policy), hooks, budget,
                new StallDetector(), this.workingDir);
        this.compactor = new ConversationCompactor(provider, hooks, this.workingDir);
        if (tools != null) registerTools(tools);
    }

    public void setMetrics(AgentMetrics metrics) {
        this.metrics = metrics;
        loop.setMetrics(metrics);
        hooks.setMetrics(metrics);
    }

    public void setSessionStore(SessionStore sessionStore) {
        this.sessionStore = Objects.requireNonNull(sessionStore, "sessionStore");
    }

    public Agent registerTool(Tool tool) {
        tools.register(tool);
        provider.registerTools(List.of(tool));
        return this;
    }

    public Agent registerTools(Collection<? extends Tool> newTools) {
        for (var tool : newTools) registerTool(tool);
        return this;
    }

    public Agent addHook(HookMatcher hook) {
        hooks.add(hook);
        return this;
    }

    public HookPipeline hooks() {
        return hooks;
    }

    public EventStream run(String task) {
        return run(task, null, true);
    }

    public EventStream run(String task, Integer maxTurns) {
        return run(task, maxTurns, true);
    }

    /**
     * Starts a run on a background thread and returns its events. The stream
     * always ends with a stop event; cancel it to abort at the next turn.
     *
     * @param maxTurns turn ceiling for this run, {@code null} for the policy's
     * @param includePartial whether streamed text chunks are emitted
     * @throws IllegalStateException if a run is already in progress
     */
    public EventStream run(String task, Integer maxTurns, boolean includePartial) {
        if (task == null || task.isBlank()) throw new IllegalArgumentException("task must not be empty");
        int turns = maxTurns != null ? maxTurns : policy.maxTurns();
        if (turns < 1) throw new IllegalArgumentException("maxTurns must be >= 1, got " + turns);
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress on this agent");
        }

        var stream = new EventStream();
        var sink = new RunSink(stream.sink());
        var thread = new Thread(() -> {
            try {
                loop.execute(task, turns, sink, includePartial);
            } finally {
                if (!sink.stopped) running.set(false);
                sink.complete();
            }
        }, "agent-run-" + RUN_THREADS.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Run thread {} died", t.getName(), e));
        thread.start();
        return stream;
    }

    public AgentResult runSync(String task) {
        return runSync(task, null);
    }

    /** Runs to completion on a background thread and waits for the outcome. */
    public AgentResult runSync(String task, Integer maxTurns) {
        var started = Instant.now();
        var historyBefore = provider.turns().size();
        List<AgentEvent> events;
        try (var stream = run(task, maxTurns, true)) {
            events = stream.collect();
        }

        String response = "";
        StopReason reason = StopReason.ERROR;
        TokenUsage cost = provider.usage();
        for (var event : events) {
            if (event instanceof AgentEvent.TextComplete text) {
                response = text.text();
            } else if (event instanceof AgentEvent.Stop stop) {
                reason = stop.reason();
                cost = stop.cost();
            }
        }
        var history = provider.turns();
        var turns = historyBefore <= history.size()
                ? history.subList(historyBefore, history.size())
                : history;
        return new AgentResult(response, turns, cost, events, Duration.between(started, Instant.now()), reason);
    }

    public boolean compact() {
        return compact(ConversationCompactor.DEFAULT_KEEP_LAST, null);
    }

    public boolean compact(int keepLast) {
        return compact(keepLast, null);
    }

    /**
     * Replaces all but the last {@code keepLast} turns with a summary in the
     * system prompt. Returns false when there was nothing to compact or a
     * PreCompact hook cancelled.
     */
    public boolean compact(int keepLast, String summary) {
        if (running.get()) throw new IllegalStateException("Cannot compact while a run is in progress");
        return compactor.compact(keepLast, summary);
    }

    public int compactionCount() {
        return compactor.compactions();
    }

    public void saveSession(Path path) {
        var names = new ArrayList<String>();
        for (var tool : tools.all()) names.add(tool.name());
        var snapshot = new SessionSnapshot(SessionSnapshot.CURRENT_FORMAT_VERSION, Instant.now().toString(),
                provider.id(), provider.model(), workingDir.toString(), provider.systemPrompt(), names,
                provider.turns());
        sessionStore.save(path, snapshot);
        log.info("Session saved to {} ({} turns)", path, snapshot.turns().size());
    }

    /** Restores history and system prompt. Tools and policy stay as configured on this agent. */
    public void loadSession(Path path) {
        if (running.get()) throw new IllegalStateException("Cannot load a session while a run is in progress");
        var snapshot = sessionStore.load(path);
        if (snapshot.provider() != null && !snapshot.provider().equals(provider.id())) {
            log.warn("Session {} was saved with provider {}, now using {}", path, snapshot.provider(), provider.id());
        }
        for (var name : snapshot.toolNames()) {
            if (tools.get(name) == null) log.warn("Session {} refers to unregistered tool {}", path, name);
        }
        provider.setSystemPrompt(snapshot.systemPrompt());
        provider.setTurns(snapshot.turns());
        log.info("Session loaded from {} ({} turns)", path, snapshot.turns().size());
    }

    public BudgetState budget() {
        return budget.state();
    }

    public TokenUsage cost() {
        return provider.usage();
    }

    public List<Turn> turns() {
        return provider.turns();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Policy policy() { return policy; }

    public Path workingDir() { return workingDir; }

    public ModelProvider provider() { return provider; }

    public Collection<Tool> tools() { return tools.all(); }

    protected AgentMetrics metrics() { return metrics; }

    @Override
    public void close() {
        hooks.close();
    }

    private static Path currentDir() {
        return Path.of("").toAbsolutePath();
    }

    // Frees the agent for the next run as soon as the stop event is handed to
    // the consumer, so a caller that has just read it can start another run.
    private final class RunSink implements EventSink {
        private final EventSink delegate;
        private volatile boolean stopped;

        RunSink(EventSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void emit(AgentEvent event) {
            if (event instanceof AgentEvent.Stop) {
                stopped = true;
                running.set(false);
            }
            delegate.emit(event);
        }

        @Override
        public boolean isCancelled() {
            return delegate.isCancelled();
        }

        @Override
        public void complete() {
            delegate.complete();
        }
    }
}
