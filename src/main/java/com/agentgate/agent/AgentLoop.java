package com.agentgate.agent;

import com.agentgate.errors.PermissionDeniedException;
import com.agentgate.errors.ProviderException;
import com.agentgate.errors.ToolExecutionException;
import com.agentgate.events.EventSink;
import com.agentgate.hooks.HookContext;
import com.agentgate.hooks.HookInput;
import com.agentgate.hooks.HookPipeline;
import com.agentgate.hooks.HookResult;
import com.agentgate.observability.AgentMetrics;
import com.agentgate.observability.CostTracker;
import com.agentgate.providers.ModelProvider;
import com.agentgate.security.PermissionContext;
import com.agentgate.security.PermissionGate;
import com.agentgate.security.PermissionResult;
import com.agentgate.shared.model.AgentEvent;
import com.agentgate.shared.model.Role;
import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.ToolResult;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.Tool;
import com.agentgate.tools.ToolAnnotations;
import com.agentgate.tools.ToolContext;
import com.agentgate.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Drives one task to a stop reason: model call, tool calls (gated by the
 * policy and PreToolUse hooks), budget checks, then the next model call.
 * Every run ends with the Stop and SessionEnd hooks and a final stop event,
 * whatever the reason. A tool that throws an {@link Error} yields an error
 * result; a {@link VirtualMachineError} ends the run with {@code ERROR} and is
 * rethrown once the stop event is out.
 */
public class AgentLoop {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ModelProvider provider;
    private final ToolRegistry tools;
    private final PermissionGate gate;
    private final HookPipeline hooks;
    private final BudgetTracker budget;
    private final StallDetector stallDetector;
    private final Path workingDir;
    private AgentMetrics metrics;

    public AgentLoop(ModelProvider provider, ToolRegistry tools, PermissionGate gate,
                     HookPipeline hooks, BudgetTracker budget, StallDetector stallDetector, Path workingDir) {
        this.provider = provider;
        this.tools = tools;
        this.gate = gate;
        this.hooks = hooks;
        this.budget = budget;
        this.stallDetector = stallDetector;
        this.workingDir = workingDir;
    }

    public void setMetrics(AgentMetrics metrics) {
        this.metrics = metrics;
    }

    /** Runs on the calling thread and returns once the final stop event has been emitted. */
    public StopReason execute(String task, int maxTurns, EventSink sink, boolean includePartial) {
        return new Run(task, maxTurns, sink, includePartial).execute();
    }

    private final class Run {
        private final String runId = UUID.randomUUID().toString();
        private final String task;
        private final int maxTurns;
        private final EventSink sink;
        private final boolean includePartial;
        private int turnNumber;
        private boolean stopRequested;
        private long tokensAtStart;

        Run(String task, int maxTurns, EventSink sink, boolean includePartial) {
            this.task = task;
            this.maxTurns = maxTurns;
            this.sink = sink;
            this.includePartial = includePartial;
        }

        StopReason execute() {
            log.info("Run {} started (maxTurns={})", runId, maxTurns);
            emit(AgentEvent.start(task));
            var reason = StopReason.ERROR;
            try {
                reason = loop();
            } catch (RuntimeException e) {
                log.error("Run {} failed", runId, e);
                emit(AgentEvent.warning("Run failed: " + describe(e)));
            } catch (VirtualMachineError e) {
                log.error("Run {} aborted", runId, e);
                emit(AgentEvent.warning("Run aborted: " + describe(e)));
                throw e;
            } catch (Error e) {
                log.error("Run {} failed", runId, e);
                emit(AgentEvent.warning("Run failed: " + describe(e)));
            } finally {
                finish(reason);
            }
            return reason;
        }

        private StopReason loop() {
            var usageAtStart = provider.usage();
            tokensAtStart = usageAtStart.totalTokens();
            budget.reset(maxTurns, gate.policy().maxCostUsd(), usageAtStart.costUsd());
            stallDetector.reset();

            var startContext = new HookContext(workingDir, mapOf(
                    "run_id", runId,
                    "permission_mode", gate.policy().mode().settingName(),
                    "provider", provider.id(),
                    "model", provider.model(),
                    "tools_count", tools.size()));
            hooks.fire(new HookInput.SessionStart(startContext));
            var submit = hooks.fire(new HookInput.UserPromptSubmit(task, HookContext.of(workingDir)));
            if (submit.map(HookResult::stopRequested).orElse(false)) {
                log.info("Run {} stopped by UserPromptSubmit hook", runId);
                return StopReason.HOOK_REQUESTED_STOP;
            }

            String prompt = task;
            while (true) {
                if (sink.isCancelled()) return StopReason.CANCELLED;
                if (stopRequested) return StopReason.HOOK_REQUESTED_STOP;
                if (budget.costBreached()) return StopReason.COST_LIMIT;

                Turn turn;
                try {
                    turn = callModel(prompt);
                } catch (ProviderException e) {
                    log.error("Run {}: model call failed: {}", runId, e.getMessage(), e);
                    emit(AgentEvent.warning("Model call failed: " + e.getMessage()));
                    return StopReason.ERROR;
                }
                prompt = null;
                turnNumber++;
                if (metrics != null) metrics.turns().increment();

                var text = turn.text();
                if (!text.isEmpty()) emit(AgentEvent.textComplete(text));
                if (stallDetector.observe(turn)) {
                    log.warn("Run {}: agent may be stalled, identical response at turn {}", runId, turnNumber);
                    emit(AgentEvent.warning("Agent may be stalled - identical response detected"));
                }
                budget.recordTurn(provider.usage().costUsd());

                var requests = turn.toolRequests();
                var interrupted = !requests.isEmpty() && runTools(requests);

                if (budget.costWarningDue()) {
                    var state = budget.state();
                    emit(AgentEvent.warning("Approaching cost limit: " + CostTracker.format(state.costUsed())
                            + " / " + CostTracker.format(state.maxCostUsd())));
                }
                emit(AgentEvent.turnComplete(turn, turnNumber));

                if (interrupted) return StopReason.ERROR;
                if (budget.costBreached()) return StopReason.COST_LIMIT;
                if (stopRequested) return StopReason.HOOK_REQUESTED_STOP;
                if (requests.isEmpty()) return StopReason.COMPLETE;
                if (budget.turnsBreached()) return StopReason.MAX_TURNS;
            }
        }

        private Turn callModel(String prompt) {
            var started = System.nanoTime();
            try {
                var stream = provider.stream(prompt);
                while (stream.hasNext()) {
                    var delta = stream.next().delta();
                    if (includePartial && delta != null && !delta.isEmpty()) {
                        emit(AgentEvent.textChunk(delta));
                    }
                }
                var turn = stream.turn();
                record("stream", started);
                return turn;
            } catch (RuntimeException e) {
                var message = describe(e);
                log.warn("Streaming failed, falling back to non-streaming: {}", message);
                emit(AgentEvent.warning("Streaming failed, falling back to non-streaming: " + message));
                if (metrics != null) metrics.providerFallbacks().increment();
            }

            started = System.nanoTime();
            try {
                var text = provider.chat(prompt);
                if (includePartial && text != null && !text.isEmpty()) emit(AgentEvent.textChunk(text));
                record("chat", started);
                return provider.lastTurn(Role.ASSISTANT)
                        .orElseThrow(() -> new ProviderException("Provider recorded no assistant turn"));
            } catch (ProviderException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ProviderException("Model call failed: " + describe(e), e);
            }
        }

        /** Returns true when a denial interrupted the run. */
        private boolean runTools(List<ToolRequest> requests) {
            if (metrics != null) metrics.toolRequests().increment(requests.size());
            var results = new ArrayList<ToolResult>();
            if (budget.costBreached()) {
                var reason = budget.breachException().map(Throwable::getMessage).orElse("Budget exhausted");
                log.info("Run {}: rejecting {} tool call(s): {}", runId, requests.size(), reason);
                for (var request : requests) results.add(ToolResult.failure(request, reason));
                provider.addToolResults(results);
                return false;
            }

            String interruptReason = null;
            for (var request : requests) {
                if (interruptReason != null) {
                    results.add(ToolResult.failure(request, "Not executed: run interrupted (" + interruptReason + ")"));
                    continue;
                }
                try {
                    results.add(executeRequest(request));
                } catch (PermissionDeniedException e) {
                    log.info("Run {}: tool {} denied: {}", runId, request.name(), e.getMessage());
                    results.add(ToolResult.failure(request, e.getMessage()));
                    if (e.interrupt()) interruptReason = e.getMessage();
                }
            }
            provider.addToolResults(results);
            return interruptReason != null;
        }

        private ToolResult executeRequest(ToolRequest request) {
            var name = request.name();
            var tool = tools.get(name);
            var annotations = tool != null ? tool.annotations() : ToolAnnotations.none();

            var permission = gate.check(name, request.arguments(), new PermissionContext(workingDir, annotations));
            if (permission instanceof PermissionResult.Deny deny) {
                if (metrics != null) metrics.denials("policy").increment();
                throw new PermissionDeniedException(name, deny.reason(), deny.interrupt());
            }

            var preContext = HookContext.of(workingDir).with("tool_annotations", annotations);
            var pre = hooks.fire(new HookInput.PreToolUse(name, request.arguments(), preContext))
                    .map(HookResult.PreToolUse.class::cast);
            if (pre.isPresent()) {
                if (pre.get().stopRequested()) stopRequested = true;
                if (pre.get().denied()) {
                    if (metrics != null) metrics.denials("hook").increment();
                    var reason = pre.get().reason();
                    throw new PermissionDeniedException(name, reason != null ? reason : "Denied by hook");
                }
            }

            emit(AgentEvent.toolStart(request));
            var result = invoke(tool, request);
            emit(AgentEvent.toolEnd(result));

            var post = hooks.fire(new HookInput.PostToolUse(name, result.value(), result.error(),
                    HookContext.of(workingDir)));
            if (post.map(HookResult::stopRequested).orElse(false)) stopRequested = true;
            return result;
        }

        private ToolResult invoke(Tool tool, ToolRequest request) {
            if (tool == null) return ToolResult.failure(request, "Unknown tool: " + request.name());
            if (metrics != null) metrics.toolCalls(tool.name()).increment();
            try {
                var output = tool.execute(new ToolContext(workingDir, runId), MAPPER.valueToTree(request.arguments()));
                if (output == null) return ToolResult.failure(request, "Tool returned no output");
                return output.isError()
                        ? ToolResult.failure(request, output.output())
                        : ToolResult.success(request, output.output());
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                var failure = new ToolExecutionException("Tool '" + request.name() + "' failed: " + describe(e), e);
                log.warn("Run {}: {}", runId, failure.getMessage(), e);
                return ToolResult.failure(request, failure.getMessage());
            }
        }

        private void finish(StopReason reason) {
            var usage = provider.usage();
            var context = new HookContext(workingDir, mapOf(
                    "run_id", runId,
                    "total_turns", turnNumber,
                    "cost", usage));
            hooks.fire(new HookInput.Stop(reason, context));
            hooks.fire(new HookInput.SessionEnd(reason, context));
            if (metrics != null) {
                metrics.runs(reason.wireName()).increment();
                metrics.tokensUsed().increment(Math.max(0, usage.totalTokens() - tokensAtStart));
            }
            log.info("Run {} finished: {} after {} turn(s), cost {}", runId, reason, turnNumber,
                    CostTracker.format(usage.costUsd()));
            emit(AgentEvent.stop(reason, turnNumber, usage));
        }

        private void record(String mode, long startedNanos) {
            if (metrics != null) {
                metrics.llmLatency(mode).record(System.nanoTime() - startedNanos, TimeUnit.NANOSECONDS);
            }
        }

        private void emit(AgentEvent event) {
            sink.emit(event);
        }
    }

    private static LinkedHashMap<String, Object> mapOf(Object... kv) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < kv.length; i += 2) map.put((String) kv[i], kv[i + 1]);
        return map;
    }

    private static String describe(Throwable e) {
        var message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
