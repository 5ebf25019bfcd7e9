package com.agentgate.hooks;

import com.agentgate.errors.HookException;
import com.agentgate.observability.AgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the hooks registered for an event in registration order and returns
 * the first non-null result.
 *
 * <p>A failing PreToolUse hook (exception, timeout or a result for another
 * event) denies the tool call. Failures of every other event only make that
 * hook abstain; they are logged, counted and kept in {@link #errorLog()}.
 *
 * <p>A timed-out callback is interrupted, not killed: one that ignores the
 * interrupt keeps its worker thread until it returns. At most
 * {@code maxWorkers} callbacks run at once; while they are all busy, further
 * non-inline hooks fail at once as if they had timed out.
 */
public class HookPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HookPipeline.class);

    private final List<HookMatcher> hooks = new CopyOnWriteArrayList<>();
    private final HookErrorLog errorLog = new HookErrorLog();
    public static final int DEFAULT_MAX_WORKERS = 16;

    private final ExecutorService executor;
    private final Semaphore workers;
    private final int maxWorkers;
    private AgentMetrics metrics;

    public HookPipeline() {
        this(DEFAULT_MAX_WORKERS);
    }

    public HookPipeline(int maxWorkers) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        this.maxWorkers = maxWorkers;
        this.workers = new Semaphore(maxWorkers);
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "hook-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void setMetrics(AgentMetrics metrics) {
        this.metrics = metrics;
    }

    public HookPipeline add(HookMatcher hook) {
        if (hook == null) throw new IllegalArgumentException("hook must not be null");
        hooks.add(hook);
        return this;
    }

    public boolean remove(HookMatcher hook) {
        return hooks.remove(hook);
    }

    public List<HookMatcher> hooks() {
        return List.copyOf(hooks);
    }

    public int size() {
        return hooks.size();
    }

    public HookErrorLog errorLog() {
        return errorLog;
    }

    /** Callbacks currently holding a worker, including ones that outlived their timeout. */
    public int busyWorkers() {
        return maxWorkers - workers.availablePermits();
    }

    public Optional<HookResult> fire(HookInput input) {
        var event = input.event();
        var toolName = input.toolName();
        for (var hook : hooks) {
            if (!hook.matches(event, toolName)) continue;
            HookResult result;
            try {
                result = invoke(hook, input);
                if (result != null && result.event() != event) {
                    throw new HookException("Hook for " + event + " returned a " + result.event() + " result");
                }
            } catch (Exception e) {
                var message = describe(e);
                recordFailure(event, toolName, message, e);
                if (event == HookEvent.PRE_TOOL_USE) {
                    return Optional.of(HookResult.PreToolUse.deny("Hook callback error: " + message));
                }
                continue;
            }
            if (result != null) {
                log.debug("Hook {} answered for tool {}: {}", event, toolName, result);
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    private HookResult invoke(HookMatcher hook, HookInput input) throws Exception {
        if (hook.timeout().isZero()) {
            return hook.callback().handle(input);
        }
        if (!workers.tryAcquire()) {
            throw new HookException("Hook worker limit reached (" + maxWorkers + " callbacks still running)");
        }
        var started = new AtomicBoolean();
        Future<HookResult> future;
        try {
            future = executor.submit(() -> {
                if (!started.compareAndSet(false, true)) return null;
                try {
                    return hook.callback().handle(input);
                } finally {
                    workers.release();
                }
            });
        } catch (RuntimeException e) {
            workers.release();
            throw e;
        }
        try {
            return future.get(hook.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(future, started);
            throw new HookException("Hook timed out after " + hook.timeout().toMillis() + "ms");
        } catch (InterruptedException e) {
            cancel(future, started);
            Thread.currentThread().interrupt();
            throw new HookException("Interrupted while waiting for hook", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw new HookException("Hook failed: " + cause, cause);
        }
    }

    // A task cancelled before it started never runs, so its permit is returned here.
    private void cancel(Future<HookResult> future, AtomicBoolean started) {
        future.cancel(true);
        if (started.compareAndSet(false, true)) workers.release();
    }

    private void recordFailure(HookEvent event, String toolName, String message, Exception e) {
        errorLog.record(event, toolName, message);
        if (metrics != null) metrics.hookFailures(event.wireName()).increment();
        if (toolName != null) {
            log.error("Hook {} failed for tool {}: {}", event, toolName, message, e);
        } else {
            log.error("Hook {} failed: {}", event, message, e);
        }
    }

    private static String describe(Exception e) {
        var message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
