package com.agentgate.hooks;

import com.agentgate.observability.AgentMetrics;
import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.Turn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HookPipelineTest {

    private final HookPipeline pipeline = new HookPipeline();

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private static HookInput.PreToolUse preToolUse(String tool) {
        return new HookInput.PreToolUse(tool, Map.of(), HookContext.of(Path.of(".")));
    }

    private static HookInput.Stop stopInput() {
        return new HookInput.Stop(StopReason.COMPLETE, HookContext.of(null));
    }

    @Test
    void noHooksMeansNoResult() {
        assertThat(pipeline.fire(preToolUse("read_file"))).isEmpty();
    }

    @Test
    void hooksRunInOrderAndFirstResultWins() {
        var calls = new ArrayList<String>();
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> {
            calls.add("first");
            return null;
        }));
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> {
            calls.add("second");
            return HookResult.PreToolUse.deny("second says no");
        }));
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> {
            calls.add("third");
            return HookResult.PreToolUse.allow();
        }));

        var result = pipeline.fire(preToolUse("write_file"));

        assertThat(result).contains(HookResult.PreToolUse.deny("second says no"));
        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void toolPatternFiltersByName() {
        pipeline.add(HookMatcher.preToolUse("^run_bash$", (tool, input, ctx) -> HookResult.PreToolUse.deny("bash")));

        assertThat(pipeline.fire(preToolUse("read_file"))).isEmpty();
        assertThat(pipeline.fire(preToolUse("run_bash"))).isPresent();
    }

    @Test
    void patternedHookIgnoresEventsWithoutTool() {
        var matcher = new HookMatcher(HookEvent.STOP, "anything", input -> new HookResult.Stop(true));
        assertThat(matcher.matches(HookEvent.STOP, null)).isFalse();
        assertThat(matcher.matches(HookEvent.SESSION_END, "anything")).isFalse();
    }

    @Test
    void failingPreToolUseHookDenies() {
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> {
            throw new IllegalStateException("rule engine offline");
        }));
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> HookResult.PreToolUse.allow()));

        var result = pipeline.fire(preToolUse("read_file")).orElseThrow();

        assertThat(result).isInstanceOf(HookResult.PreToolUse.class);
        var pre = (HookResult.PreToolUse) result;
        assertThat(pre.denied()).isTrue();
        assertThat(pre.reason()).isEqualTo("Hook callback error: rule engine offline");
        assertThat(pipeline.errorLog().failures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.event()).isEqualTo(HookEvent.PRE_TOOL_USE);
                    assertThat(f.toolName()).isEqualTo("read_file");
                });
    }

    @Test
    void failingOtherHookAbstains() {
        pipeline.add(HookMatcher.stop((reason, ctx) -> {
            throw new RuntimeException();
        }));
        pipeline.add(HookMatcher.stop((reason, ctx) -> new HookResult.Stop(true)));

        assertThat(pipeline.fire(stopInput())).contains(new HookResult.Stop(true));
        assertThat(pipeline.errorLog().failures()).singleElement()
                .satisfies(f -> assertThat(f.message()).isEqualTo("RuntimeException"));
    }

    @Test
    void timedOutPreToolUseHookDenies() {
        pipeline.add(HookMatcher.preToolUse(null, (tool, input, ctx) -> {
            Thread.sleep(5_000);
            return HookResult.PreToolUse.allow();
        }).withTimeout(Duration.ofMillis(100)));

        var result = (HookResult.PreToolUse) pipeline.fire(preToolUse("read_file")).orElseThrow();

        assertThat(result.denied()).isTrue();
        assertThat(result.reason()).isEqualTo("Hook callback error: Hook timed out after 100ms");
    }

    @Test
    void callbackIgnoringInterruptHoldsItsWorkerUntilItReturns() throws Exception {
        var release = new AtomicBoolean();
        var calls = new AtomicInteger();
        try (var bounded = new HookPipeline(1)) {
            bounded.add(HookMatcher.sessionStart(ctx -> {
                calls.incrementAndGet();
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                return null;
            }).withTimeout(Duration.ofMillis(100)));
            var start = new HookInput.SessionStart(HookContext.of(null));

            assertThat(bounded.fire(start)).isEmpty();
            assertThat(bounded.busyWorkers()).isEqualTo(1);

            // Pool exhausted: the second firing fails without running the callback.
            assertThat(bounded.fire(start)).isEmpty();
            assertThat(calls.get()).isEqualTo(1);
            assertThat(bounded.errorLog().failures())
                    .extracting(HookFailure::message)
                    .containsExactly("Hook timed out after 100ms",
                            "Hook worker limit reached (1 callbacks still running)");

            release.set(true);
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (bounded.busyWorkers() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(bounded.busyWorkers()).isZero();
        }
    }

    @Test
    void rejectsNonPositiveWorkerLimit() {
        assertThatThrownBy(() -> new HookPipeline(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultForAnotherEventIsAFailure() {
        pipeline.add(new HookMatcher(HookEvent.STOP, (String) null, input -> new HookResult.SessionEnd(true)));
        pipeline.add(new HookMatcher(HookEvent.PRE_TOOL_USE, (String) null, input -> new HookResult.PostToolUse(true)));

        assertThat(pipeline.fire(stopInput())).isEmpty();
        var pre = (HookResult.PreToolUse) pipeline.fire(preToolUse("x")).orElseThrow();
        assertThat(pre.denied()).isTrue();
        assertThat(pre.reason()).contains("returned a PostToolUse result");
        assertThat(pipeline.errorLog().size()).isEqualTo(2);
    }

    @Test
    void inlineHookRunsOnCallerThread() {
        var threads = new ArrayList<String>();
        pipeline.add(HookMatcher.sessionStart(ctx -> {
            threads.add(Thread.currentThread().getName());
            return null;
        }).inline());
        pipeline.add(HookMatcher.sessionStart(ctx -> {
            threads.add(Thread.currentThread().getName());
            return null;
        }));

        pipeline.fire(new HookInput.SessionStart(HookContext.of(null)));

        assertThat(threads).hasSize(2);
        assertThat(threads.get(0)).isEqualTo(Thread.currentThread().getName());
        assertThat(threads.get(1)).startsWith("hook-worker-");
    }

    @Test
    void typedCallbacksReceiveTheirArguments() {
        var seen = new ArrayList<Object>();
        pipeline.add(HookMatcher.subagentStop((name, task, result, ctx) -> {
            seen.addAll(List.of(name, task, result));
            return null;
        }));
        pipeline.add(HookMatcher.preCompact((compact, keep, ctx) -> {
            seen.addAll(List.of(compact.size(), keep.get(0).text(), ctx.get("trigger")));
            return new HookResult.PreCompact(true, "custom");
        }));

        pipeline.fire(new HookInput.SubagentStop("code_reader", "read it", "done", HookContext.of(null)));
        var compact = pipeline.fire(new HookInput.PreCompact(
                List.of(Turn.user("old question"), Turn.assistant("old answer")),
                List.of(Turn.user("latest")),
                HookContext.of(null).with("trigger", "manual")));

        assertThat(seen).containsExactly("code_reader", "read it", "done", 2, "latest", "manual");
        assertThat(compact).contains(new HookResult.PreCompact(true, "custom"));
    }

    @Test
    void failuresAreCountedInMetrics() {
        var metrics = new AgentMetrics();
        pipeline.setMetrics(metrics);
        pipeline.add(HookMatcher.sessionEnd((reason, ctx) -> {
            throw new IllegalArgumentException("bad");
        }));

        pipeline.fire(new HookInput.SessionEnd(StopReason.ERROR, HookContext.of(null)));

        assertThat(metrics.hookFailures("SessionEnd").count()).isEqualTo(1.0);
    }

    @Test
    void removeUnregistersHook() {
        var hook = HookMatcher.stop((reason, ctx) -> new HookResult.Stop(true));
        pipeline.add(hook);
        assertThat(pipeline.size()).isEqualTo(1);
        assertThat(pipeline.remove(hook)).isTrue();
        assertThat(pipeline.fire(stopInput())).isEmpty();
    }

    @Test
    void stopRequestedFollowsProceedFlag() {
        assertThat(HookResult.PreToolUse.denyAndStop("x").stopRequested()).isTrue();
        assertThat(HookResult.PreToolUse.deny("x").stopRequested()).isFalse();
        assertThat(new HookResult.PostToolUse(false).stopRequested()).isTrue();
        assertThat(new HookResult.UserPromptSubmit(true).stopRequested()).isFalse();
        assertThat(new HookResult.Stop(true).stopRequested()).isFalse();
    }

    @Test
    void eventWireNames() {
        assertThat(HookEvent.fromWireName("PreCompact")).isEqualTo(HookEvent.PRE_COMPACT);
        assertThat(HookEvent.fromWireName("session_start")).isEqualTo(HookEvent.SESSION_START);
        assertThat(HookEvent.USER_PROMPT_SUBMIT.wireName()).isEqualTo("UserPromptSubmit");
    }
}
