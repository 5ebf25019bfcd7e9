package com.agentgate.agent;

import com.agentgate.hooks.HookMatcher;
import com.agentgate.security.Policy;
import com.agentgate.shared.model.StopReason;
import com.agentgate.shared.model.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LeadAgentTest {

    @TempDir
    Path tempDir;

    @Test
    void systemPromptListsSubAgents() {
        var provider = new ScriptedProvider();
        var reader = new AgentDefinition("code_reader", "Reads code files", "You read code");
        try (var lead = new LeadAgent(provider, List.of(reader), List.of(), "You are a lead agent.",
                Policy.standard(tempDir), tempDir)) {
            var prompt = provider.systemPrompt();
            assertThat(prompt)
                    .startsWith("You are a lead agent.")
                    .contains("# Available Sub-Agents")
                    .contains("## code_reader\nReads code files")
                    .contains("delegate_to_agent");
            assertEquals(List.of("code_reader"), lead.availableSubAgents());
            assertThat(lead.tools()).extracting(t -> t.name()).contains(DelegateTool.NAME);
        }
    }

    @Test
    void registeringSubAgentRebuildsPromptWithoutDuplicatingBase() {
        var provider = new ScriptedProvider();
        try (var lead = new LeadAgent(provider, List.of(new AgentDefinition("a", "first", "p")), List.of(),
                "Base prompt.", Policy.standard(tempDir), tempDir)) {
            lead.registerSubAgent(new AgentDefinition("b", "second", "p"));

            var prompt = provider.systemPrompt();
            assertEquals(1, prompt.split("Base prompt\\.", -1).length - 1);
            assertEquals(1, prompt.split("# Available Sub-Agents", -1).length - 1);
            assertThat(prompt).contains("## a\nfirst").contains("## b\nsecond");
            assertEquals(List.of("a", "b"), lead.availableSubAgents());
        }
    }

    @Test
    void delegatesToForkedSubAgentAndFiresSubagentStop() {
        var child = new ScriptedProvider().reply("the file defines main()");
        var provider = new ScriptedProvider()
                .toolCall("c1", DelegateTool.NAME, Map.of("agent_name", "code_reader", "task", "read Main.java"))
                .reply("Main defines main()");
        provider.forkTarget = child;
        var stops = new CopyOnWriteArrayList<String>();

        try (var lead = new LeadAgent(provider, List.of(AgentDefinition.codeReader()), Policy.readOnly(), tempDir)) {
            lead.addHook(HookMatcher.subagentStop((name, task, result, ctx) -> {
                stops.add(name + "|" + task + "|" + result);
                return null;
            }));
            var result = lead.runSync("what is in Main.java?");

            assertEquals(StopReason.COMPLETE, result.stopReason());
            assertEquals("Main defines main()", result.response());
            assertEquals("the file defines main()", toolResults(provider).get(0).value());
            assertEquals(List.of("code_reader|read Main.java|the file defines main()"), stops);
            assertEquals(AgentDefinition.codeReader().prompt(), child.systemPrompt());
            assertThat(child.turns()).hasSize(2);
        }
    }

    @Test
    void unknownSubAgentIsAnErrorResult() {
        var provider = new ScriptedProvider()
                .toolCall("c1", DelegateTool.NAME, Map.of("agent_name", "ghost", "task", "boo"))
                .reply("ok");
        try (var lead = LeadAgent.withDefaultSubAgents(provider, Policy.standard(tempDir), tempDir)) {
            lead.runSync("delegate");
            assertEquals("Unknown agent: ghost. Available agents: code_reader, code_analyzer",
                    toolResults(provider).get(0).error());
        }
    }

    @Test
    void failedSubRunIsReportedToLead() {
        var child = new ScriptedProvider();
        child.streamFailures = 1;
        child.chatFails = true;
        var provider = new ScriptedProvider()
                .toolCall("c1", DelegateTool.NAME, Map.of("agent_name", "code_analyzer", "task", "review"))
                .reply("sub-agent failed");
        provider.forkTarget = child;
        try (var lead = LeadAgent.withDefaultSubAgents(provider, Policy.standard(tempDir), tempDir)) {
            lead.runSync("review the code");
            assertThat(toolResults(provider).get(0).error())
                    .startsWith("Sub-agent 'code_analyzer' failed.\nError: ")
                    .contains("service unavailable");
        }
    }

    @Test
    void nonInheritedModelUsesProviderFactory() {
        var requested = new CopyOnWriteArrayList<String>();
        var child = new ScriptedProvider().reply("cheap answer");
        var provider = new ScriptedProvider()
                .toolCall("c1", DelegateTool.NAME, Map.of("agent_name", "cheap", "task", "sum"))
                .reply("done");
        var def = new AgentDefinition("cheap", "Uses a small model", "Be cheap", List.of(), "gpt-4o-mini");
        try (var lead = new LeadAgent(provider, List.of(def), Policy.standard(tempDir), tempDir)) {
            lead.setProviderFactory(model -> {
                requested.add(model);
                return child;
            });
            lead.runSync("delegate cheaply");

            assertEquals(List.of("gpt-4o-mini"), requested);
            assertEquals("cheap answer", toolResults(provider).get(0).value());
            assertEquals("Be cheap", child.systemPrompt());
        }
    }

    @Test
    void missingArgumentsAreRejectedByTool() {
        var provider = new ScriptedProvider()
                .toolCall("c1", DelegateTool.NAME, Map.of("agent_name", "code_reader"))
                .reply("ok");
        try (var lead = LeadAgent.withDefaultSubAgents(provider, Policy.standard(tempDir), tempDir)) {
            lead.runSync("delegate");
            assertEquals("Missing required argument: task", toolResults(provider).get(0).error());
        }
    }

    @Test
    void definitionDefaultsToInheritedModel() {
        var def = new AgentDefinition("x", "desc", "prompt");
        assertTrue(def.inheritsModel());
        assertTrue(def.tools().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new AgentDefinition(" ", "desc", "p"));
    }

    private static List<ToolResult> toolResults(ScriptedProvider provider) {
        return provider.turns().stream()
                .flatMap(t -> t.contents().stream())
                .filter(ToolResult.class::isInstance)
                .map(ToolResult.class::cast)
                .toList();
    }
}
