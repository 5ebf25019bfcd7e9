package com.agentgate.agent;

import com.agentgate.hooks.HookContext;
import com.agentgate.hooks.HookInput;
import com.agentgate.providers.ModelProvider;
import com.agentgate.security.Policy;
import com.agentgate.shared.model.AgentEvent;
import com.agentgate.shared.model.AgentResult;
import com.agentgate.shared.model.StopReason;
import com.agentgate.tools.Tool;
import com.agentgate.tools.ToolBundles;
import com.agentgate.tools.ToolOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * An agent that can delegate to sub-agents through the
 * {@value DelegateTool#NAME} tool. Sub-agents run with the lead's policy and
 * working directory and a fresh history; their answer comes back as the
 * tool result.
 */
public class LeadAgent extends Agent {

    private static final Logger log = LoggerFactory.getLogger(LeadAgent.class);

    private final Map<String, AgentDefinition> subAgents = new LinkedHashMap<>();
    private Function<String, ModelProvider> providerFactory;

    public LeadAgent(ModelProvider provider, Collection<AgentDefinition> subAgents, Collection<? extends Tool> tools,
                     String systemPrompt, Policy policy, Path workingDir) {
        super(provider, List.of(), systemPrompt, policy, workingDir);
        if (subAgents != null) {
            for (var def : subAgents) this.subAgents.put(def.name(), def);
        }
        provider.setSystemPrompt(PromptBuilder.leadPrompt(systemPrompt, this.subAgents.values()));
        registerTool(new DelegateTool(this));
        if (tools != null) registerTools(tools);
    }

    public LeadAgent(ModelProvider provider, Collection<AgentDefinition> subAgents, Policy policy, Path workingDir) {
        this(provider, subAgents, List.of(), null, policy, workingDir);
    }

    /** A lead with the file tools and the {@code code_reader} and {@code code_analyzer} sub-agents. */
    public static LeadAgent withDefaultSubAgents(ModelProvider provider, Policy policy, Path workingDir) {
        return new LeadAgent(provider, List.of(AgentDefinition.codeReader(), AgentDefinition.codeAnalyzer()),
                ToolBundles.fileTools(), null, policy, workingDir);
    }

    /** Resolves sub-agent models other than {@value AgentDefinition#INHERIT}. */
    public void setProviderFactory(Function<String, ModelProvider> providerFactory) {
        this.providerFactory = providerFactory;
    }

    public synchronized LeadAgent registerSubAgent(AgentDefinition definition) {
        if (definition == null) throw new IllegalArgumentException("definition must not be null");
        subAgents.put(definition.name(), definition);
        var base = PromptBuilder.basePrompt(provider().systemPrompt());
        provider().setSystemPrompt(PromptBuilder.leadPrompt(base, subAgents.values()));
        log.info("Registered sub-agent: {}", definition.name());
        return this;
    }

    public synchronized List<String> availableSubAgents() {
        return List.copyOf(subAgents.keySet());
    }

    public synchronized List<AgentDefinition> subAgents() {
        return List.copyOf(subAgents.values());
    }

    ToolOutput delegate(String agentName, String task) {
        AgentDefinition def;
        synchronized (this) {
            def = subAgents.get(agentName);
        }
        if (def == null) {
            return ToolOutput.error("Unknown agent: " + agentName + ". Available agents: "
                    + String.join(", ", availableSubAgents()));
        }

        log.info("Delegating to {}: {}", agentName, task);
        ToolOutput output;
        try {
            var result = runSubAgent(def, task);
            output = result.stopReason() == StopReason.ERROR
                    ? ToolOutput.error(failure(agentName, lastWarning(result)))
                    : ToolOutput.ok(result.response());
            log.info("Sub-agent {} finished: {} after {} turn(s)", agentName, result.stopReason(), result.turnCount());
        } catch (RuntimeException e) {
            log.error("Sub-agent {} failed: {}", agentName, e.getMessage(), e);
            output = ToolOutput.error(failure(agentName, e.getMessage()));
        }

        hooks().fire(new HookInput.SubagentStop(agentName, task, output.output(), HookContext.of(workingDir())));
        return output;
    }

    private AgentResult runSubAgent(AgentDefinition def, String task) {
        ModelProvider subProvider;
        if (def.inheritsModel()) {
            subProvider = provider().fork(def.prompt());
        } else {
            if (providerFactory == null) {
                throw new IllegalStateException("No provider factory configured for model '" + def.model() + "'");
            }
            subProvider = providerFactory.apply(def.model());
            subProvider.setSystemPrompt(def.prompt());
        }
        try (var sub = new Agent(subProvider, new ArrayList<>(def.tools()), null, policy(), workingDir())) {
            if (metrics() != null) sub.setMetrics(metrics());
            return sub.runSync(task);
        }
    }

    private static String failure(String agentName, String message) {
        return "Sub-agent '" + agentName + "' failed.\nError: " + message;
    }

    private static String lastWarning(AgentResult result) {
        String message = "run ended with an error";
        for (var event : result.events()) {
            if (event instanceof AgentEvent.Warning warning) message = warning.message();
        }
        return message;
    }
}
