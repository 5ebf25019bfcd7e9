package com.agentgate.agent;

import com.agentgate.tools.Tool;
import com.agentgate.tools.ToolAnnotations;
import com.agentgate.tools.ToolContext;
import com.agentgate.tools.ToolOutput;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Hands a task to one of the lead agent's sub-agents and returns its answer. */
public class DelegateTool implements Tool {

    public static final String NAME = "delegate_to_agent";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LeadAgent lead;

    DelegateTool(LeadAgent lead) {
        this.lead = lead;
    }

    @Override public String name() { return NAME; }

    @Override public String description() {
        return "Delegate a task to a specialized sub-agent. The sub-agent will complete the task and return results.";
    }

    @Override public JsonNode inputSchema() {
        var properties = MAPPER.createObjectNode();
        properties.set("agent_name", MAPPER.createObjectNode()
                .put("type", "string")
                .put("description", "Name of the sub-agent to delegate to"));
        properties.set("task", MAPPER.createObjectNode()
                .put("type", "string")
                .put("description", "Task description for the sub-agent"));
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", properties)
                .set("required", MAPPER.createArrayNode().add("agent_name").add("task"));
    }

    // Not read-only: the sub-agent may write within the shared policy.
    @Override public ToolAnnotations annotations() {
        return ToolAnnotations.none();
    }

    @Override
    public ToolOutput execute(ToolContext ctx, JsonNode input) {
        var agentName = input.path("agent_name").asText("");
        var task = input.path("task").asText("");
        if (agentName.isBlank()) return ToolOutput.error("Missing required argument: agent_name");
        if (task.isBlank()) return ToolOutput.error("Missing required argument: task");
        return lead.delegate(agentName, task);
    }
}
