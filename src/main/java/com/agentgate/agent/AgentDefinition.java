package com.agentgate.agent;

import com.agentgate.tools.Tool;
import com.agentgate.tools.ToolBundles;

import java.util.List;

/**
 * A sub-agent a {@link LeadAgent} can delegate to. {@code model} is
 * {@value #INHERIT} to reuse the lead's model and transport, or a model name
 * resolved through the lead's provider factory.
 */
public record AgentDefinition(String name, String description, String prompt, List<Tool> tools, String model) {

    public static final String INHERIT = "inherit";

    public AgentDefinition {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be empty");
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description must not be empty");
        }
        tools = tools != null ? List.copyOf(tools) : List.of();
        model = model == null || model.isBlank() ? INHERIT : model;
    }

    public AgentDefinition(String name, String description, String prompt, List<Tool> tools) {
        this(name, description, prompt, tools, INHERIT);
    }

    public AgentDefinition(String name, String description, String prompt) {
        this(name, description, prompt, List.of(), INHERIT);
    }

    public boolean inheritsModel() {
        return INHERIT.equals(model);
    }

    public static AgentDefinition codeReader() {
        return new AgentDefinition("code_reader",
                "Reads and explains code files. Good for understanding what code does.",
                "You are a code reading expert. Read files carefully and explain what the code does clearly and concisely.",
                ToolBundles.readOnlyTools());
    }

    public static AgentDefinition codeAnalyzer() {
        return new AgentDefinition("code_analyzer",
                "Analyzes code for bugs, issues, and improvements. Good for code review.",
                "You are a code analysis expert. Look for bugs, potential issues, and suggest improvements. Be specific and actionable.",
                ToolBundles.readOnlyTools());
    }
}
