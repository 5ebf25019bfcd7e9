package com.agentgate.tools;

import com.agentgate.security.ToolNames;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public synchronized void register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalArgumentException("Duplicate tool: " + tool.name());
        }
        tools.put(tool.name(), tool);
    }

    /** Exact name first, then the normalized alias ({@code tool_} prefix, case). */
    public synchronized Tool get(String name) {
        if (name == null) return null;
        var exact = tools.get(name);
        if (exact != null) return exact;
        var wanted = ToolNames.normalize(name);
        for (var tool : tools.values()) {
            if (ToolNames.normalize(tool.name()).equals(wanted)) return tool;
        }
        return null;
    }

    public synchronized Collection<Tool> all() {
        return java.util.List.copyOf(tools.values());
    }

    public synchronized int size() {
        return tools.size();
    }
}
