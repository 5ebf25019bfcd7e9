package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

public interface Tool {
    String name();
    String description();
    JsonNode inputSchema();
    ToolOutput execute(ToolContext ctx, JsonNode input);

    default ToolAnnotations annotations() {
        return ToolAnnotations.none();
    }
}
