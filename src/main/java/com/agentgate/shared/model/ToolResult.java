package com.agentgate.shared.model;

public record ToolResult(String requestId, String toolName, String value, String error) implements Content {

    public static ToolResult success(ToolRequest request, String value) {
        return new ToolResult(request.id(), request.name(), value, null);
    }

    public static ToolResult failure(ToolRequest request, String error) {
        return new ToolResult(request.id(), request.name(), null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
