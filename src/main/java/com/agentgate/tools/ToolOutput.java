package com.agentgate.tools;

public record ToolOutput(String output, boolean isError) {

    public static ToolOutput ok(String output) {
        return new ToolOutput(output, false);
    }

    public static ToolOutput error(String message) {
        return new ToolOutput(message, true);
    }
}
