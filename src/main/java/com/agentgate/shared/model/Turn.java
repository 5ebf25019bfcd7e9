package com.agentgate.shared.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One exchange in the conversation. Immutable once produced.
 */
public record Turn(Role role, List<Content> contents, TokenUsage usage) {

    public Turn {
        contents = contents != null ? List.copyOf(contents) : List.of();
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public static Turn user(String text) {
        return new Turn(Role.USER, List.of(new TextContent(text)), TokenUsage.ZERO);
    }

    public static Turn assistant(String text) {
        return new Turn(Role.ASSISTANT, List.of(new TextContent(text)), TokenUsage.ZERO);
    }

    public static Turn assistant(List<Content> contents, TokenUsage usage) {
        return new Turn(Role.ASSISTANT, contents, usage);
    }

    public static Turn toolResults(List<ToolResult> results) {
        return new Turn(Role.USER, List.copyOf(results), TokenUsage.ZERO);
    }

    public String text() {
        return contents.stream()
                .filter(TextContent.class::isInstance)
                .map(c -> ((TextContent) c).text())
                .collect(Collectors.joining());
    }

    public List<ToolRequest> toolRequests() {
        return contents.stream()
                .filter(ToolRequest.class::isInstance)
                .map(ToolRequest.class::cast)
                .toList();
    }

    public boolean hasToolRequests() {
        return contents.stream().anyMatch(ToolRequest.class::isInstance);
    }
}
