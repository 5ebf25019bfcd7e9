package com.agentgate.shared.model;

public record TextContent(String text) implements Content {
    public TextContent {
        text = text != null ? text : "";
    }
}
