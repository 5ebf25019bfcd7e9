package com.agentgate.shared.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One item of a {@link Turn}: plain text, a tool call requested by the model,
 * or the result of a tool call fed back to it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextContent.class, name = "text"),
        @JsonSubTypes.Type(value = ToolRequest.class, name = "tool_request"),
        @JsonSubTypes.Type(value = ToolResult.class, name = "tool_result")
})
public sealed interface Content permits TextContent, ToolRequest, ToolResult {
}
