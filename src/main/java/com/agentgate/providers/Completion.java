package com.agentgate.providers;

import com.agentgate.shared.model.Content;
import com.agentgate.shared.model.TextContent;
import com.agentgate.shared.model.TokenUsage;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.Turn;

import java.util.ArrayList;
import java.util.List;

/** A finished model reply as a transport returns it, before it becomes a {@link Turn}. */
public record Completion(String text, List<ToolRequest> toolRequests, TokenUsage usage) {

    public Completion {
        text = text != null ? text : "";
        toolRequests = toolRequests != null ? List.copyOf(toolRequests) : List.of();
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public Turn toTurn() {
        var contents = new ArrayList<Content>();
        if (!text.isEmpty()) contents.add(new TextContent(text));
        contents.addAll(toolRequests);
        return Turn.assistant(contents, usage);
    }
}
