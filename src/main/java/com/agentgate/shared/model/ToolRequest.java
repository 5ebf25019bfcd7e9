package com.agentgate.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolRequest(String id, String name, Map<String, Object> arguments) implements Content {
    public ToolRequest {
        // Map.copyOf rejects null values, which JSON arguments may legitimately carry
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
