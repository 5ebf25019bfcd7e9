package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Small helper for the flat JSON object schemas the built-in tools declare. */
final class Schemas {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Schemas() {}

    /** {@code props} alternates property name and description; every property is a string. */
    static JsonNode stringObject(String[] required, String... props) {
        var properties = MAPPER.createObjectNode();
        for (int i = 0; i + 1 < props.length; i += 2) {
            properties.set(props[i], MAPPER.createObjectNode()
                    .put("type", "string")
                    .put("description", props[i + 1]));
        }
        var requiredNode = MAPPER.createArrayNode();
        for (var r : required) requiredNode.add(r);
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", properties)
                .set("required", requiredNode);
    }
}
