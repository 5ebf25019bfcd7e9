package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Files;

public class FileReadTool implements Tool {

    private static final long MAX_FILE_SIZE_BYTES = 10 * 1024 * 1024; // 10MB

    @Override public String name() { return "read_file"; }

    @Override public String description() {
        return "Read the contents of a text file";
    }

    @Override public JsonNode inputSchema() {
        return Schemas.stringObject(new String[]{"path"}, "path", "Path to the file, relative to the working directory");
    }

    @Override public ToolAnnotations annotations() {
        return ToolAnnotations.readOnlyTool();
    }

    @Override
    public ToolOutput execute(ToolContext ctx, JsonNode input) {
        var raw = input.path("path").asText(null);
        if (raw == null || raw.isBlank()) return ToolOutput.error("Missing required argument: path");
        try {
            var file = ctx.workDir().resolve(raw).normalize();
            if (!Files.isRegularFile(file)) {
                return ToolOutput.error("File not found: " + raw);
            }
            if (Files.size(file) > MAX_FILE_SIZE_BYTES) {
                return ToolOutput.error("File too large: max " + MAX_FILE_SIZE_BYTES + " bytes");
            }
            return ToolOutput.ok(Files.readString(file));
        } catch (Exception e) {
            return ToolOutput.error(e.getMessage());
        }
    }
}
