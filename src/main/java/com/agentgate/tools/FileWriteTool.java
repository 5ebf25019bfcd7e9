package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.StandardOpenOption;

public class FileWriteTool implements Tool {

    @Override public String name() { return "write_file"; }

    @Override public String description() {
        return "Write content to a file, creating parent directories as needed";
    }

    @Override public JsonNode inputSchema() {
        return Schemas.stringObject(new String[]{"path", "content"},
                "path", "Target file, relative to the working directory",
                "content", "Full text to write");
    }

    @Override public ToolAnnotations annotations() {
        return ToolAnnotations.destructiveTool();
    }

    @Override
    public ToolOutput execute(ToolContext ctx, JsonNode input) {
        var raw = input.path("path").asText(null);
        if (raw == null || raw.isBlank()) return ToolOutput.error("Missing required argument: path");
        try {
            var target = ctx.workDir().resolve(raw).normalize();
            // Reject writing through an existing symlink.
            if (Files.isSymbolicLink(target)) {
                return ToolOutput.error("Target is a symlink");
            }
            var parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);

            var content = input.path("content").asText("");
            try (var out = Files.newOutputStream(
                    target,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE,
                    LinkOption.NOFOLLOW_LINKS)) {
                out.write(content.getBytes(StandardCharsets.UTF_8));
            }
            return ToolOutput.ok("Written " + content.length() + " characters to " + raw);
        } catch (Exception e) {
            return ToolOutput.error(e.getMessage());
        }
    }
}
