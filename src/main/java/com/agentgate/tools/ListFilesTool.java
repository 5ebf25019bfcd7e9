package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

public class ListFilesTool implements Tool {

    private static final int MAX_ENTRIES = 500;

    @Override public String name() { return "list_files"; }

    @Override public String description() {
        return "List the entries of a directory, one per line; directories end with '/'";
    }

    @Override public JsonNode inputSchema() {
        return Schemas.stringObject(new String[]{}, "path", "Directory to list, defaults to the working directory");
    }

    @Override public ToolAnnotations annotations() {
        return ToolAnnotations.readOnlyTool();
    }

    @Override
    public ToolOutput execute(ToolContext ctx, JsonNode input) {
        var raw = input.path("path").asText(".");
        var dir = ctx.workDir().resolve(raw.isBlank() ? "." : raw).normalize();
        if (!Files.isDirectory(dir)) {
            return ToolOutput.error("Not a directory: " + raw);
        }
        try (var entries = Files.list(dir)) {
            var listing = entries
                    .sorted()
                    .limit(MAX_ENTRIES)
                    .map(p -> display(p))
                    .collect(Collectors.joining("\n"));
            return ToolOutput.ok(listing);
        } catch (Exception e) {
            return ToolOutput.error(e.getMessage());
        }
    }

    private static String display(Path p) {
        var name = p.getFileName().toString();
        return Files.isDirectory(p) ? name + "/" : name;
    }
}
