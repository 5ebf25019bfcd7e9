package com.agentgate.security;

import com.agentgate.tools.ToolAnnotations;

import java.nio.file.Path;

public record PermissionContext(Path workingDir, ToolAnnotations annotations) {
    public PermissionContext {
        annotations = annotations != null ? annotations : ToolAnnotations.none();
    }

    public static PermissionContext of(Path workingDir) {
        return new PermissionContext(workingDir, ToolAnnotations.none());
    }
}
