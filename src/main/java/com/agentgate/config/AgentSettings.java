package com.agentgate.config;

import java.nio.file.Path;

/** @param workingDir {@code null} for the process's current directory */
public record AgentSettings(String systemPrompt, Path workingDir) {

    public static AgentSettings defaults() {
        return new AgentSettings(null, null);
    }

    public Path resolvedWorkingDir() {
        return (workingDir != null ? workingDir : Path.of("")).toAbsolutePath().normalize();
    }
}
