package com.agentgate.tools;

import java.nio.file.Path;

public record ToolContext(Path workDir, String runId) {}
