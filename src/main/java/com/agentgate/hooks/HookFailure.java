package com.agentgate.hooks;

import java.time.Instant;

public record HookFailure(HookEvent event, String toolName, String message, Instant timestamp) {}
