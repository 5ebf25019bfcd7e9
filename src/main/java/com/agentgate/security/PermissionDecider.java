package com.agentgate.security;

import java.util.Map;

/**
 * Custom decision step consulted before the per-capability rules. A thrown
 * exception or a {@code null} result is treated as a denial.
 */
@FunctionalInterface
public interface PermissionDecider {
    PermissionResult decide(String toolName, Map<String, Object> input, PermissionContext context) throws Exception;
}
