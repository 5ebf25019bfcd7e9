package com.agentgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Decides whether a tool call may run. The decision depends only on the
 * arguments and the (immutable) policy; the first matching rule wins.
 */
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    static final String DECIDER_FAILED = "Permission callback failed; denying by default";

    private static final Set<String> FILE_READ_TOOLS = Set.of("read_file", "list_files");
    private static final Set<String> FILE_WRITE_TOOLS = Set.of("write_file");
    private static final Set<String> BASH_TOOLS = Set.of("run_bash", "bash");
    private static final Set<String> CODE_TOOLS = Set.of("run_code", "run_r_code");
    private static final Set<String> WEB_TOOLS = Set.of("web_search", "web_fetch");
    private static final Set<String> INSTALL_TOOLS = Set.of("install_package");
    private static final Set<String> WRITE_OR_EXECUTE = Set.of(
            "write_file", "run_bash", "bash", "run_code", "run_r_code", "install_package");

    private final Policy policy;

    public PermissionGate(Policy policy) {
        if (policy == null) throw new IllegalArgumentException("policy must not be null");
        this.policy = policy;
    }

    public Policy policy() { return policy; }

    public PermissionResult check(String toolName, Map<String, Object> input, PermissionContext context) {
        var name = ToolNames.normalize(toolName);
        var args = input != null ? input : Map.<String, Object>of();
        var ctx = context != null ? context : PermissionContext.of(null);

        // The prompt tool stays reachable even when deny-listed.
        if (isPromptTool(name)) {
            return PermissionResult.allow();
        }
        if (listContains(policy.deniedTools(), name)) {
            return PermissionResult.deny("Tool '" + toolName + "' is blocked by the tool denylist");
        }
        if (policy.mode() == PermissionMode.BYPASS_PERMISSIONS) {
            return PermissionResult.allow();
        }
        if (policy.allowedTools() != null && !listContains(policy.allowedTools(), name)) {
            var reason = "Tool '" + toolName + "' is not in the tool allowlist";
            if (policy.permissionPromptTool() != null) {
                reason += " (use '" + policy.permissionPromptTool() + "' to request permission)";
            }
            return PermissionResult.deny(reason);
        }
        if (policy.mode() == PermissionMode.READ_ONLY) {
            return checkReadOnly(name, ctx);
        }
        if (policy.decider() != null) {
            return consultDecider(toolName, args, ctx);
        }
        return checkCapabilities(name, args, ctx);
    }

    private PermissionResult checkReadOnly(String name, PermissionContext ctx) {
        var annotations = ctx.annotations();
        if (annotations.readOnly()) {
            return PermissionResult.allow();
        }
        if (annotations.destructive()) {
            return PermissionResult.deny("Permission denied: tool is destructive and readonly mode is active");
        }
        if (WRITE_OR_EXECUTE.contains(name)) {
            return PermissionResult.deny("Permission denied: readonly mode active");
        }
        return PermissionResult.allow();
    }

    private PermissionResult consultDecider(String toolName, Map<String, Object> args, PermissionContext ctx) {
        try {
            var result = policy.decider().decide(toolName, args, ctx);
            if (result == null) {
                log.warn("Permission callback returned no result for tool {}", toolName);
                return PermissionResult.deny(DECIDER_FAILED);
            }
            return result;
        } catch (Exception e) {
            log.warn("Permission callback failed for tool {}: {}", toolName, e.getMessage());
            return PermissionResult.deny(DECIDER_FAILED);
        }
    }

    private PermissionResult checkCapabilities(String name, Map<String, Object> args, PermissionContext ctx) {
        if (FILE_READ_TOOLS.contains(name)) {
            return policy.fileRead() ? PermissionResult.allow() : PermissionResult.deny("File reading is not allowed");
        }
        if (FILE_WRITE_TOOLS.contains(name)) {
            return checkFileWrite(args, ctx);
        }
        if (BASH_TOOLS.contains(name)) {
            return policy.bash() ? PermissionResult.allow() : PermissionResult.deny("Bash command execution is not allowed");
        }
        if (CODE_TOOLS.contains(name)) {
            return policy.codeExecution() ? PermissionResult.allow() : PermissionResult.deny("Code execution is not allowed");
        }
        if (WEB_TOOLS.contains(name)) {
            return policy.web() ? PermissionResult.allow() : PermissionResult.deny("Web access is not allowed");
        }
        if (INSTALL_TOOLS.contains(name)) {
            return policy.installPackages() ? PermissionResult.allow() : PermissionResult.deny("Package installation is not allowed");
        }

        var annotations = ctx.annotations();
        if (annotations.destructive() && !policy.fileWrite().allowed() && !policy.bash()) {
            return PermissionResult.deny("Tool is marked as destructive and write operations are disabled");
        }
        if (annotations.readOnly()) {
            return PermissionResult.allow();
        }
        if (annotations.openWorld() && !policy.web()) {
            return PermissionResult.deny("Tool can access external resources but web access is disabled");
        }
        return PermissionResult.allow();
    }

    private PermissionResult checkFileWrite(Map<String, Object> args, PermissionContext ctx) {
        var rule = policy.fileWrite();
        if (!rule.allowed()) {
            return PermissionResult.deny("File writing is not allowed");
        }
        if (rule.restricted()) {
            var raw = args.containsKey("path") ? args.get("path") : args.get("file_path");
            if (raw != null) {
                var path = String.valueOf(raw);
                if (PathGuard.hasTraversal(path)) {
                    return PermissionResult.deny("Path traversal patterns not allowed in file paths");
                }
                if (!PathGuard.isWithin(path, rule.directory(), ctx.workingDir())) {
                    return PermissionResult.deny("File writing only allowed in: " + rule.directory());
                }
            }
        }
        return PermissionResult.allow();
    }

    private boolean isPromptTool(String normalizedName) {
        var prompt = policy.permissionPromptTool();
        return prompt != null && ToolNames.normalize(prompt).equals(normalizedName);
    }

    private static boolean listContains(java.util.List<String> list, String normalizedName) {
        for (var entry : list) {
            if (ToolNames.normalize(entry).equals(normalizedName)) return true;
        }
        return false;
    }
}
