package com.agentgate.config;

import com.agentgate.security.FileWriteRule;
import com.agentgate.security.PermissionMode;
import com.agentgate.security.Policy;

import java.nio.file.Path;
import java.util.List;

/**
 * Policy as written in a config file.
 *
 * @param fileWrite {@code "true"}, {@code "false"} or a directory writes are confined to
 * @param allowedTools {@code null} when no allow-list is configured
 */
public record PolicySettings(
    PermissionMode mode,
    boolean fileRead,
    String fileWrite,
    boolean bash,
    boolean codeExecution,
    boolean web,
    boolean installPackages,
    List<String> allowedTools,
    List<String> deniedTools,
    String permissionPromptTool,
    int maxTurns,
    Double maxCostUsd
) {
    public PolicySettings {
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : null;
        deniedTools = deniedTools != null ? List.copyOf(deniedTools) : List.of();
    }

    /** Matches {@link Policy#standard}: writes confined to the working directory. */
    public static PolicySettings defaults() {
        return new PolicySettings(PermissionMode.DEFAULT, true, ".", false, true, false, false,
                null, List.of(), null, Policy.DEFAULT_MAX_TURNS, null);
    }

    /** Relative write directories resolve against {@code workingDir}. */
    public Policy toPolicy(Path workingDir) {
        return Policy.builder()
                .mode(mode)
                .fileRead(fileRead)
                .fileWrite(fileWriteRule(workingDir))
                .bash(bash)
                .codeExecution(codeExecution)
                .web(web)
                .installPackages(installPackages)
                .allowedTools(allowedTools)
                .deniedTools(deniedTools)
                .permissionPromptTool(permissionPromptTool)
                .maxTurns(maxTurns)
                .maxCostUsd(maxCostUsd)
                .build();
    }

    private FileWriteRule fileWriteRule(Path workingDir) {
        if (fileWrite == null || fileWrite.isBlank() || "true".equalsIgnoreCase(fileWrite.strip())) {
            return FileWriteRule.unrestricted();
        }
        if ("false".equalsIgnoreCase(fileWrite.strip())) return FileWriteRule.denied();
        var base = workingDir != null ? workingDir : Path.of("");
        return FileWriteRule.within(base.resolve(fileWrite.strip()));
    }
}
