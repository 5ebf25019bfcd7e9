package com.agentgate.security;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable permission and budget policy. Built once before a run and shared
 * read-only with sub-agents; derive a changed copy with {@link #toBuilder()}.
 */
public final class Policy {

    public static final int DEFAULT_MAX_TURNS = 25;

    private final PermissionMode mode;
    private final boolean fileRead;
    private final FileWriteRule fileWrite;
    private final boolean bash;
    private final boolean codeExecution;
    private final boolean web;
    private final boolean installPackages;
    private final List<String> allowedTools;
    private final List<String> deniedTools;
    private final String permissionPromptTool;
    private final PermissionDecider decider;
    private final int maxTurns;
    private final Double maxCostUsd;

    private Policy(Builder b) {
        this.mode = b.mode;
        this.fileRead = b.fileRead;
        this.fileWrite = b.fileWrite;
        this.bash = b.bash;
        this.codeExecution = b.codeExecution;
        this.web = b.web;
        this.installPackages = b.installPackages;
        this.allowedTools = b.allowedTools == null ? null : List.copyOf(b.allowedTools);
        this.deniedTools = List.copyOf(b.deniedTools);
        this.permissionPromptTool = b.permissionPromptTool;
        this.decider = b.decider;
        this.maxTurns = b.maxTurns;
        this.maxCostUsd = b.maxCostUsd;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Reads only: writes, shell, code execution, web and installs are all off. */
    public static Policy readOnly() {
        return builder()
                .mode(PermissionMode.READ_ONLY)
                .fileWrite(FileWriteRule.denied())
                .codeExecution(false)
                .build();
    }

    /** Reads anywhere, writes confined to {@code workingDir}, code execution on, shell and web off. */
    public static Policy standard(Path workingDir) {
        return builder()
                .fileWrite(FileWriteRule.within(workingDir))
                .build();
    }

    public static Policy full() {
        return builder()
                .mode(PermissionMode.BYPASS_PERMISSIONS)
                .fileWrite(FileWriteRule.unrestricted())
                .bash(true)
                .web(true)
                .installPackages(true)
                .maxTurns(50)
                .build();
    }

    public Builder toBuilder() {
        var b = new Builder()
                .mode(mode)
                .fileRead(fileRead)
                .fileWrite(fileWrite)
                .bash(bash)
                .codeExecution(codeExecution)
                .web(web)
                .installPackages(installPackages)
                .deniedTools(deniedTools)
                .permissionPromptTool(permissionPromptTool)
                .decider(decider)
                .maxTurns(maxTurns)
                .maxCostUsd(maxCostUsd);
        if (allowedTools != null) b.allowedTools(allowedTools);
        return b;
    }

    public PermissionMode mode() { return mode; }
    public boolean fileRead() { return fileRead; }
    public FileWriteRule fileWrite() { return fileWrite; }
    public boolean bash() { return bash; }
    public boolean codeExecution() { return codeExecution; }
    public boolean web() { return web; }
    public boolean installPackages() { return installPackages; }

    /** {@code null} when no allow-list is configured; an empty list allows nothing but the prompt tool. */
    public List<String> allowedTools() { return allowedTools; }
    public List<String> deniedTools() { return deniedTools; }
    public String permissionPromptTool() { return permissionPromptTool; }
    public PermissionDecider decider() { return decider; }
    public int maxTurns() { return maxTurns; }
    public Double maxCostUsd() { return maxCostUsd; }

    @Override
    public String toString() {
        return "Policy[mode=" + mode + ", fileRead=" + fileRead + ", fileWrite=" + fileWrite
                + ", bash=" + bash + ", codeExecution=" + codeExecution + ", web=" + web
                + ", installPackages=" + installPackages + ", allowedTools=" + allowedTools
                + ", deniedTools=" + deniedTools + ", maxTurns=" + maxTurns
                + ", maxCostUsd=" + (maxCostUsd == null ? "unlimited" : maxCostUsd) + "]";
    }

    public static final class Builder {
        private PermissionMode mode = PermissionMode.DEFAULT;
        private boolean fileRead = true;
        private FileWriteRule fileWrite = FileWriteRule.unrestricted();
        private boolean bash = false;
        private boolean codeExecution = true;
        private boolean web = false;
        private boolean installPackages = false;
        private List<String> allowedTools;
        private List<String> deniedTools = List.of();
        private String permissionPromptTool;
        private PermissionDecider decider;
        private int maxTurns = DEFAULT_MAX_TURNS;
        private Double maxCostUsd;

        private Builder() {}

        public Builder mode(PermissionMode mode) {
            this.mode = mode != null ? mode : PermissionMode.DEFAULT;
            return this;
        }

        public Builder fileRead(boolean fileRead) {
            this.fileRead = fileRead;
            return this;
        }

        public Builder fileWrite(FileWriteRule fileWrite) {
            this.fileWrite = fileWrite != null ? fileWrite : FileWriteRule.unrestricted();
            return this;
        }

        public Builder bash(boolean bash) {
            this.bash = bash;
            return this;
        }

        public Builder codeExecution(boolean codeExecution) {
            this.codeExecution = codeExecution;
            return this;
        }

        public Builder web(boolean web) {
            this.web = web;
            return this;
        }

        public Builder installPackages(boolean installPackages) {
            this.installPackages = installPackages;
            return this;
        }

        public Builder allowedTools(Collection<String> tools) {
            this.allowedTools = tools == null ? null : cleaned(tools);
            return this;
        }

        public Builder deniedTools(Collection<String> tools) {
            this.deniedTools = tools == null ? List.of() : cleaned(tools);
            return this;
        }

        public Builder permissionPromptTool(String name) {
            this.permissionPromptTool = name == null || name.isBlank() ? null : name.strip();
            return this;
        }

        public Builder decider(PermissionDecider decider) {
            this.decider = decider;
            return this;
        }

        public Builder maxTurns(int maxTurns) {
            if (maxTurns < 1) throw new IllegalArgumentException("maxTurns must be >= 1, got " + maxTurns);
            this.maxTurns = maxTurns;
            return this;
        }

        public Builder maxCostUsd(Double maxCostUsd) {
            if (maxCostUsd != null && (maxCostUsd.isNaN() || maxCostUsd < 0)) {
                throw new IllegalArgumentException("maxCostUsd must be >= 0, got " + maxCostUsd);
            }
            this.maxCostUsd = maxCostUsd;
            return this;
        }

        public Policy build() {
            return new Policy(this);
        }

        private static List<String> cleaned(Collection<String> tools) {
            var out = new ArrayList<String>();
            for (var t : tools) {
                if (t != null && !t.isBlank()) out.add(t.strip());
            }
            return out;
        }
    }
}
