package com.agentgate.security;

public enum PermissionMode {
    DEFAULT("default"),
    ACCEPT_EDITS("acceptEdits"),
    READ_ONLY("readonly"),
    BYPASS_PERMISSIONS("bypassPermissions");

    private final String settingName;

    PermissionMode(String settingName) {
        this.settingName = settingName;
    }

    public String settingName() { return settingName; }

    /** Accepts the setting names ("readonly", "bypassPermissions", ...) and enum constant names. */
    public static PermissionMode parse(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        var trimmed = value.strip();
        for (var mode : values()) {
            if (mode.settingName.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid permission mode: " + value
                + " (valid: default, acceptEdits, readonly, bypassPermissions)");
    }

    @Override
    public String toString() {
        return settingName;
    }
}
