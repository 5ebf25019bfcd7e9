package com.agentgate.tools;

/**
 * Capability hints a tool declares about itself. The permission gate
 * consults them for tools it does not know by name.
 */
public record ToolAnnotations(boolean readOnly, boolean destructive, boolean openWorld, boolean idempotent) {

    private static final ToolAnnotations NONE = new ToolAnnotations(false, false, false, false);

    public static ToolAnnotations none() { return NONE; }

    public static ToolAnnotations readOnlyTool() {
        return new ToolAnnotations(true, false, false, true);
    }

    public static ToolAnnotations destructiveTool() {
        return new ToolAnnotations(false, true, false, false);
    }

    public static ToolAnnotations openWorldTool() {
        return new ToolAnnotations(false, false, true, false);
    }
}
