package com.agentgate.tools;

import java.util.List;

/** Ready-made tool sets. */
public final class ToolBundles {

    private ToolBundles() {}

    public static List<Tool> fileTools() {
        return List.of(new FileReadTool(), new ListFilesTool(), new FileWriteTool());
    }

    public static List<Tool> readOnlyTools() {
        return List.of(new FileReadTool(), new ListFilesTool());
    }

    public static List<Tool> all() {
        return List.of(new FileReadTool(), new ListFilesTool(), new FileWriteTool(), new ShellTool());
    }
}
