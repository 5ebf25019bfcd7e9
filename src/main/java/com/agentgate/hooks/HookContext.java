package com.agentgate.hooks;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a callback may know about the run besides its event arguments: the
 * working directory plus event-specific extras such as totals and cost.
 */
public record HookContext(Path workingDir, Map<String, Object> extras) {

    public HookContext {
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static HookContext of(Path workingDir) {
        return new HookContext(workingDir, Map.of());
    }

    public Object get(String key) {
        return extras.get(key);
    }

    public HookContext with(String key, Object value) {
        var copy = new LinkedHashMap<>(extras);
        copy.put(key, value);
        return new HookContext(workingDir, copy);
    }
}
