package com.agentgate.config;

import com.agentgate.security.PermissionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code ~/.agentgate/config.yaml}. A missing file yields the defaults;
 * {@code AGENTGATE_*} environment variables override the file.
 *
 * <pre>
 * policy:
 *   mode: readonly
 *   file-write: ./out
 *   allowed-tools: [read_file, list_files]
 *   max-cost-usd: 1.50
 * agent:
 *   system-prompt: You are a careful assistant.
 * provider:
 *   id: deepseek
 *   api-key: sk-...
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".agentgate", "config.yaml"
    );

    private ConfigLoader() {}

    public static AgentGateConfig load() {
        return load(DEFAULT_PATH);
    }

    public static AgentGateConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static AgentGateConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                Object parsed = new Yaml().load(in);
                if (parsed == null) {
                    raw = Map.of();
                } else if (parsed instanceof Map<?, ?> map) {
                    raw = (Map<String, Object>) map;
                } else {
                    throw new IllegalStateException("Config root must be a mapping: " + path);
                }
            } catch (IOException | YAMLException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
            log.debug("Loaded config from {}", path);
        } else {
            log.debug("No config at {}, using defaults", path);
            raw = Map.of();
        }

        return new AgentGateConfig(
            parsePolicy(section(raw, "policy"), env),
            parseAgent(section(raw, "agent"), env),
            parseProvider(section(raw, "provider"), env)
        );
    }

    private static PolicySettings parsePolicy(Map<String, Object> policy, Map<String, String> env) {
        var defaults = PolicySettings.defaults();
        var tools = section(policy, "tools");

        var mode = envOrDefault(env, "AGENTGATE_PERMISSION_MODE",
                string(policy, null, "mode", "permission-mode", "permissionMode", "defaultMode"));
        var allowed = first(policy, "allowed-tools", "allowedTools", "allowed_tools");
        if (allowed == null) allowed = tools.get("allow");
        var denied = first(policy, "denied-tools", "disallowedTools", "disallowed-tools", "denied_tools");
        if (denied == null) denied = tools.get("deny");
        var maxCost = envOrDefault(env, "AGENTGATE_MAX_COST_USD", string(policy, null, "max-cost-usd", "maxCostUsd"));

        var deniedList = toolList(denied);
        return new PolicySettings(
            mode != null ? PermissionMode.parse(mode) : defaults.mode(),
            bool(policy, defaults.fileRead(), "file-read", "fileRead"),
            string(policy, defaults.fileWrite(), "file-write", "fileWrite"),
            bool(policy, defaults.bash(), "bash"),
            bool(policy, defaults.codeExecution(), "code-execution", "codeExecution"),
            bool(policy, defaults.web(), "web"),
            bool(policy, defaults.installPackages(), "install-packages", "installPackages"),
            toolList(allowed),
            deniedList != null ? deniedList : defaults.deniedTools(),
            string(policy, null, "permission-prompt-tool", "permissionPromptTool", "permissionPromptToolName"),
            Integer.parseInt(envOrDefault(env, "AGENTGATE_MAX_TURNS",
                    string(policy, String.valueOf(defaults.maxTurns()), "max-turns", "maxTurns"))),
            maxCost != null && !maxCost.isBlank() ? Double.valueOf(maxCost) : defaults.maxCostUsd()
        );
    }

    private static AgentSettings parseAgent(Map<String, Object> agent, Map<String, String> env) {
        var defaults = AgentSettings.defaults();
        var dir = envOrDefault(env, "AGENTGATE_WORKING_DIR", string(agent, null, "working-dir", "workingDir"));
        return new AgentSettings(
            string(agent, defaults.systemPrompt(), "system-prompt", "systemPrompt"),
            dir != null && !dir.isBlank() ? Path.of(dir) : defaults.workingDir()
        );
    }

    private static ProviderSettings parseProvider(Map<String, Object> provider, Map<String, String> env) {
        var defaults = ProviderSettings.defaults();
        return new ProviderSettings(
            envOrDefault(env, "AGENTGATE_PROVIDER", string(provider, defaults.id(), "id")),
            envOrDefault(env, "AGENTGATE_MODEL", string(provider, defaults.model(), "model")),
            envOrDefault(env, "AGENTGATE_BASE_URL", string(provider, defaults.baseUrl(), "base-url", "baseUrl")),
            envOrDefault(env, "AGENTGATE_API_KEY", string(provider, defaults.apiKey(), "api-key", "apiKey")),
            Integer.parseInt(string(provider, String.valueOf(defaults.timeoutSeconds()), "timeout-seconds", "timeout"))
        );
    }

    /** A YAML list, or a comma-separated string; {@code null} when absent. */
    static List<String> toolList(Object value) {
        if (value == null) return null;
        var out = new ArrayList<String>();
        if (value instanceof List<?> list) {
            for (var item : list) {
                if (item != null && !String.valueOf(item).isBlank()) out.add(String.valueOf(item).strip());
            }
        } else {
            for (var part : String.valueOf(value).split(",")) {
                if (!part.isBlank()) out.add(part.strip());
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Object first(Map<String, Object> map, String... keys) {
        for (var key : keys) {
            if (map.containsKey(key)) return map.get(key);
        }
        return null;
    }

    private static String string(Map<String, Object> map, String fallback, String... keys) {
        var value = first(map, keys);
        return value != null ? String.valueOf(value) : fallback;
    }

    private static boolean bool(Map<String, Object> map, boolean fallback, String... keys) {
        var value = first(map, keys);
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        return Boolean.parseBoolean(String.valueOf(value).strip());
    }

    private static String envOrDefault(Map<String, String> env, String name, String fallback) {
        var val = env.get(name);
        return val != null ? val : fallback;
    }
}
