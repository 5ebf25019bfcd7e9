package com.agentgate.hooks;

import com.agentgate.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/** Ready-made hooks. All run inline. */
public final class Hooks {

    private static final Logger log = LoggerFactory.getLogger(Hooks.class);

    public static final List<String> DANGEROUS_BASH_PATTERNS = List.of(
            "rm\\s+-rf", "sudo", "chmod\\s+777", "mkfs", "dd\\s+if=", ">\\s*/dev/");

    private Hooks() {}

    /** Logs every finished tool call; with {@code verbose} also a preview of its result. */
    public static HookMatcher logTools(boolean verbose) {
        return HookMatcher.postToolUse(null, (toolName, result, error, context) -> {
            if (error != null) {
                log.warn("Tool {} failed: {}", toolName, error);
            } else {
                log.info("Tool {} completed", toolName);
                if (verbose && result != null) {
                    log.info("Result: {}", truncate(result, 100));
                }
            }
            return new HookResult.PostToolUse(true);
        }).inline();
    }

    public static HookMatcher blockDangerousBash() {
        return blockDangerousBash(DANGEROUS_BASH_PATTERNS);
    }

    /** Denies shell commands matching any of {@code patterns} (case-insensitive regexes). */
    public static HookMatcher blockDangerousBash(List<String> patterns) {
        var combined = Pattern.compile(String.join("|", patterns), Pattern.CASE_INSENSITIVE);
        return HookMatcher.preToolUse("^(run_bash|bash|tool_run_bash)$", (toolName, input, context) -> {
            var command = input.get("command");
            if (command != null && combined.matcher(String.valueOf(command)).find()) {
                return HookResult.PreToolUse.deny("Blocked: potentially dangerous command pattern detected");
            }
            return HookResult.PreToolUse.allow();
        }).inline();
    }

    /** Denies file writes whose target does not resolve inside {@code allowedDir}. */
    public static HookMatcher limitFileWrites(Path allowedDir) {
        var root = allowedDir.toAbsolutePath().normalize();
        return HookMatcher.preToolUse("^(write_file|tool_write_file)$", (toolName, input, context) -> {
            var raw = input.containsKey("path") ? input.get("path") : input.get("file_path");
            var path = raw == null ? "" : String.valueOf(raw);
            if (!PathGuard.isWithin(path, root, context.workingDir())) {
                return HookResult.PreToolUse.deny("File writes only allowed in: " + root);
            }
            return HookResult.PreToolUse.allow();
        }).inline();
    }

    static String truncate(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max - 3) + "...";
    }
}
