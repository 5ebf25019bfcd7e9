package com.agentgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ShellTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ShellTool.class);

    private static final Set<String> UNIX_ENV = Set.of(
            "PATH", "HOME", "TERM", "LANG", "USER", "SHELL", "TMPDIR");
    private static final Set<String> WIN_ENV = Set.of(
            "PATH", "SystemRoot", "ComSpec", "TEMP", "TMP", "USERPROFILE", "HOMEDRIVE", "HOMEPATH");

    private final ShellExecutor executor;

    public ShellTool() {
        this(new ShellExecutor(30));
    }

    public ShellTool(ShellExecutor executor) {
        this.executor = executor;
    }

    @Override public String name() { return "run_bash"; }

    @Override public String description() {
        return "Execute a shell command in the working directory and return its combined output";
    }

    @Override public JsonNode inputSchema() {
        return Schemas.stringObject(new String[]{"command"}, "command", "Command line passed to bash -c");
    }

    @Override public ToolAnnotations annotations() {
        return new ToolAnnotations(false, true, true, false);
    }

    @Override
    public ToolOutput execute(ToolContext ctx, JsonNode input) {
        var command = input.path("command").asText(null);
        if (command == null || command.isBlank()) return ToolOutput.error("Missing required argument: command");
        try {
            log.info("Shell command in {}: {}", ctx.workDir(), command);
            var result = executor.execute(command, ctx.workDir(), sanitizedEnv());
            var output = result.exitCode() != 0 && !result.output().startsWith("[TIMEOUT]")
                    ? result.output() + "\n[exit code " + result.exitCode() + "]"
                    : result.output();
            return new ToolOutput(output, result.isError());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolOutput.error("Interrupted");
        } catch (Exception e) {
            return ToolOutput.error(e.getMessage());
        }
    }

    static Map<String, String> sanitizedEnv() {
        var allowed = System.getProperty("os.name", "").toLowerCase().contains("win") ? WIN_ENV : UNIX_ENV;
        return System.getenv().entrySet().stream()
                .filter(e -> allowed.contains(e.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
