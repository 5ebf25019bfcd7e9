package com.agentgate.tools;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs one command through the platform shell with a wall-clock timeout,
 * stdout and stderr merged.
 */
public class ShellExecutor {

    public record Result(String output, int exitCode) {
        public boolean isError() {
            return exitCode != 0 || output.startsWith("[TIMEOUT]");
        }
    }

    private final long timeoutSeconds;

    public ShellExecutor(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long timeoutSeconds() { return timeoutSeconds; }

    public Result execute(String command, Path workDir, Map<String, String> env) throws IOException, InterruptedException {
        var shell = System.getProperty("os.name").toLowerCase().contains("win")
                ? new String[]{"cmd", "/c", command}
                : new String[]{"bash", "-c", command};
        var pb = new ProcessBuilder(shell);
        if (workDir != null) pb.directory(workDir.toFile());
        if (env != null) {
            pb.environment().clear();
            pb.environment().putAll(env);
        }
        pb.redirectErrorStream(true);
        var proc = pb.start();
        var stdout = new ByteArrayOutputStream();
        var reader = new Thread(() -> {
            try {
                proc.getInputStream().transferTo(stdout);
            } catch (IOException e) {
                // stream closes when the process is destroyed
            }
        }, "shell-output");
        reader.setDaemon(true);
        reader.start();
        if (!proc.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            proc.destroyForcibly();
            reader.join(5000);
            return new Result("[TIMEOUT] Command exceeded " + timeoutSeconds + "s", -1);
        }
        reader.join(5000);
        return new Result(stdout.toString(), proc.exitValue());
    }
}
