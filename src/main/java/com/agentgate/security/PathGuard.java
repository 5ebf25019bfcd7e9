package com.agentgate.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Path checks for directory-restricted writes. Containment compares real
 * paths so a symlink inside the root cannot point a write outside it.
 */
public final class PathGuard {

    private PathGuard() {}

    public static boolean hasTraversal(String path) {
        if (path == null || path.indexOf('\0') >= 0) return true;
        return path.contains("..") || path.startsWith("~");
    }

    public static boolean isWithin(String rawPath, Path root, Path workingDir) {
        if (hasTraversal(rawPath)) return false;
        try {
            var base = workingDir != null ? workingDir : Path.of("").toAbsolutePath();
            var target = base.resolve(rawPath).toAbsolutePath().normalize();
            var realRoot = realPathOfExistingPrefix(root.toAbsolutePath().normalize());
            return realPathOfExistingPrefix(target).startsWith(realRoot);
        } catch (InvalidPathException | IOException e) {
            return false;
        }
    }

    /**
     * Real path of the longest existing ancestor with the non-existing
     * remainder appended. A dangling symlink fails {@code toRealPath} and so
     * never counts as contained.
     */
    public static Path realPathOfExistingPrefix(Path absolute) throws IOException {
        var existing = absolute;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) return absolute;
        var remainder = existing.relativize(absolute);
        var real = existing.toRealPath();
        return remainder.toString().isEmpty() ? real : real.resolve(remainder).normalize();
    }
}
