package com.agentgate.security;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PathGuardTest {

    @TempDir
    Path tempDir;

    @Test
    void detectsTraversalPatterns() {
        assertTrue(PathGuard.hasTraversal("../a"));
        assertTrue(PathGuard.hasTraversal("a/../../b"));
        assertTrue(PathGuard.hasTraversal("~/secrets"));
        assertTrue(PathGuard.hasTraversal("a\0b"));
        assertTrue(PathGuard.hasTraversal(null));
        assertFalse(PathGuard.hasTraversal("a/b.txt"));
    }

    @Test
    void nonExistingTargetsResolveAgainstRealParent() throws IOException {
        var root = Files.createDirectories(tempDir.resolve("root"));
        assertTrue(PathGuard.isWithin("new/dir/file.txt", root, root));
        assertTrue(PathGuard.isWithin(".", root, root));
        assertFalse(PathGuard.isWithin(tempDir.resolve("other.txt").toString(), root, root));
    }

    @Test
    void danglingSymlinkIsNeverContained() throws IOException {
        var root = Files.createDirectories(tempDir.resolve("root"));
        try {
            Files.createSymbolicLink(root.resolve("dangling"), tempDir.resolve("missing-target"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symlinks not supported here");
        }
        assertFalse(PathGuard.isWithin("dangling/file.txt", root, root));
    }
}
