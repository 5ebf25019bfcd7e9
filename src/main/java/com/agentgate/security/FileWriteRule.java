package com.agentgate.security;

import java.nio.file.Path;

/**
 * Whether file writes are permitted, optionally confined to one directory.
 */
public record FileWriteRule(boolean allowed, Path directory) {

    private static final FileWriteRule DENIED = new FileWriteRule(false, null);
    private static final FileWriteRule UNRESTRICTED = new FileWriteRule(true, null);

    public FileWriteRule {
        if (!allowed && directory != null) {
            throw new IllegalArgumentException("A denied rule cannot name a directory");
        }
    }

    public static FileWriteRule denied() { return DENIED; }

    public static FileWriteRule unrestricted() { return UNRESTRICTED; }

    public static FileWriteRule within(Path directory) {
        if (directory == null) throw new IllegalArgumentException("directory must not be null");
        return new FileWriteRule(true, directory.toAbsolutePath().normalize());
    }

    public boolean restricted() {
        return directory != null;
    }
}
