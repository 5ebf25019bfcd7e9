package com.agentgate.sessions;

import com.agentgate.errors.SessionException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** One pretty-printed JSON document per session, replaced atomically on save. */
public class JsonSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonSessionStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public void save(Path path, SessionSnapshot snapshot) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        try {
            var target = path.toAbsolutePath();
            var parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);
            var tmp = Files.createTempFile(parent, ".session-", ".tmp");
            try {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Saved session with {} turns to {}", snapshot.turns().size(), target);
        } catch (IOException e) {
            throw new SessionException("Failed to save session: " + path, e);
        }
    }

    @Override
    public SessionSnapshot load(Path path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new SessionException("Session file not found: " + path);
        }
        SessionSnapshot snapshot;
        try {
            snapshot = MAPPER.readValue(path.toFile(), SessionSnapshot.class);
        } catch (IOException e) {
            throw new SessionException("Failed to load session: " + path, e);
        }
        if (snapshot == null) {
            throw new SessionException("Session file is empty: " + path);
        }
        if (snapshot.formatVersion() > SessionSnapshot.CURRENT_FORMAT_VERSION) {
            throw new SessionException("Unsupported session format version " + snapshot.formatVersion()
                    + " (max " + SessionSnapshot.CURRENT_FORMAT_VERSION + "): " + path);
        }
        log.debug("Loaded session with {} turns from {}", snapshot.turns().size(), path);
        return snapshot;
    }
}
