package com.agentgate.sessions;

import java.nio.file.Path;

public interface SessionStore {
    void save(Path path, SessionSnapshot snapshot);
    SessionSnapshot load(Path path);
}
