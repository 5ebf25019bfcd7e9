package com.agentgate.agent;

import com.agentgate.errors.SessionException;
import com.agentgate.security.Policy;
import com.agentgate.sessions.SessionSnapshot;
import com.agentgate.sessions.SessionStore;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.FileReadTool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AgentSessionTest {

    @TempDir
    Path tempDir;

    @Test
    void saveHandsSnapshotToStore() {
        var store = mock(SessionStore.class);
        var provider = new ScriptedProvider();
        provider.setTurns(List.of(Turn.user("hi"), Turn.assistant("hello")));
        try (var agent = new Agent(provider, List.of(new FileReadTool()), "Be kind.", Policy.standard(tempDir), tempDir)) {
            agent.setSessionStore(store);
            var file = tempDir.resolve("s.json");

            agent.saveSession(file);

            var captor = ArgumentCaptor.forClass(SessionSnapshot.class);
            verify(store).save(eq(file), captor.capture());
            var snapshot = captor.getValue();
            assertEquals(SessionSnapshot.CURRENT_FORMAT_VERSION, snapshot.formatVersion());
            assertEquals("scripted", snapshot.provider());
            assertEquals("scripted-model", snapshot.model());
            assertEquals("Be kind.", snapshot.systemPrompt());
            assertEquals(List.of("read_file"), snapshot.toolNames());
            assertEquals(2, snapshot.turns().size());
            assertEquals(tempDir.toAbsolutePath().normalize().toString(), snapshot.workingDir());
        }
    }

    @Test
    void loadRestoresPromptAndHistoryFromStore() {
        var store = mock(SessionStore.class);
        var file = tempDir.resolve("s.json");
        when(store.load(file)).thenReturn(new SessionSnapshot(1, "2026-01-01T00:00:00Z", "other-provider",
                "m", "/elsewhere", "Restored prompt.", List.of("run_bash"),
                List.of(Turn.user("earlier"), Turn.assistant("answer"))));
        var provider = new ScriptedProvider();
        try (var agent = new Agent(provider, Policy.standard(tempDir), tempDir)) {
            agent.setSessionStore(store);

            agent.loadSession(file);

            assertEquals("Restored prompt.", provider.systemPrompt());
            assertEquals(2, agent.turns().size());
            assertEquals("earlier", agent.turns().get(0).text());
            assertTrue(agent.policy().fileWrite().restricted());
        }
    }

    @Test
    void storeFailurePropagates() {
        var store = mock(SessionStore.class);
        doThrow(new SessionException("disk full")).when(store).save(any(), any());
        try (var agent = new Agent(new ScriptedProvider(), Policy.standard(tempDir), tempDir)) {
            agent.setSessionStore(store);
            assertThrows(SessionException.class, () -> agent.saveSession(tempDir.resolve("x.json")));
        }
    }
}
