package com.agentgate.security;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyTest {

    @Test
    void defaultsMatchStandardExpectations() {
        var policy = Policy.builder().build();
        assertEquals(PermissionMode.DEFAULT, policy.mode());
        assertTrue(policy.fileRead());
        assertTrue(policy.fileWrite().allowed());
        assertFalse(policy.bash());
        assertTrue(policy.codeExecution());
        assertFalse(policy.web());
        assertNull(policy.allowedTools());
        assertEquals(25, policy.maxTurns());
        assertNull(policy.maxCostUsd());
    }

    @Test
    void presets() {
        var dir = Path.of("/srv/work");
        assertEquals(PermissionMode.READ_ONLY, Policy.readOnly().mode());
        assertFalse(Policy.readOnly().fileWrite().allowed());
        assertEquals(dir.toAbsolutePath().normalize(), Policy.standard(dir).fileWrite().directory());
        assertEquals(PermissionMode.BYPASS_PERMISSIONS, Policy.full().mode());
        assertEquals(50, Policy.full().maxTurns());
    }

    @Test
    void fileWriteRuleFactories() {
        var open = FileWriteRule.unrestricted();
        assertTrue(open.allowed());
        assertFalse(open.restricted());

        var denied = FileWriteRule.denied();
        assertFalse(denied.allowed());
        assertFalse(denied.restricted());

        var within = FileWriteRule.within(Path.of("/srv/work/../work"));
        assertTrue(within.allowed());
        assertTrue(within.restricted());
        assertEquals(Path.of("/srv/work").toAbsolutePath().normalize(), within.directory());

        assertThrows(IllegalArgumentException.class, () -> new FileWriteRule(false, Path.of("/tmp")));
    }

    @Test
    void listsAreCopiedAndCleaned() {
        var tools = new ArrayList<>(List.of(" read_file ", "", "list_files"));
        var policy = Policy.builder().allowedTools(tools).build();
        tools.add("write_file");

        assertEquals(List.of("read_file", "list_files"), policy.allowedTools());
        assertThrows(UnsupportedOperationException.class, () -> policy.allowedTools().add("x"));
    }

    @Test
    void toBuilderDerivesWithoutChangingOriginal() {
        var original = Policy.builder().maxCostUsd(2.0).deniedTools(List.of("bash")).build();
        var derived = original.toBuilder().maxCostUsd(5.0).build();

        assertEquals(2.0, original.maxCostUsd());
        assertEquals(5.0, derived.maxCostUsd());
        assertEquals(List.of("bash"), derived.deniedTools());
        assertNull(derived.allowedTools());
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> Policy.builder().maxTurns(0));
        assertThrows(IllegalArgumentException.class, () -> Policy.builder().maxCostUsd(-1.0));
    }

    @Test
    void parsesPermissionModes() {
        assertEquals(PermissionMode.READ_ONLY, PermissionMode.parse("readonly"));
        assertEquals(PermissionMode.BYPASS_PERMISSIONS, PermissionMode.parse("bypassPermissions"));
        assertEquals(PermissionMode.ACCEPT_EDITS, PermissionMode.parse("ACCEPT_EDITS"));
        assertEquals(PermissionMode.DEFAULT, PermissionMode.parse(null));
        assertThrows(IllegalArgumentException.class, () -> PermissionMode.parse("yolo"));
    }
}
