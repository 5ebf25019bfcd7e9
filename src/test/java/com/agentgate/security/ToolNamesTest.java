package com.agentgate.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolNamesTest {

    @Test
    void normalizesCaseSeparatorsAndPrefix() {
        assertEquals("read_file", ToolNames.normalize("read_file"));
        assertEquals("read_file", ToolNames.normalize("tool_read_file"));
        assertEquals("read_file", ToolNames.normalize("Tool_Read_File"));
        assertEquals("read_file", ToolNames.normalize("readFile"));
        assertEquals("read_file", ToolNames.normalize("read-file"));
        assertEquals("run_bash", ToolNames.normalize(" RUN_BASH "));
        assertEquals("http_request", ToolNames.normalize("HTTPRequest"));
        assertEquals("", ToolNames.normalize(null));
    }

    @Test
    void matchesComparesNormalizedForms() {
        assertTrue(ToolNames.matches("tool_write_file", "writeFile"));
        assertFalse(ToolNames.matches("write_file", "read_file"));
        assertFalse(ToolNames.matches(null, "x"));
    }
}
