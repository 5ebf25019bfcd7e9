package com.agentgate.errors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentExceptionTest {

    @Test
    void budgetMessageUsesFourDecimals() {
        var e = new BudgetExceededException(1.5, 1.0);
        assertEquals("Cost limit reached: $1.5000 of $1.0000", e.getMessage());
        assertEquals(ErrorKind.BUDGET_EXCEEDED, e.kind());
        assertEquals(1.5, e.costUsd());
    }

    @Test
    void kindsIdentifyTheFailure() {
        assertEquals(ErrorKind.TURN_LIMIT, new TurnLimitException(5).kind());
        assertEquals("Turn limit reached: 5", new TurnLimitException(5).getMessage());

        var denied = new PermissionDeniedException("run_bash", "Bash command execution is not allowed");
        assertEquals(ErrorKind.PERMISSION_DENIED, denied.kind());
        assertEquals("run_bash", denied.toolName());
        assertFalse(denied.interrupt());
        assertTrue(new PermissionDeniedException("x", "no", true).interrupt());
    }

    @Test
    void causeIsKept() {
        var cause = new java.io.IOException("disk");
        var e = new SessionException("Failed to save session: s.json", cause);
        assertSame(cause, e.getCause());
        assertEquals(ErrorKind.SESSION, e.kind());
        assertInstanceOf(AgentException.class, new ProviderException("x"));
    }
}
