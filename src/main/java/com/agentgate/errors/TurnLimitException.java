package com.agentgate.errors;

public class TurnLimitException extends AgentException {

    private final int maxTurns;

    public TurnLimitException(int maxTurns) {
        super(ErrorKind.TURN_LIMIT, "Turn limit reached: " + maxTurns);
        this.maxTurns = maxTurns;
    }

    public int maxTurns() { return maxTurns; }
}
