package com.agentgate.agent;

/** Snapshot of a run's consumption against its ceilings; a {@code null} ceiling is unlimited. */
public record BudgetState(int turnsUsed, double costUsed, Integer maxTurns, Double maxCostUsd) {}
