package com.agentgate.agent;

import com.agentgate.errors.BudgetExceededException;
import com.agentgate.errors.TurnLimitException;
import com.agentgate.shared.model.StopReason;

import java.util.Optional;

/**
 * Turn and cost accounting for one run. Cost is the provider's cumulative
 * spend, so it carries over between runs of the same agent; it never goes
 * down within a run.
 */
public class BudgetTracker {

    static final double WARNING_RATIO = 0.9;

    private Integer maxTurns;
    private Double maxCostUsd;
    private int turnsUsed;
    private double costUsed;
    private boolean warned;

    public void reset(Integer maxTurns, Double maxCostUsd, double currentCost) {
        this.maxTurns = maxTurns;
        this.maxCostUsd = maxCostUsd;
        this.turnsUsed = 0;
        this.costUsed = Math.max(0.0, currentCost);
        this.warned = false;
    }

    public void recordTurn(double cumulativeCost) {
        turnsUsed++;
        if (cumulativeCost > costUsed) costUsed = cumulativeCost;
    }

    /** True the first time per run that cost reaches 90% of the ceiling without breaching it. */
    public boolean costWarningDue() {
        if (warned || maxCostUsd == null || costBreached()) return false;
        if (costUsed >= maxCostUsd * WARNING_RATIO) {
            warned = true;
            return true;
        }
        return false;
    }

    public boolean costBreached() {
        return maxCostUsd != null && costUsed >= maxCostUsd;
    }

    public boolean turnsBreached() {
        return maxTurns != null && turnsUsed >= maxTurns;
    }

    /** Cost wins over turns when both ceilings are met. */
    public Optional<StopReason> breach() {
        if (costBreached()) return Optional.of(StopReason.COST_LIMIT);
        if (turnsBreached()) return Optional.of(StopReason.MAX_TURNS);
        return Optional.empty();
    }

    /** The breach as an exception, for callers that report it as an error message. */
    public Optional<RuntimeException> breachException() {
        if (costBreached()) return Optional.of(new BudgetExceededException(costUsed, maxCostUsd));
        if (turnsBreached()) return Optional.of(new TurnLimitException(maxTurns));
        return Optional.empty();
    }

    public BudgetState state() {
        return new BudgetState(turnsUsed, costUsed, maxTurns, maxCostUsd);
    }

    public int turnsUsed() { return turnsUsed; }

    public double costUsed() { return costUsed; }
}
