package com.agentgate.errors;

import java.util.Locale;

public class BudgetExceededException extends AgentException {

    private final double costUsd;
    private final double maxCostUsd;

    public BudgetExceededException(double costUsd, double maxCostUsd) {
        super(ErrorKind.BUDGET_EXCEEDED,
                String.format(Locale.ROOT, "Cost limit reached: $%.4f of $%.4f", costUsd, maxCostUsd));
        this.costUsd = costUsd;
        this.maxCostUsd = maxCostUsd;
    }

    public double costUsd() { return costUsd; }

    public double maxCostUsd() { return maxCostUsd; }
}
