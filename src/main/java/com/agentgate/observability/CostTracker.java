package com.agentgate.observability;

import com.agentgate.shared.model.TokenUsage;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts token counts to USD from a per-model price table. Unknown models
 * cost nothing.
 */
public class CostTracker {

    // price per 1M tokens (USD): input, output
    private static final Map<String, double[]> DEFAULT_PRICING = Map.of(
            "gpt-4o", new double[]{2.50, 10.00},
            "gpt-4o-mini", new double[]{0.15, 0.60},
            "gpt-4.1", new double[]{2.00, 8.00},
            "gpt-4.1-mini", new double[]{0.40, 1.60},
            "deepseek-chat", new double[]{0.14, 0.28},
            "qwen3:4b", new double[]{0.0, 0.0}
    );

    private final Map<String, double[]> pricing = new ConcurrentHashMap<>(DEFAULT_PRICING);

    public void setPrice(String model, double inputPerMillion, double outputPerMillion) {
        pricing.put(model, new double[]{inputPerMillion, outputPerMillion});
    }

    public double cost(String model, long inputTokens, long outputTokens) {
        var prices = model == null ? null : pricing.get(model);
        if (prices == null) return 0.0;
        return (inputTokens * prices[0] + outputTokens * prices[1]) / 1_000_000.0;
    }

    public TokenUsage usage(String model, long inputTokens, long outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, cost(model, inputTokens, outputTokens));
    }

    public static String format(double costUsd) {
        if (Double.isNaN(costUsd)) return "$0.00";
        return String.format(Locale.ROOT, "$%.4f", costUsd);
    }
}
