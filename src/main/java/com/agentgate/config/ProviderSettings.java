package com.agentgate.config;

import com.agentgate.observability.CostTracker;
import com.agentgate.providers.ModelProvider;
import com.agentgate.providers.OpenAiCompatibleProvider;

import java.time.Duration;
import java.util.Locale;

/** Which OpenAI-compatible endpoint to talk to. Blank fields take the per-provider defaults. */
public record ProviderSettings(String id, String model, String baseUrl, String apiKey, int timeoutSeconds) {

    public static ProviderSettings defaults() {
        return new ProviderSettings("openai", null, null, null, 60);
    }

    public ProviderSettings withModel(String model) {
        return new ProviderSettings(id, model, baseUrl, apiKey, timeoutSeconds);
    }

    public ModelProvider createProvider() {
        var name = id == null || id.isBlank() ? "openai" : id.strip().toLowerCase(Locale.ROOT);
        String url;
        String defaultModel;
        String key = apiKey;
        switch (name) {
            case "openai" -> {
                url = "https://api.openai.com/v1";
                defaultModel = "gpt-4o-mini";
            }
            case "deepseek" -> {
                url = "https://api.deepseek.com/v1";
                defaultModel = "deepseek-chat";
            }
            case "ollama" -> {
                url = "http://localhost:11434/v1";
                defaultModel = "qwen3:4b";
                if (isBlank(key)) key = "ollama";
            }
            default -> {
                if (isBlank(baseUrl)) {
                    throw new IllegalArgumentException("Provider '" + id + "' needs a base-url");
                }
                url = baseUrl;
                defaultModel = null;
            }
        }
        if (!isBlank(baseUrl)) url = baseUrl;
        var chosenModel = isBlank(model) ? defaultModel : model;
        if (isBlank(chosenModel)) throw new IllegalArgumentException("Provider '" + id + "' needs a model");
        if (isBlank(key)) throw new IllegalArgumentException("Provider '" + name + "' needs an api-key");
        return new OpenAiCompatibleProvider(name, key, url, chosenModel,
                Duration.ofSeconds(timeoutSeconds > 0 ? timeoutSeconds : 60), new CostTracker());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
