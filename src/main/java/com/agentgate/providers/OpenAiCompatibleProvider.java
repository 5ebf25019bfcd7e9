package com.agentgate.providers;

import com.agentgate.errors.ProviderException;
import com.agentgate.observability.CostTracker;
import com.agentgate.shared.model.TextContent;
import com.agentgate.shared.model.TokenUsage;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.ToolResult;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.Tool;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Chat Completions transport for OpenAI and the many servers that speak the
 * same wire format (DeepSeek, Ollama, vLLM, ...).
 */
public class OpenAiCompatibleProvider extends AbstractModelProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProvider.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final String id;
    private final String apiKey;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final CostTracker costTracker;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiCompatibleProvider(String id, String apiKey, String baseUrl, String model) {
        this(id, apiKey, baseUrl, model, Duration.ofSeconds(60), new CostTracker());
    }

    public OpenAiCompatibleProvider(String id, String apiKey, String baseUrl, String model,
                                    Duration requestTimeout, CostTracker costTracker) {
        super(model, null);
        this.id = id;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.requestTimeout = requestTimeout;
        this.costTracker = costTracker;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public static OpenAiCompatibleProvider openAi(String apiKey, String model) {
        return new OpenAiCompatibleProvider("openai", apiKey, "https://api.openai.com/v1", model);
    }

    public static OpenAiCompatibleProvider deepSeek(String apiKey) {
        return new OpenAiCompatibleProvider("deepseek", apiKey, "https://api.deepseek.com/v1", "deepseek-chat");
    }

    public static OpenAiCompatibleProvider ollama(String model) {
        return new OpenAiCompatibleProvider("ollama", "ollama", "http://localhost:11434/v1", model,
                Duration.ofSeconds(120), new CostTracker());
    }

    @Override public String id() { return id; }

    @Override
    protected AbstractModelProvider copy() {
        return new OpenAiCompatibleProvider(id, apiKey, baseUrl, model(), requestTimeout, costTracker);
    }

    @Override
    protected Completion complete(String systemPrompt, List<Turn> conversation, List<Tool> tools) {
        try {
            var resp = httpClient.send(request(systemPrompt, conversation, tools, false),
                    HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ProviderException("LLM API error " + resp.statusCode() + ": " + resp.body());
            }
            var body = resp.body().trim();
            if (body.startsWith("{")) {
                return parseResponse(mapper.readTree(body));
            }
            var sse = new SseAccumulator();
            for (var line : body.split("\n")) sse.accept(line);
            return sse.completion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for " + id, e);
        } catch (IOException e) {
            throw new ProviderException("LLM request to " + id + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    protected ReplyStream openStream(String systemPrompt, List<Turn> conversation, List<Tool> tools) {
        HttpResponse<Stream<String>> resp;
        try {
            resp = httpClient.send(request(systemPrompt, conversation, tools, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for " + id, e);
        } catch (IOException e) {
            throw new ProviderException("LLM stream to " + id + " failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            String body;
            try (var lines = resp.body()) {
                body = lines.collect(Collectors.joining("\n"));
            }
            throw new ProviderException("LLM API error " + resp.statusCode() + ": " + body);
        }
        return new SseReplyStream(resp.body());
    }

    private HttpRequest request(String systemPrompt, List<Turn> conversation, List<Tool> tools, boolean stream)
            throws IOException {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", model());
        body.put("messages", messages(systemPrompt, conversation));
        var toolDefs = toolDefinitions(tools);
        if (!toolDefs.isEmpty()) body.put("tools", toolDefs);
        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
    }

    List<Map<String, Object>> messages(String systemPrompt, List<Turn> conversation) throws IOException {
        var messages = new ArrayList<Map<String, Object>>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        for (var turn : conversation) {
            switch (turn.role()) {
                case SYSTEM -> messages.add(Map.of("role", "system", "content", turn.text()));
                case ASSISTANT -> messages.add(assistantMessage(turn));
                case USER -> {
                    var results = turn.contents().stream()
                            .filter(ToolResult.class::isInstance)
                            .map(ToolResult.class::cast)
                            .toList();
                    for (var r : results) {
                        messages.add(Map.of(
                                "role", "tool",
                                "tool_call_id", r.requestId(),
                                "content", r.failed() ? "Error: " + r.error() : String.valueOf(r.value())));
                    }
                    var text = turn.contents().stream()
                            .filter(TextContent.class::isInstance)
                            .map(c -> ((TextContent) c).text())
                            .collect(Collectors.joining());
                    if (results.isEmpty() || !text.isEmpty()) {
                        messages.add(Map.of("role", "user", "content", text));
                    }
                }
            }
        }
        return messages;
    }

    private Map<String, Object> assistantMessage(Turn turn) throws IOException {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", "assistant");
        msg.put("content", turn.text());
        var requests = turn.toolRequests();
        if (!requests.isEmpty()) {
            var tcList = new ArrayList<Map<String, Object>>();
            for (var tc : requests) {
                tcList.add(Map.of(
                        "id", tc.id(),
                        "type", "function",
                        "function", Map.of(
                                "name", tc.name(),
                                "arguments", mapper.writeValueAsString(tc.arguments()))));
            }
            msg.put("tool_calls", tcList);
        }
        return msg;
    }

    private List<Map<String, Object>> toolDefinitions(List<Tool> tools) {
        var defs = new ArrayList<Map<String, Object>>();
        for (var t : tools) {
            var fn = new LinkedHashMap<String, Object>();
            fn.put("name", t.name());
            fn.put("description", t.description());
            fn.put("parameters", mapper.convertValue(t.inputSchema(), Map.class));
            defs.add(Map.of("type", "function", "function", fn));
        }
        return defs;
    }

    private Completion parseResponse(JsonNode root) {
        var choice = root.path("choices").path(0).path("message");
        var content = choice.path("content").asText("");
        var requests = new ArrayList<ToolRequest>();
        var tcNode = choice.path("tool_calls");
        if (tcNode.isArray()) {
            for (var tc : tcNode) {
                var fn = tc.path("function");
                requests.add(new ToolRequest(
                        tc.path("id").asText(),
                        fn.path("name").asText(),
                        parseArguments(fn.path("arguments").asText(""))));
            }
        }
        return new Completion(content, requests, usage(root.path("usage")));
    }

    private TokenUsage usage(JsonNode u) {
        return costTracker.usage(model(),
                u.path("prompt_tokens").asLong(0),
                u.path("completion_tokens").asLong(0));
    }

    Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            var parsed = mapper.readValue(json, ARGS_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (IOException e) {
            log.warn("Model sent malformed tool arguments: {}", json);
            return Map.of("_raw", json);
        }
    }

    /** Accumulates Server-Sent Events chunks into text deltas and a final completion. */
    private final class SseAccumulator {
        private final StringBuilder content = new StringBuilder();
        private final Map<Integer, String[]> toolCalls = new LinkedHashMap<>();
        private final Map<Integer, StringBuilder> toolCallArgs = new LinkedHashMap<>();
        private TokenUsage tokens = TokenUsage.ZERO;
        private boolean done;

        /** Returns the text delta carried by the line, or {@code null}. */
        String accept(String line) {
            line = line.trim();
            if (done || !line.startsWith("data:")) return null;
            var data = line.substring(5).trim();
            if ("[DONE]".equals(data)) {
                done = true;
                return null;
            }
            JsonNode node;
            try {
                node = mapper.readTree(data);
            } catch (IOException e) {
                throw new ProviderException("Malformed stream chunk from " + id + ": " + data, e);
            }
            var u = node.path("usage");
            if (u.has("prompt_tokens")) tokens = usage(u);

            var delta = node.path("choices").path(0).path("delta");
            var tcs = delta.path("tool_calls");
            if (tcs.isArray()) {
                for (var tc : tcs) {
                    int idx = tc.path("index").asInt(0);
                    var tcId = tc.path("id").asText(null);
                    var fn = tc.path("function");
                    if (tcId != null && !toolCalls.containsKey(idx)) {
                        toolCalls.put(idx, new String[]{tcId, fn.path("name").asText(null)});
                        toolCallArgs.put(idx, new StringBuilder());
                    }
                    var args = fn.path("arguments").asText(null);
                    if (args != null && toolCallArgs.containsKey(idx)) {
                        toolCallArgs.get(idx).append(args);
                    }
                }
            }
            var c = delta.path("content");
            if (c.isTextual() && !c.asText().isEmpty()) {
                content.append(c.asText());
                return c.asText();
            }
            return null;
        }

        Completion completion() {
            var requests = new ArrayList<ToolRequest>();
            for (var entry : toolCalls.entrySet()) {
                var v = entry.getValue();
                requests.add(new ToolRequest(v[0], v[1],
                        parseArguments(toolCallArgs.get(entry.getKey()).toString())));
            }
            return new Completion(content.toString(), requests, tokens);
        }
    }

    private final class SseReplyStream implements ReplyStream {
        private final Stream<String> body;
        private final Iterator<String> lines;
        private final SseAccumulator sse = new SseAccumulator();
        private String nextDelta;
        private boolean closed;

        SseReplyStream(Stream<String> body) {
            this.body = body;
            this.lines = body.iterator();
        }

        @Override
        public boolean hasNext() {
            while (nextDelta == null && !closed) {
                if (!lines.hasNext() || sse.done) {
                    close();
                } else {
                    try {
                        nextDelta = sse.accept(lines.next());
                    } catch (RuntimeException e) {
                        close();
                        throw e;
                    }
                }
            }
            return nextDelta != null;
        }

        @Override
        public String next() {
            if (!hasNext()) throw new NoSuchElementException();
            var delta = nextDelta;
            nextDelta = null;
            return delta;
        }

        @Override
        public Completion completion() {
            return sse.completion();
        }

        private void close() {
            closed = true;
            body.close();
        }
    }
}
