package com.agentgate.providers;

import com.agentgate.errors.ProviderException;
import com.agentgate.observability.CostTracker;
import com.agentgate.shared.model.Role;
import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.ToolResult;
import com.agentgate.shared.model.Turn;
import com.agentgate.tools.FileReadTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String TEXT_REPLY = """
            {"choices":[{"message":{"role":"assistant","content":"Hello there"}}],
             "usage":{"prompt_tokens":1000,"completion_tokens":500}}
            """;

    private static final String TOOL_REPLY = """
            {"choices":[{"message":{"role":"assistant","content":null,
              "tool_calls":[{"id":"call_1","type":"function",
                "function":{"name":"read_file","arguments":"{\\"path\\":\\"a.txt\\"}"}}]}}],
             "usage":{"prompt_tokens":10,"completion_tokens":5}}
            """;

    private static final String STREAM_REPLY = """
            data: {"choices":[{"delta":{"content":"Hel"}}]}

            data: {"choices":[{"delta":{"content":"lo"}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_9","function":{"name":"read_file","arguments":"{\\"pa"}}]}}]}

            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"th\\":\\"b.txt\\"}"}}]}}]}

            data: {"choices":[],"usage":{"prompt_tokens":1000,"completion_tokens":500}}

            data: [DONE]

            """;

    private MockWebServer server;
    private OpenAiCompatibleProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new OpenAiCompatibleProvider("openai", "test-key", server.url("/v1/").toString(),
                "gpt-4o-mini", Duration.ofSeconds(5), new CostTracker());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
    }

    @Test
    void chatSendsRequestAndCommitsTurns() throws Exception {
        enqueueJson(TEXT_REPLY);
        provider.setSystemPrompt("Be brief.");
        provider.registerTools(List.of(new FileReadTool()));

        var text = provider.chat("hi");

        assertEquals("Hello there", text);
        var request = server.takeRequest();
        assertEquals("/v1/chat/completions", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        var body = MAPPER.readTree(request.getBody().readUtf8());
        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("Be brief.", body.get("messages").get(0).get("content").asText());
        assertEquals("hi", body.get("messages").get(1).get("content").asText());
        assertEquals("read_file", body.get("tools").get(0).get("function").get("name").asText());
        assertFalse(body.has("stream"));

        var turns = provider.turns();
        assertEquals(2, turns.size());
        assertEquals(Role.USER, turns.get(0).role());
        assertEquals("Hello there", turns.get(1).text());
        assertEquals(1500, provider.usage().totalTokens());
        assertEquals(0.00045, provider.usage().costUsd(), 1e-9);
    }

    @Test
    void parsesToolCallsAndNotifiesListeners() {
        enqueueJson(TOOL_REPLY);
        var seen = new ArrayList<ToolRequest>();
        provider.onToolRequest(seen::add);

        provider.chat("read a.txt");

        var requests = provider.lastTurn(Role.ASSISTANT).orElseThrow().toolRequests();
        assertEquals(List.of(new ToolRequest("call_1", "read_file", Map.of("path", "a.txt"))), requests);
        assertEquals(requests, seen);
    }

    @Test
    void streamsDeltasAndAssemblesToolCalls() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(STREAM_REPLY));

        var stream = provider.stream("go");
        var deltas = new ArrayList<String>();
        var lastDone = false;
        while (stream.hasNext()) {
            var event = stream.next();
            deltas.add(event.delta());
            lastDone = event.done();
        }
        var turn = stream.turn();

        assertEquals(List.of("Hel", "lo"), deltas);
        assertTrue(lastDone);
        assertEquals("Hello", turn.text());
        assertEquals(List.of(new ToolRequest("call_9", "read_file", Map.of("path", "b.txt"))), turn.toolRequests());
        assertEquals(0.00045, provider.usage().costUsd(), 1e-9);
        assertEquals(2, provider.turns().size());

        var body = MAPPER.readTree(server.takeRequest().getBody().readUtf8());
        assertTrue(body.get("stream").asBoolean());
        assertTrue(body.get("stream_options").get("include_usage").asBoolean());
    }

    @Test
    void errorStatusBecomesProviderException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        var e = assertThrows(ProviderException.class, () -> provider.chat("hi"));

        assertEquals("LLM API error 500: boom", e.getMessage());
        assertTrue(provider.turns().isEmpty());
    }

    @Test
    void failedStreamThenBlockingRetryKeepsOnePromptInHistory() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        enqueueJson(TEXT_REPLY);

        assertThrows(ProviderException.class, () -> provider.stream("hi"));
        provider.chat("hi");

        var turns = provider.turns();
        assertEquals(2, turns.size());
        assertEquals("hi", turns.get(0).text());
    }

    @Test
    void continuationAfterToolResultsSendsToolMessages() throws Exception {
        enqueueJson(TOOL_REPLY);
        enqueueJson(TEXT_REPLY);
        provider.chat("read a.txt");
        var request = provider.lastTurn(Role.ASSISTANT).orElseThrow().toolRequests().get(0);
        provider.addToolResults(List.of(ToolResult.success(request, "file body")));

        provider.chat(null);

        server.takeRequest();
        var messages = MAPPER.readTree(server.takeRequest().getBody().readUtf8()).get("messages");
        assertEquals(3, messages.size());
        assertEquals("assistant", messages.get(1).get("role").asText());
        assertEquals("call_1", messages.get(1).get("tool_calls").get(0).get("id").asText());
        assertEquals("tool", messages.get(2).get("role").asText());
        assertEquals("call_1", messages.get(2).get("tool_call_id").asText());
        assertEquals("file body", messages.get(2).get("content").asText());
    }

    @Test
    void summarizeLeavesHistoryAlone() throws Exception {
        enqueueJson(TEXT_REPLY);

        var summary = provider.summarize("Summarize this");

        assertEquals("Hello there", summary);
        assertTrue(provider.turns().isEmpty());
        assertEquals(1500, provider.usage().totalTokens());
        var messages = MAPPER.readTree(server.takeRequest().getBody().readUtf8()).get("messages");
        assertEquals(AbstractModelProvider.SUMMARY_SYSTEM_PROMPT, messages.get(0).get("content").asText());
    }

    @Test
    void forkStartsEmptyOnSameModel() {
        provider.setTurns(List.of(Turn.user("old"), Turn.assistant("reply")));

        var child = provider.fork("You are a reader.");

        assertEquals("gpt-4o-mini", child.model());
        assertEquals("openai", child.id());
        assertEquals("You are a reader.", child.systemPrompt());
        assertTrue(child.turns().isEmpty());
        assertEquals(2, provider.turns().size());
    }

    @Test
    void failedToolResultsAreMarkedAsErrors() throws Exception {
        var request = new ToolRequest("c1", "read_file", Map.of());
        var conversation = List.of(Turn.toolResults(List.of(ToolResult.failure(request, "File not found: x"))));

        var messages = provider.messages(null, conversation);

        assertEquals(1, messages.size());
        assertEquals("Error: File not found: x", messages.get(0).get("content"));
    }

    @Test
    void malformedArgumentsAreKeptRaw() {
        assertEquals(Map.of("_raw", "{not json"), provider.parseArguments("{not json"));
        assertEquals(Map.of(), provider.parseArguments(""));
    }
}
