package com.agentgate.agent;

import com.agentgate.shared.model.ToolRequest;
import com.agentgate.shared.model.Turn;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flags an agent that keeps producing the same reply. Advisory only: the loop
 * emits a warning and carries on.
 */
public class StallDetector {

    private final int window;
    private final Deque<String> signatures = new ArrayDeque<>();

    public StallDetector() {
        this(2);
    }

    public StallDetector(int window) {
        if (window < 2) throw new IllegalArgumentException("window must be >= 2, got " + window);
        this.window = window;
    }

    public void reset() {
        signatures.clear();
    }

    /** Records the turn and returns true when the last {@code window} turns were identical. */
    public boolean observe(Turn turn) {
        var text = normalize(turn.text());
        signatures.addLast(text + "\u0000" + toolSignature(turn));
        while (signatures.size() > window) signatures.removeFirst();
        if (text.isEmpty() || signatures.size() < window) return false;
        var first = signatures.peekFirst();
        return signatures.stream().allMatch(first::equals);
    }

    static String normalize(String text) {
        if (text == null) return "";
        return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String toolSignature(Turn turn) {
        return turn.toolRequests().stream()
                .map(StallDetector::signature)
                .sorted()
                .collect(Collectors.joining("|"));
    }

    private static String signature(ToolRequest request) {
        Map<String, Object> sorted = new TreeMap<>(request.arguments());
        return request.name() + sorted;
    }
}
