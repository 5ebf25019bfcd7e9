package com.agentgate.hooks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Failures of hook callbacks, kept so callers can inspect them after a run. */
public class HookErrorLog {

    private final List<HookFailure> failures = new ArrayList<>();

    synchronized HookFailure record(HookEvent event, String toolName, String message) {
        var failure = new HookFailure(event, toolName, message, Instant.now());
        failures.add(failure);
        return failure;
    }

    public synchronized List<HookFailure> failures() {
        return List.copyOf(failures);
    }

    public synchronized int size() {
        return failures.size();
    }

    public synchronized boolean isEmpty() {
        return failures.isEmpty();
    }

    public synchronized void clear() {
        failures.clear();
    }
}
