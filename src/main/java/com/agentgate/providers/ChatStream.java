package com.agentgate.providers;

import com.agentgate.shared.model.Turn;

import java.util.Iterator;

/**
 * Incremental text of one assistant reply. After the iterator is exhausted,
 * {@link #turn()} returns the structured turn and commits it to history.
 */
public interface ChatStream extends Iterator<ChatEvent> {
    Turn turn();
}
