package com.agentgate.events;

import com.agentgate.shared.model.AgentEvent;

/** Producer side of an event channel. */
public interface EventSink {

    /** Blocks while the channel is full; drops the event once the consumer has gone away. */
    void emit(AgentEvent event);

    /** True once the consumer asked the run to stop. */
    boolean isCancelled();

    /** Signals that no further events will be emitted. */
    void complete();
}
