package com.agentgate.events;

import com.agentgate.shared.model.AgentEvent;
import com.agentgate.shared.model.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Events of one run, in emission order. A producer thread pushes through a
 * bounded queue and blocks while the consumer lags behind. The final
 * {@link AgentEvent.Stop} ends the stream.
 */
public class EventStream implements Iterator<AgentEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    public static final int DEFAULT_CAPACITY = 256;
    private static final Object END = new Object();
    private static final long OFFER_POLL_MS = 100;

    private final BlockingQueue<Object> queue;
    private final Sink sink = new Sink();
    private volatile boolean cancelled;
    private volatile boolean closed;
    private AgentEvent next;
    private boolean finished;

    public EventStream() {
        this(DEFAULT_CAPACITY);
    }

    public EventStream(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public EventSink sink() {
        return sink;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (finished) return false;
        try {
            var item = queue.take();
            if (item == END) {
                finished = true;
                return false;
            }
            next = (AgentEvent) item;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            finished = true;
            return false;
        }
    }

    @Override
    public AgentEvent next() {
        if (!hasNext()) throw new NoSuchElementException();
        var event = next;
        next = null;
        if (event.type() == EventType.STOP) finished = true;
        return event;
    }

    /** Drains the remaining events up to and including the final stop event. */
    public List<AgentEvent> collect() {
        var events = new ArrayList<AgentEvent>();
        while (hasNext()) events.add(next());
        return events;
    }

    /** Asks the run to stop at its next iteration boundary; the stream still ends with a stop event. */
    public void cancel() {
        if (!cancelled) log.debug("Run cancellation requested");
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Cancels the run and discards any events still in flight. */
    @Override
    public void close() {
        cancel();
        closed = true;
        finished = true;
        next = null;
        queue.clear();
    }

    private final class Sink implements EventSink {

        @Override
        public void emit(AgentEvent event) {
            put(event);
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void complete() {
            put(END);
        }

        // An interrupt cancels the run but never loses an event: the consumer
        // is waiting for the final stop event.
        private void put(Object item) {
            var interrupted = false;
            try {
                while (!closed) {
                    try {
                        if (queue.offer(item, OFFER_POLL_MS, TimeUnit.MILLISECONDS)) return;
                    } catch (InterruptedException e) {
                        interrupted = true;
                        cancelled = true;
                    }
                }
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        }
    }
}
