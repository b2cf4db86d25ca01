// file: server/src/main/java/io/proxgraph/server/events/FanoutEventSink.java
package io.proxgraph.server.events;

import io.proxgraph.core.EventSink;
import io.proxgraph.core.GraphEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers each event to every subscribed sink, in subscription order.
 * <p>
 * A failing subscriber is logged and does not stop delivery to the others:
 * by the time events are emitted the mutation is already durable.
 */
public final class FanoutEventSink implements EventSink {
    private static final Logger log = Logger.getLogger(FanoutEventSink.class.getName());

    private final List<EventSink> subscribers = new CopyOnWriteArrayList<>();

    public FanoutEventSink(EventSink... initial) {
        subscribers.addAll(List.of(initial));
    }

    public void subscribe(EventSink sink) {
        subscribers.add(sink);
    }

    public boolean unsubscribe(EventSink sink) {
        return subscribers.remove(sink);
    }

    @Override
    public void emit(GraphEvent event) {
        for (EventSink s : subscribers) {
            try {
                s.emit(event);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "event subscriber failed on " + event, e);
            }
        }
    }
}
