// file: server/src/main/java/io/proxgraph/server/events/LoggingEventSink.java
package io.proxgraph.server.events;

import io.proxgraph.core.EventSink;
import io.proxgraph.core.GraphEvent;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes every graph event to the log, one line each.
 */
public final class LoggingEventSink implements EventSink {
    private static final Logger log = Logger.getLogger(LoggingEventSink.class.getName());

    private final Level level;

    public LoggingEventSink() {
        this(Level.INFO);
    }

    public LoggingEventSink(Level level) {
        this.level = level;
    }

    @Override
    public void emit(GraphEvent event) {
        if (!log.isLoggable(level)) {
            return;
        }
        log.log(level, format(event));
    }

    static String format(GraphEvent event) {
        if (event instanceof GraphEvent.RegistryCreated e) {
            return "event RegistryCreated registry=" + e.registryId() + " creator=" + e.creator();
        } else if (event instanceof GraphEvent.NewUser e) {
            return "event NewUser owner=" + e.owner() + " user=" + e.userId();
        } else if (event instanceof GraphEvent.NodeUpdate e) {
            return "event NodeUpdate user=" + e.userId() + " node=" + e.currentNode();
        }
        return "event " + event;
    }
}
