// file: core/src/main/java/io/proxgraph/core/EventSink.java
package io.proxgraph.core;

/**
 * Receiver for {@link GraphEvent}s.
 * <p>
 * Called synchronously on the mutating thread, after the mutation is durable.
 * Implementations should be quick and must not call back into the service.
 */
@FunctionalInterface
public interface EventSink {

    void emit(GraphEvent event);

    /** Sink that drops everything. */
    static EventSink discard() { return e -> { }; }
}
