// file: server/src/test/java/io/proxgraph/server/events/EventSinksSpec.java
package io.proxgraph.server.events;

import io.proxgraph.core.EventSink;
import io.proxgraph.core.GraphEvent;
import io.proxgraph.core.Identity;
import io.proxgraph.core.SnapshotId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventSinksSpec {

    private static final GraphEvent NEW_USER = new GraphEvent.NewUser(Identity.of("A"), "u-1");

    @Test
    void fanout_delivers_to_every_subscriber_in_order() {
        List<String> seen = new ArrayList<>();
        var fanout = new FanoutEventSink(e -> seen.add("first"));
        fanout.subscribe(e -> seen.add("second"));

        fanout.emit(NEW_USER);

        assertEquals(List.of("first", "second"), seen);
    }

    @Test
    void failing_subscriber_does_not_block_the_others() {
        List<GraphEvent> seen = new ArrayList<>();
        var fanout = new FanoutEventSink(
                e -> { throw new IllegalStateException("boom"); },
                seen::add
        );

        fanout.emit(NEW_USER);

        assertEquals(List.of(NEW_USER), seen);
    }

    @Test
    void unsubscribed_sink_stops_receiving() {
        List<GraphEvent> seen = new ArrayList<>();
        EventSink sink = seen::add;
        var fanout = new FanoutEventSink(sink);

        assertTrue(fanout.unsubscribe(sink));
        fanout.emit(NEW_USER);

        assertTrue(seen.isEmpty());
    }

    @Test
    void log_lines_name_the_event_and_its_fields() {
        assertEquals("event NodeUpdate user=u-1 node=" + new SnapshotId(7),
                LoggingEventSink.format(new GraphEvent.NodeUpdate("u-1", new SnapshotId(7))));
        assertTrue(LoggingEventSink.format(NEW_USER).startsWith("event NewUser"));
    }
}
