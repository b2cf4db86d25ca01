// file: core/src/main/java/io/proxgraph/core/NodeContents.java
package io.proxgraph.core;

import java.util.List;
import java.util.Objects;

/**
 * The cached "current" view of a user record: neighbors plus the time they were published.
 * Always equal to the contents of the snapshot the record's head points to.
 */
public record NodeContents(List<PeerRef> neighbors, long timestampMillis) {

    public NodeContents {
        neighbors = List.copyOf(Objects.requireNonNull(neighbors, "neighbors"));
        if (timestampMillis < 0) throw new IllegalArgumentException("timestamp must be >= 0");
    }
}
