// file: core/src/main/java/io/proxgraph/core/PeerRef.java
package io.proxgraph.core;

import java.util.Objects;

/**
 * Opaque reference to a neighbor, as supplied by the caller.
 * The graph never derives or validates peers; A listing B implies nothing about B.
 */
public record PeerRef(String value) {

    public PeerRef {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("peer reference must not be blank");
    }

    public static PeerRef of(String value) { return new PeerRef(value); }

    @Override
    public String toString() { return value; }
}
