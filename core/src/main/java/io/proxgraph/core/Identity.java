// file: core/src/main/java/io/proxgraph/core/Identity.java
package io.proxgraph.core;

import java.util.Objects;

/**
 * Opaque, already-authenticated account reference.
 * <p>
 * Equality is by value. Nothing in this project verifies an identity; the
 * transport in front of the service is expected to have done that.
 */
public record Identity(String value) {

    public Identity {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("identity must not be blank");
    }

    public static Identity of(String value) { return new Identity(value); }

    @Override
    public String toString() { return value; }
}
