// file: core/src/main/java/io/proxgraph/core/AlreadyRegisteredException.java
package io.proxgraph.core;

/** The identity already holds a registry entry. */
public final class AlreadyRegisteredException extends GraphException {
    private final Identity identity;

    public AlreadyRegisteredException(Identity identity) {
        super(ErrorCode.ALREADY_REGISTERED, "identity already registered: " + identity);
        this.identity = identity;
    }

    public Identity identity() { return identity; }
}
