// file: storage/src/main/java/io/proxgraph/storage/IdentityRegistry.java
package io.proxgraph.storage;

import io.proxgraph.core.AlreadyRegisteredException;
import io.proxgraph.core.Identity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The set of identities that have registered, in registration order.
 * <p>
 * Design:
 *  - One instance per deployment, created by {@link GraphStore#initRegistry}.
 *  - Backed by a LinkedHashSet: O(1) membership while keeping insertion order.
 *  - Only the owning store mutates it, so {@link #register} is package-private.
 *  - Synthetic users never appear here.
 */
public final class IdentityRegistry {
    private final String id;
    private final Identity creator;
    private final Set<Identity> registered = new LinkedHashSet<>();

    IdentityRegistry(String id, Identity creator) {
        this.id = Objects.requireNonNull(id, "id");
        this.creator = Objects.requireNonNull(creator, "creator");
    }

    public String id() { return id; }

    public Identity creator() { return creator; }

    public synchronized boolean contains(Identity identity) {
        return registered.contains(identity);
    }

    /** Registered identities in insertion order (copy). */
    public synchronized List<Identity> registeredUsers() {
        return List.copyOf(registered);
    }

    public synchronized int size() { return registered.size(); }

    /**
     * Append {@code identity}, failing if it is already present.
     * The membership test and the append happen under one monitor.
     */
    synchronized void register(Identity identity) {
        Objects.requireNonNull(identity, "identity");
        if (!registered.add(identity)) {
            throw new AlreadyRegisteredException(identity);
        }
    }
}
