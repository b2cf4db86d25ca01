// file: storage/src/main/java/io/proxgraph/storage/GraphStore.java
package io.proxgraph.storage;

import io.proxgraph.core.DevCapability;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract used by the service layer.
 * <p>
 * Semantics:
 *  - Every mutating call is all-or-nothing: it is durable before it returns,
 *    and a failed call leaves no trace (no orphan snapshot, no half-registered identity).
 *  - Snapshots are frozen once stored; user records and the registry are the
 *    only mutable state, and only this store mutates them.
 *  - Mutating calls do not check ownership or the update gate; that is the
 *    caller's job. They do enforce registry uniqueness and chain ordering.
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Create the registry and mint the dev capability, bound to {@code deployer}.
     *
     * @throws IllegalStateException if the registry already exists
     */
    Genesis initRegistry(Identity deployer);

    /** The registry, if {@link #initRegistry} has run (in this process or before a restart). */
    Optional<IdentityRegistry> registry();

    /** The capability minted together with the registry. */
    Optional<DevCapability> capability();

    /**
     * Atomically:
     *  1) append {@code owner} to the registry (only if {@code countInRegistry}),
     *  2) freeze a root snapshot with {@code neighbors} at {@code nowMillis},
     *  3) publish a user record pointing at it.
     *
     * @throws io.proxgraph.core.AlreadyRegisteredException if counted and already registered
     * @throws IllegalStateException if the registry has not been created
     */
    UserRecord createUser(Identity owner, List<PeerRef> neighbors, long nowMillis, boolean countInRegistry);

    /**
     * Atomically freeze a snapshot whose previous is the record's current head and
     * repoint the record at it.
     *
     * @throws java.util.NoSuchElementException if the user does not exist
     * @throws IllegalStateException if {@code nowMillis} is not newer than the current head
     */
    NodeSnapshot appendNode(String userId, List<PeerRef> neighbors, long nowMillis);

    Optional<UserRecord> user(String userId);

    Optional<NodeSnapshot> snapshot(SnapshotId id);

    /**
     * Snapshots of a user's chain, newest first.
     *
     * @throws java.util.NoSuchElementException if the user does not exist
     */
    List<NodeSnapshot> history(String userId);

    /** All user records, real and synthetic. */
    Collection<UserRecord> users();

    /** Handles produced by {@link #initRegistry}. */
    record Genesis(IdentityRegistry registry, DevCapability capability) {}

    @Override
    void close();
}
