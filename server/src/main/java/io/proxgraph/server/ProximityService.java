// file: server/src/main/java/io/proxgraph/server/ProximityService.java
package io.proxgraph.server;

import io.proxgraph.core.CapabilityMismatchException;
import io.proxgraph.core.DevCapability;
import io.proxgraph.core.EventSink;
import io.proxgraph.core.GraphEvent;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.NotOwnerException;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;
import io.proxgraph.core.UpdateGate;
import io.proxgraph.storage.GraphStore;
import io.proxgraph.storage.IdentityRegistry;
import io.proxgraph.storage.UserRecord;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Application service for the proximity graph.
 *
 * Responsibilities:
 *  - Enforce the preconditions of every mutation (ownership, update gate,
 *    capability) before anything reaches the store.
 *  - Serialize writers per user record; the store serializes registry appends.
 *  - Emit events once the store has made a mutation durable.
 *
 * Normal path vs dev path:
 *  - registerUser / updateNode are checked against the caller's identity.
 *  - spawnSyntheticUser / syntheticUpdate replace the identity checks with the
 *    dev capability. Synthetic users never enter the registry. Synthetic updates
 *    still go through {@link UpdateGate}: the capability waives ownership, not
 *    the rate limit.
 *
 * Readers take no locks: snapshots are immutable and records publish
 * head/current atomically.
 */
public class ProximityService {
    private static final Logger log = Logger.getLogger(ProximityService.class.getName());

    private final GraphStore store;
    private final EventSink events;

    // One monitor per user record id; records are never destroyed, so neither are these.
    private final Map<String, Object> userLocks = new ConcurrentHashMap<>();

    public ProximityService(GraphStore store, EventSink events) {
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------- normal path ----------

    /**
     * Register {@code caller} with an initial neighbor set.
     *
     * @throws io.proxgraph.core.AlreadyRegisteredException if the caller is already registered
     */
    public UserRecord registerUser(List<PeerRef> neighbors, long nowMillis, Identity caller) {
        Objects.requireNonNull(caller, "caller");
        UserRecord rec = store.createUser(caller, checkNeighbors(neighbors), nowMillis, true);
        announceNewUser(rec);
        log.fine(() -> "registered " + caller + " as " + rec.id());
        return rec;
    }

    /**
     * Publish a new neighbor set for a record owned by {@code caller}.
     *
     * @throws NotOwnerException if caller is not the record's owner
     * @throws io.proxgraph.core.UpdateTooSoonException if the gate is closed
     * @throws io.proxgraph.core.ClockRegressionException if nowMillis precedes the head
     */
    public NodeSnapshot updateNode(String userId, List<PeerRef> neighbors, long nowMillis, Identity caller) {
        Objects.requireNonNull(caller, "caller");
        List<PeerRef> peers = checkNeighbors(neighbors);
        UserRecord rec = requireUser(userId);
        synchronized (lockFor(rec)) {
            if (!rec.owner().equals(caller)) {
                throw new NotOwnerException(caller, userId);
            }
            return advance(rec, peers, nowMillis);
        }
    }

    // ---------- dev capability path ----------

    /**
     * Create a user record for {@code target} without touching the registry.
     *
     * @throws CapabilityMismatchException if caller does not hold {@code cap}
     */
    public UserRecord spawnSyntheticUser(DevCapability cap,
                                         Identity target,
                                         List<PeerRef> neighbors,
                                         long nowMillis,
                                         Identity caller) {
        Objects.requireNonNull(target, "target");
        checkCapability(cap, caller);
        UserRecord rec = store.createUser(target, checkNeighbors(neighbors), nowMillis, false);
        announceNewUser(rec);
        log.info("spawned synthetic user " + rec.id() + " for " + target);
        return rec;
    }

    /**
     * Advance any record on behalf of the capability holder.
     *
     * @throws CapabilityMismatchException if caller does not hold {@code cap}
     * @throws io.proxgraph.core.UpdateTooSoonException if the gate is closed
     */
    public NodeSnapshot syntheticUpdate(DevCapability cap,
                                        String userId,
                                        List<PeerRef> neighbors,
                                        long nowMillis,
                                        Identity caller) {
        checkCapability(cap, caller);
        List<PeerRef> peers = checkNeighbors(neighbors);
        UserRecord rec = requireUser(userId);
        synchronized (lockFor(rec)) {
            return advance(rec, peers, nowMillis);
        }
    }

    // ---------- reads ----------

    public UserRecord user(String userId) {
        return requireUser(userId);
    }

    public NodeSnapshot snapshot(SnapshotId id) {
        Objects.requireNonNull(id, "id");
        return store.snapshot(id).orElseThrow(() -> new NoSuchElementException("no such snapshot: " + id));
    }

    /** The user's chain, newest first. */
    public List<NodeSnapshot> history(String userId) {
        return store.history(requireUser(userId).id());
    }

    public IdentityRegistry registry() {
        return store.registry().orElseThrow(() -> new IllegalStateException("registry has not been initialised"));
    }

    public int userCount() {
        return store.users().size();
    }

    // ---------- helpers ----------

    /** Gate, append, announce. Caller holds the record's lock. */
    private NodeSnapshot advance(UserRecord rec, List<PeerRef> peers, long nowMillis) {
        UpdateGate.check(nowMillis, rec.current().timestampMillis());
        NodeSnapshot next = store.appendNode(rec.id(), peers, nowMillis);
        events.emit(new GraphEvent.NodeUpdate(rec.id(), next.id()));
        return next;
    }

    private void announceNewUser(UserRecord rec) {
        events.emit(new GraphEvent.NewUser(rec.owner(), rec.id()));
        events.emit(new GraphEvent.NodeUpdate(rec.id(), rec.head()));
    }

    /** The presented token must be the one the store minted, and the caller must own it. */
    private void checkCapability(DevCapability cap, Identity caller) {
        Objects.requireNonNull(caller, "caller");
        DevCapability minted = store.capability()
                .orElseThrow(() -> new CapabilityMismatchException("no dev capability has been minted"));
        if (cap == null || !minted.id().equals(cap.id())) {
            throw new CapabilityMismatchException("unknown dev capability");
        }
        minted.authorize(caller);
    }

    private UserRecord requireUser(String userId) {
        Objects.requireNonNull(userId, "userId");
        return store.user(userId).orElseThrow(() -> new NoSuchElementException("no such user: " + userId));
    }

    private Object lockFor(UserRecord rec) {
        return userLocks.computeIfAbsent(rec.id(), k -> new Object());
    }

    private static List<PeerRef> checkNeighbors(List<PeerRef> neighbors) {
        if (neighbors == null) {
            throw new IllegalArgumentException("neighbors must not be null");
        }
        for (PeerRef p : neighbors) {
            if (p == null) throw new IllegalArgumentException("neighbors must not contain null");
        }
        return List.copyOf(neighbors);
    }
}
