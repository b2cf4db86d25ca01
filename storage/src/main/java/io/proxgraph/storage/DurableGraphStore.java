// file: storage/src/main/java/io/proxgraph/storage/DurableGraphStore.java
package io.proxgraph.storage;

import io.proxgraph.core.AlreadyRegisteredException;
import io.proxgraph.core.DevCapability;
import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.PeerRef;
import io.proxgraph.core.SnapshotId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable graph store.
 * <p>
 * Responsibilities:
 *  - Hold the registry, the snapshot arena and all user records in memory.
 *  - On every mutation:
 *      1) Validate against current state (uniqueness, chain order).
 *      2) Encode the whole mutation as ONE WAL record.
 *      3) Append+fsync it.
 *      4) Apply it to memory.
 *      5) Rotate the WAL segment and maybe write a full snapshot.
 *    A failure in 1-3 leaves memory untouched, so no caller ever sees a
 *    half-applied mutation.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay the WAL, skipping records whose effect is already present.
 * <p>
 * Concurrency: writers are serialized on this instance; readers go straight to
 * concurrent maps and the records' volatile pointers and never block.
 */
public class DurableGraphStore implements GraphStore {
    private static final Logger log = Logger.getLogger(DurableGraphStore.class.getName());

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    private final NodeChain chain = new NodeChain();
    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();
    private volatile IdentityRegistry registry;
    private volatile DevCapability capability;

    public DurableGraphStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    @Override
    public synchronized Genesis initRegistry(Identity deployer) {
        Objects.requireNonNull(deployer, "deployer");
        if (registry != null) {
            throw new IllegalStateException("registry already initialised by " + registry.creator());
        }
        var rec = new GraphRecord.RegistryInit(
                UUID.randomUUID().toString(), deployer, DevCapability.mint(deployer).id());
        commit(rec);
        return new Genesis(registry, capability);
    }

    @Override
    public Optional<IdentityRegistry> registry() { return Optional.ofNullable(registry); }

    @Override
    public Optional<DevCapability> capability() { return Optional.ofNullable(capability); }

    @Override
    public synchronized UserRecord createUser(Identity owner,
                                              List<PeerRef> neighbors,
                                              long nowMillis,
                                              boolean countInRegistry) {
        Objects.requireNonNull(owner, "owner");
        IdentityRegistry reg = requireRegistry();
        if (countInRegistry && reg.contains(owner)) {
            throw new AlreadyRegisteredException(owner);
        }

        var root = new NodeSnapshot(chain.allocateId(), owner, neighbors, nowMillis, null);
        String userId = UUID.randomUUID().toString();
        commit(new GraphRecord.UserCreated(userId, countInRegistry, !countInRegistry, root));
        return users.get(userId);
    }

    @Override
    public synchronized NodeSnapshot appendNode(String userId, List<PeerRef> neighbors, long nowMillis) {
        UserRecord rec = requireUser(userId);
        var next = new NodeSnapshot(chain.allocateId(), rec.owner(), neighbors, nowMillis, rec.head());
        chain.validate(next);
        commit(new GraphRecord.NodeAppended(userId, next));
        return next;
    }

    @Override
    public Optional<UserRecord> user(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Optional<NodeSnapshot> snapshot(SnapshotId id) {
        return chain.get(id);
    }

    @Override
    public List<NodeSnapshot> history(String userId) {
        return chain.walk(requireUser(userId).head());
    }

    @Override
    public Collection<UserRecord> users() {
        return List.copyOf(users.values());
    }

    /** Number of frozen snapshots across all chains. */
    public int snapshotCount() { return chain.size(); }

    /** Force a full snapshot now, regardless of policy. */
    public synchronized String checkpoint() {
        return snaps.writeSnapshot(image());
    }

    @Override
    public synchronized void close() {
        wal.close();
    }

    // ---------- write path ----------

    /**
     * Log, then apply. Caller holds the instance lock.
     * <p>
     * Once the record is applied the mutation has happened: rotation and
     * snapshot failures after that point are logged, not thrown. The WAL
     * still holds the record, and the policy takes the next snapshot.
     */
    private void commit(GraphRecord rec) {
        wal.append(RecordCodec.encode(rec));
        apply(rec);
        try {
            wal.rotateIfNeeded();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "WAL rotation failed after committing " + rec.getClass().getSimpleName(), e);
        }
        try {
            String snap = snapPolicy.maybeSnapshot(this::image, snaps);
            if (snap != null) {
                log.info("wrote graph snapshot " + snap);
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "graph snapshot failed; recovery will replay the WAL instead", e);
        }
    }

    /**
     * Apply one record to memory. Idempotent: records already reflected in
     * memory (from a snapshot, or a duplicate frame) are skipped.
     */
    private void apply(GraphRecord rec) {
        if (rec instanceof GraphRecord.RegistryInit r) {
            if (registry != null) {
                if (!registry.id().equals(r.registryId())) {
                    throw new IllegalStateException("second registry in log: " + r.registryId());
                }
                return;
            }
            registry = new IdentityRegistry(r.registryId(), r.creator());
            capability = new DevCapability(r.capabilityId(), r.creator());
        } else if (rec instanceof GraphRecord.UserCreated u) {
            if (users.containsKey(u.userId())) {
                return;
            }
            chain.append(u.root());
            if (u.counted()) {
                requireRegistry().register(u.root().owner());
            }
            users.put(u.userId(), new UserRecord(u.userId(), u.root().owner(), u.synthetic(), u.root()));
        } else if (rec instanceof GraphRecord.NodeAppended n) {
            if (chain.contains(n.snapshot().id())) {
                return;
            }
            UserRecord user = requireUser(n.userId());
            if (!n.snapshot().previous().map(user.head()::equals).orElse(false)) {
                throw new IllegalStateException("snapshot " + n.snapshot().id()
                        + " does not extend head " + user.head() + " of " + n.userId());
            }
            chain.append(n.snapshot());
            user.repoint(n.snapshot());
        }
    }

    // ---------- recovery ----------

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records in order.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            restore(loaded.image());
            log.info("loaded graph snapshot " + loaded.id() + " with " + users.size() + " users");
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                apply(RecordCodec.decode(payload));
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Recovery failed after " + replayed + " records", e);
        }
        if (replayed > 0) {
            log.info("replayed " + replayed + " WAL records; " + users.size() + " users, "
                    + chain.size() + " snapshots");
        }
    }

    private void restore(GraphImage image) {
        if (image.hasRegistry()) {
            registry = new IdentityRegistry(image.registryId(), image.creator());
            capability = new DevCapability(image.capabilityId(), image.creator());
            for (Identity id : image.registered()) {
                registry.register(id);
            }
        }
        for (NodeSnapshot s : image.snapshots()) {
            chain.append(s);
        }
        for (GraphImage.UserImage u : image.users()) {
            NodeSnapshot head = chain.get(u.head())
                    .orElseThrow(() -> new IllegalStateException("snapshot image misses head " + u.head()));
            // Only the contents of the head matter; the chain behind it is already in the arena.
            users.put(u.userId(), new UserRecord(u.userId(), u.owner(), u.synthetic(), head));
        }
    }

    private GraphImage image() {
        IdentityRegistry reg = registry;
        DevCapability cap = capability;
        List<GraphImage.UserImage> userImages = new ArrayList<>(users.size());
        for (UserRecord u : users.values()) {
            userImages.add(new GraphImage.UserImage(u.id(), u.owner(), u.synthetic(), u.head()));
        }
        return new GraphImage(
                reg == null ? null : reg.id(),
                reg == null ? null : reg.creator(),
                cap == null ? null : cap.id(),
                reg == null ? List.of() : reg.registeredUsers(),
                chain.all(),
                userImages
        );
    }

    // ---------- helpers ----------

    private IdentityRegistry requireRegistry() {
        IdentityRegistry reg = registry;
        if (reg == null) {
            throw new IllegalStateException("registry has not been initialised");
        }
        return reg;
    }

    private UserRecord requireUser(String userId) {
        Objects.requireNonNull(userId, "userId");
        UserRecord rec = users.get(userId);
        if (rec == null) {
            throw new NoSuchElementException("no such user: " + userId);
        }
        return rec;
    }
}
