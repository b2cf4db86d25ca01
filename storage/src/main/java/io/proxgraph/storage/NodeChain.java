// file: storage/src/main/java/io/proxgraph/storage/NodeChain.java
package io.proxgraph.storage;

import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.SnapshotId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only arena of frozen snapshots: snapshotId -> NodeSnapshot.
 * <p>
 * Every chain in the arena is acyclic because:
 *  - ids come from one monotonically increasing counter, and
 *  - a snapshot may only name a previous that is already stored, owned by the
 *    same identity, and strictly older.
 * <p>
 * Lookups are lock-free; appends are serialized by the owning store.
 */
public final class NodeChain {
    private final Map<SnapshotId, NodeSnapshot> arena = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    /** Reserve the next snapshot id. Ids are never reused, even if the append later fails. */
    SnapshotId allocateId() {
        return new SnapshotId(nextId.getAndIncrement());
    }

    /**
     * Check that {@code snapshot} may be appended without breaking the chain rules.
     *
     * @throws IllegalStateException if the id is taken or the predecessor is invalid
     */
    void validate(NodeSnapshot snapshot) {
        if (arena.containsKey(snapshot.id())) {
            throw new IllegalStateException("snapshot " + snapshot.id() + " already exists");
        }
        var prevId = snapshot.previous();
        if (prevId.isEmpty()) {
            return;
        }
        NodeSnapshot prev = arena.get(prevId.get());
        if (prev == null) {
            throw new IllegalStateException("unknown previous snapshot " + prevId.get());
        }
        if (!prev.owner().equals(snapshot.owner())) {
            throw new IllegalStateException("previous snapshot " + prev.id() + " has a different owner");
        }
        if (prev.timestampMillis() >= snapshot.timestampMillis()) {
            throw new IllegalStateException("snapshot " + snapshot.id() + " at " + snapshot.timestampMillis()
                    + " is not newer than its previous at " + prev.timestampMillis());
        }
    }

    /** Validate and store. Also moves the id counter past {@code snapshot.id()} (used by recovery). */
    void append(NodeSnapshot snapshot) {
        validate(snapshot);
        arena.put(snapshot.id(), snapshot);
        nextId.accumulateAndGet(snapshot.id().value() + 1, Math::max);
    }

    boolean contains(SnapshotId id) { return arena.containsKey(id); }

    public Optional<NodeSnapshot> get(SnapshotId id) {
        return Optional.ofNullable(arena.get(id));
    }

    /**
     * Walk from {@code head} back to the root.
     *
     * @return snapshots ordered newest first; timestamps strictly decrease along the list
     */
    public List<NodeSnapshot> walk(SnapshotId head) {
        List<NodeSnapshot> out = new ArrayList<>();
        SnapshotId cursor = head;
        while (cursor != null) {
            NodeSnapshot s = arena.get(cursor);
            if (s == null) {
                throw new NoSuchElementException("snapshot " + cursor + " not found");
            }
            out.add(s);
            cursor = s.previous().orElse(null);
        }
        return out;
    }

    public int size() { return arena.size(); }

    /** All snapshots in id order; used when writing a full image. */
    List<NodeSnapshot> all() {
        List<NodeSnapshot> out = new ArrayList<>(arena.values());
        out.sort((a, b) -> a.id().compareTo(b.id()));
        return out;
    }
}
