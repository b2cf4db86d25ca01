// file: core/src/main/java/io/proxgraph/core/NodeSnapshot.java
package io.proxgraph.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one owner's neighbor set at a point in time.
 * <p>
 * Snapshots form a backward-linked chain per owner:
 *  - previous is absent for the root created at registration,
 *  - otherwise previous names an earlier snapshot with a strictly smaller timestamp.
 * <p>
 * There are no forward pointers; history is walked from the live head towards the root.
 * Thread safe by construction, so published snapshots are shared without locking.
 */
public final class NodeSnapshot {
    private final SnapshotId id;
    private final Identity owner;
    private final List<PeerRef> neighbors;
    private final long timestampMillis;
    private final SnapshotId previous; // null for a root

    public NodeSnapshot(SnapshotId id,
                        Identity owner,
                        List<PeerRef> neighbors,
                        long timestampMillis,
                        SnapshotId previous) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.neighbors = List.copyOf(Objects.requireNonNull(neighbors, "neighbors"));
        if (timestampMillis < 0) throw new IllegalArgumentException("timestamp must be >= 0");
        this.timestampMillis = timestampMillis;
        if (previous != null && previous.compareTo(id) >= 0) {
            throw new IllegalArgumentException("previous " + previous + " must precede " + id);
        }
        this.previous = previous;
    }

    public SnapshotId id() { return id; }

    public Identity owner() { return owner; }

    /** Read-only neighbor list, in the order the caller supplied it. */
    public List<PeerRef> neighbors() { return neighbors; }

    public long timestampMillis() { return timestampMillis; }

    public Optional<SnapshotId> previous() { return Optional.ofNullable(previous); }

    public boolean isRoot() { return previous == null; }

    /** The neighbors/timestamp pair a user record caches for this snapshot. */
    public NodeContents contents() { return new NodeContents(neighbors, timestampMillis); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeSnapshot s)) return false;
        return timestampMillis == s.timestampMillis
                && id.equals(s.id)
                && owner.equals(s.owner)
                && neighbors.equals(s.neighbors)
                && Objects.equals(previous, s.previous);
    }

    @Override
    public int hashCode() { return Objects.hash(id, owner, neighbors, timestampMillis, previous); }

    @Override
    public String toString() {
        return "NodeSnapshot{id=" + id + ", owner=" + owner + ", neighbors=" + neighbors
                + ", ts=" + timestampMillis + ", previous=" + previous + "}";
    }
}
