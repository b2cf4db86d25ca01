// file: storage/src/main/java/io/proxgraph/storage/UserRecord.java
package io.proxgraph.storage;

import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeContents;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.SnapshotId;

import java.util.Objects;

/**
 * Mutable head-of-chain pointer for one user.
 * <p>
 * head and current are published together through a single volatile
 * reference, so a reader never sees a head whose contents differ from current.
 * Only the owning store repoints a record.
 */
public final class UserRecord {
    private final String id;
    private final Identity owner;
    private final boolean synthetic;
    private volatile Pointer pointer;

    /** Immutable (head, current) pair. */
    public record Pointer(SnapshotId head, NodeContents current) {
        public Pointer {
            Objects.requireNonNull(head, "head");
            Objects.requireNonNull(current, "current");
        }
    }

    UserRecord(String id, Identity owner, boolean synthetic, NodeSnapshot root) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.synthetic = synthetic;
        this.pointer = pointerTo(root);
    }

    public String id() { return id; }

    public Identity owner() { return owner; }

    /** True when the record was spawned through the dev capability. */
    public boolean synthetic() { return synthetic; }

    /** Consistent view of head and current. */
    public Pointer pointer() { return pointer; }

    public SnapshotId head() { return pointer.head(); }

    public NodeContents current() { return pointer.current(); }

    void repoint(NodeSnapshot next) {
        if (!next.owner().equals(owner)) {
            throw new IllegalStateException("snapshot " + next.id() + " belongs to " + next.owner() + ", not " + owner);
        }
        this.pointer = pointerTo(next);
    }

    private static Pointer pointerTo(NodeSnapshot snapshot) {
        return new Pointer(snapshot.id(), snapshot.contents());
    }

    @Override
    public String toString() {
        return "UserRecord{id=" + id + ", owner=" + owner + ", synthetic=" + synthetic + ", pointer=" + pointer + "}";
    }
}
