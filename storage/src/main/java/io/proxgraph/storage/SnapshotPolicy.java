// file: storage/src/main/java/io/proxgraph/storage/SnapshotPolicy.java
package io.proxgraph.storage;

import java.util.function.Supplier;

/**
 * Snapshot policy that triggers a full snapshot after every N mutations.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Not thread safe; the store calls it under its write lock.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private int sinceLast;

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each successful durable write. Snapshots when threshold is hit.
     *
     * @return the snapshot id, or null when no snapshot was taken
     */
    String maybeSnapshot(Supplier<GraphImage> image, Snapshotter snaps) {
        if (++sinceLast < everyOps) {
            return null;
        }
        sinceLast = 0;
        return snaps.writeSnapshot(image.get());
    }
}
