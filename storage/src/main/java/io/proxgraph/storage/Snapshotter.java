// file: storage/src/main/java/io/proxgraph/storage/Snapshotter.java
package io.proxgraph.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's state at some point in time.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay the WAL, skipping records the snapshot already contains.
 */
public interface Snapshotter {

    /**
     * Persist a full image.
     *
     * @return snapshot identifier (file name).
     */
    String writeSnapshot(GraphImage image);

    /** Load the latest snapshot if present, else null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, GraphImage image) {}
}
