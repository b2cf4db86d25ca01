// file: storage/src/main/java/io/proxgraph/storage/GraphImage.java
package io.proxgraph.storage;

import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;
import io.proxgraph.core.SnapshotId;

import java.util.List;
import java.util.Objects;

/**
 * Full copy of the store's state at one point in time, as written by a {@link Snapshotter}.
 * The registry fields are all null when the registry has not been created yet.
 */
public record GraphImage(
        String registryId,
        Identity creator,
        String capabilityId,
        List<Identity> registered,
        List<NodeSnapshot> snapshots,
        List<UserImage> users
) {

    public GraphImage {
        registered = List.copyOf(registered);
        snapshots = List.copyOf(snapshots);
        users = List.copyOf(users);
    }

    public boolean hasRegistry() { return registryId != null; }

    /** Persisted form of a {@link UserRecord}; contents are re-derived from the head snapshot. */
    public record UserImage(String userId, Identity owner, boolean synthetic, SnapshotId head) {
        public UserImage {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(head, "head");
        }
    }
}
