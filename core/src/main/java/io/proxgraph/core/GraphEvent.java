// file: core/src/main/java/io/proxgraph/core/GraphEvent.java
package io.proxgraph.core;

import java.util.Objects;

/**
 * Notifications emitted after a mutation has been applied.
 */
public sealed interface GraphEvent permits GraphEvent.RegistryCreated, GraphEvent.NewUser, GraphEvent.NodeUpdate {

    /** The registry was initialised by {@code creator}. Emitted once per deployment. */
    record RegistryCreated(String registryId, Identity creator) implements GraphEvent {
        public RegistryCreated {
            Objects.requireNonNull(registryId, "registryId");
            Objects.requireNonNull(creator, "creator");
        }
    }

    /** A user record was created, by registration or by the dev capability. */
    record NewUser(Identity owner, String userId) implements GraphEvent {
        public NewUser {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(userId, "userId");
        }
    }

    /** A user record now points at {@code currentNode}. */
    record NodeUpdate(String userId, SnapshotId currentNode) implements GraphEvent {
        public NodeUpdate {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(currentNode, "currentNode");
        }
    }
}
