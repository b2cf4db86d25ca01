// file: storage/src/main/java/io/proxgraph/storage/GraphRecord.java
package io.proxgraph.storage;

import io.proxgraph.core.Identity;
import io.proxgraph.core.NodeSnapshot;

/**
 * One durable mutation. Each record is written to the WAL as a single frame,
 * so a mutation is either fully replayed or not at all.
 * <p>
 * Replay is idempotent: a record whose effect is already present (for example
 * because it was captured by a full snapshot) is skipped.
 */
sealed interface GraphRecord permits GraphRecord.RegistryInit, GraphRecord.UserCreated, GraphRecord.NodeAppended {

    byte TYPE_REGISTRY_INIT = 1;
    byte TYPE_USER_CREATED = 2;
    byte TYPE_NODE_APPENDED = 3;

    /** Registry created and capability minted, atomically. */
    record RegistryInit(String registryId, Identity creator, String capabilityId) implements GraphRecord {}

    /** Registry append (when counted), root snapshot and user record, atomically. */
    record UserCreated(String userId, boolean counted, boolean synthetic, NodeSnapshot root) implements GraphRecord {}

    /** New head snapshot for an existing user. */
    record NodeAppended(String userId, NodeSnapshot snapshot) implements GraphRecord {}
}
