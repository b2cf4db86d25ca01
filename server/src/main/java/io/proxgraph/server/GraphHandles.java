// file: server/src/main/java/io/proxgraph/server/GraphHandles.java
package io.proxgraph.server;

import io.proxgraph.core.DevCapability;

import java.util.Objects;

/**
 * What bootstrap hands to the deployer: the registry id and the dev capability.
 * Threaded explicitly into later calls; there is no global registry.
 */
public record GraphHandles(String registryId, DevCapability capability) {
    public GraphHandles {
        Objects.requireNonNull(registryId, "registryId");
        Objects.requireNonNull(capability, "capability");
    }
}
