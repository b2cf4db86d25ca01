// file: core/src/main/java/io/proxgraph/core/DevCapability.java
package io.proxgraph.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Privileged token for minting synthetic users and updates.
 * <p>
 * Invariants:
 *  - minted once, when the registry is created, and bound to the deploying identity;
 *  - the owner is final: there is no transfer operation;
 *  - the token id is a random UUID, so holding the id is what makes a presentation valid.
 */
public final class DevCapability {
    private final String id;
    private final Identity owner;

    public DevCapability(String id, Identity owner) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        if (id.isBlank()) throw new IllegalArgumentException("capability id must not be blank");
    }

    /** Issue a fresh capability for {@code deployer}. Only the store's registry init calls this. */
    public static DevCapability mint(Identity deployer) {
        return new DevCapability(UUID.randomUUID().toString(), deployer);
    }

    public String id() { return id; }

    public Identity owner() { return owner; }

    /**
     * Verify that {@code caller} is the holder of this capability.
     *
     * @throws CapabilityMismatchException otherwise
     */
    public void authorize(Identity caller) {
        if (!owner.equals(caller)) {
            throw new CapabilityMismatchException(caller + " does not hold the dev capability");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DevCapability c)) return false;
        return id.equals(c.id) && owner.equals(c.owner);
    }

    @Override
    public int hashCode() { return Objects.hash(id, owner); }

    // Never print the token id.
    @Override
    public String toString() { return "DevCapability{owner=" + owner + "}"; }
}
