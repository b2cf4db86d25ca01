// file: core/src/test/java/io/proxgraph/core/DevCapabilitySpec.java
package io.proxgraph.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DevCapabilitySpec {

    @Test
    void only_the_owner_is_authorized() {
        var cap = DevCapability.mint(Identity.of("deployer"));

        assertDoesNotThrow(() -> cap.authorize(Identity.of("deployer")));
        var ex = assertThrows(CapabilityMismatchException.class,
                () -> cap.authorize(Identity.of("mallory")));
        assertEquals(ErrorCode.CAPABILITY_MISMATCH, ex.code());
    }

    @Test
    void each_mint_has_a_distinct_token() {
        var a = DevCapability.mint(Identity.of("deployer"));
        var b = DevCapability.mint(Identity.of("deployer"));
        assertNotEquals(a, b);
        assertFalse(a.toString().contains(a.id()), "token id must not leak through toString");
    }
}
