// file: core/src/main/java/io/proxgraph/core/CapabilityMismatchException.java
package io.proxgraph.core;

/** The caller presented a capability it does not hold, or one that was never minted. */
public final class CapabilityMismatchException extends GraphException {

    public CapabilityMismatchException(String message) {
        super(ErrorCode.CAPABILITY_MISMATCH, message);
    }
}
