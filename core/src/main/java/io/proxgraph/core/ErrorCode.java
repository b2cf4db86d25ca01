// file: core/src/main/java/io/proxgraph/core/ErrorCode.java
package io.proxgraph.core;

/**
 * Stable, transport-independent names for every precondition failure.
 * The HTTP layer puts these on the wire; tests assert on them.
 */
public enum ErrorCode {
    ALREADY_REGISTERED,
    NOT_OWNER,
    UPDATE_TOO_SOON,
    CAPABILITY_MISMATCH,
    CLOCK_REGRESSION
}
