// file: core/src/main/java/io/proxgraph/core/GraphException.java
package io.proxgraph.core;

import java.util.Objects;

/**
 * Base type for rejected graph operations.
 * <p>
 * A thrown GraphException always means the operation was aborted before any
 * state changed. There is no internal retry; retrying is the caller's call.
 */
public abstract class GraphException extends RuntimeException {
    private final ErrorCode code;

    protected GraphException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() { return code; }
}
