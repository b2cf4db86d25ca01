// file: core/src/main/java/io/proxgraph/core/NotOwnerException.java
package io.proxgraph.core;

/** A caller tried to advance a user record it does not own. */
public final class NotOwnerException extends GraphException {

    public NotOwnerException(Identity caller, String userId) {
        super(ErrorCode.NOT_OWNER, caller + " does not own user record " + userId);
    }
}
