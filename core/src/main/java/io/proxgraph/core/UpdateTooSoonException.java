// file: core/src/main/java/io/proxgraph/core/UpdateTooSoonException.java
package io.proxgraph.core;

/** Less than {@link UpdateGate#MIN_INTERVAL_MILLIS} has passed since the last published snapshot. */
public final class UpdateTooSoonException extends GraphException {
    private final long elapsedMillis;

    public UpdateTooSoonException(long elapsedMillis) {
        super(ErrorCode.UPDATE_TOO_SOON,
                "update too soon: " + elapsedMillis + "ms elapsed, need "
                        + UpdateGate.MIN_INTERVAL_MILLIS + "ms");
        this.elapsedMillis = elapsedMillis;
    }

    public long elapsedMillis() { return elapsedMillis; }
}
