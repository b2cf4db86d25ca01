// file: core/src/main/java/io/proxgraph/core/UpdateGate.java
package io.proxgraph.core;

/**
 * Rate-limit policy for node updates.
 * <p>
 * Stateless: the only inputs are the supplied clock reading and the timestamp
 * of the snapshot the record currently points to. The boundary is inclusive,
 * so an update exactly {@link #MIN_INTERVAL_MILLIS} after the last one passes.
 */
public final class UpdateGate {

    /** Minimum spacing between two snapshots of the same record. */
    public static final long MIN_INTERVAL_MILLIS = 10_000L;

    private UpdateGate() {
        // utility
    }

    /**
     * @return true when at least MIN_INTERVAL_MILLIS separates the two readings
     * @throws ClockRegressionException if {@code nowMillis < lastMillis}
     */
    public static boolean allowed(long nowMillis, long lastMillis) {
        if (nowMillis < lastMillis) {
            throw new ClockRegressionException(nowMillis, lastMillis);
        }
        return nowMillis - lastMillis >= MIN_INTERVAL_MILLIS;
    }

    /** Throwing variant of {@link #allowed(long, long)}. */
    public static void check(long nowMillis, long lastMillis) {
        if (!allowed(nowMillis, lastMillis)) {
            throw new UpdateTooSoonException(nowMillis - lastMillis);
        }
    }
}
