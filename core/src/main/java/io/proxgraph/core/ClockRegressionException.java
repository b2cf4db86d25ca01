// file: core/src/main/java/io/proxgraph/core/ClockRegressionException.java
package io.proxgraph.core;

/**
 * The supplied clock reading is earlier than the last recorded timestamp.
 * Rejected explicitly instead of letting the interval computation go negative.
 */
public final class ClockRegressionException extends GraphException {

    public ClockRegressionException(long nowMillis, long lastMillis) {
        super(ErrorCode.CLOCK_REGRESSION,
                "clock moved backwards: now=" + nowMillis + " < last=" + lastMillis);
    }
}
