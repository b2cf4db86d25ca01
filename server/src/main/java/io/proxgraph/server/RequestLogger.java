// file: server/src/main/java/io/proxgraph/server/RequestLogger.java
package io.proxgraph.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP adapter.
 *
 * Rejections (4xx) are part of normal operation and log at INFO;
 * only server faults (5xx) log at WARNING, with the stack trace when present.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis time spent inside ProximityService, or -1 if it was never reached
     * @param error         exception that produced the status, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)%s",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : "",
                error != null && status < 500 ? " " + error.getMessage() : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
