// file: client/src/main/java/io/kvgate/client/RequestLogger.java
package io.kvgate.client;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per gateway call.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed gateway call.
     *
     * @param endpoint    endpoint path (e.g. /kv/range)
     * @param status      HTTP status code, or -1 if no response arrived
     * @param totalMillis wall-clock latency of the call
     * @param error       failure raised to the caller, null if none
     */
    public static void logRequest(String endpoint, int status, long totalMillis, Throwable error) {
        String msg = String.format("POST %s -> %s (total=%dms)",
                endpoint,
                status < 0 ? "no response" : Integer.toString(status),
                totalMillis);

        if (error != null) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
