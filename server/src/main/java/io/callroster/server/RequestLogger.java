// file: src/main/java/io/callroster/server/RequestLogger.java
package io.callroster.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP surface.
 *
 * Responsibilities:
 *  - Central place to log method/path/status and latency.
 *  - 5xx answers are logged at WARNING with their cause, everything else at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param callId      call the request addressed, or -1 if none
     * @param error       optional exception, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long callId,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)",
                method,
                path,
                status,
                totalMillis,
                callId >= 0 ? ", call=" + callId : ""
        );

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
