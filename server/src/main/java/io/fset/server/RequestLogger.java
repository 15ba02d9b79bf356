// file: server/src/main/java/io/fset/server/RequestLogger.java
package io.fset.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request against the project API.
 * <p>
 * Line shape: {@code HTTP POST /projects/billing/diff -> 422 UNRESOLVED_PARENT (total=4ms, store=3ms)}.
 * Server errors go out at WARNING with the throwable, rejected diffs and other
 * client errors at INFO with their reason.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    public static void logRequest(String method, String path, int status, long totalMillis, long storeMillis,
                                  Throwable error) {
        logRequest(method, path, status, null, totalMillis, storeMillis, error);
    }

    /**
     * Log a completed request.
     *
     * @param outcome     short result tag, e.g. the {@code DiffResult.Reason} of a rejected
     *                    diff; null when the status says it all
     * @param storeMillis time spent inside {@link ProjectService}: the project lookup,
     *                    provisioning, or the whole {@code DiffReconciler} transaction;
     *                    -1 if the request never reached it
     * @param error       exception behind a 4xx/5xx, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            String outcome,
            long totalMillis,
            long storeMillis,
            Throwable error
    ) {
        StringBuilder msg = new StringBuilder()
                .append("HTTP ").append(method).append(' ').append(path)
                .append(" -> ").append(status);
        if (outcome != null) {
            msg.append(' ').append(outcome);
        }
        msg.append(" (total=").append(totalMillis).append("ms");
        if (storeMillis >= 0) {
            msg.append(", store=").append(storeMillis).append("ms");
        }
        msg.append(')');

        if (status >= 500) {
            log.log(Level.WARNING, msg.toString(), error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg.toString());
        }
    }
}
