package net.fiddleserver.util;

import org.slf4j.Logger;

/**
 * Centralized console logging for outbound gist API calls.
 *
 * These logs trace one gist load end to end:
 * - metadata lookup (cached or remote)
 * - raw content fetch for truncated files
 * - the final outcome handed back to the browser
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String target, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info("{} [{}] {} ATTEMPT: {} for '{}'", PREFIX, apiName, authType, operation, target);
    }

    /**
     * Log an external API call that answered, whatever its status
     */
    public static void logApiCallCompleted(Logger log, String apiName, String operation, String target, int status) {
        log.info("{} [{}] COMPLETED: {} for '{}' answered {}", PREFIX, apiName, operation, target, status);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String target, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for '{}' - {}", PREFIX, apiName, operation, target, reason);
    }

    /**
     * Log a response served from the local cache instead of the remote API
     */
    public static void logCacheHit(Logger log, String apiName, String operation, String target) {
        log.debug("{} [{}] CACHE-HIT: {} for '{}'", PREFIX, apiName, operation, target);
    }
}
