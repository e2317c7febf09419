package com.williamcallahan.movie_discovery_engine.util;

import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

/**
 * Logging helpers that attach the exception to a formatted message.
 * Keeps the stack trace at debug level so warn lines stay readable.
 */
public final class LoggingUtils {

    private LoggingUtils() {
        // Utility class
    }

    public static void warn(Logger log, Throwable e, String format, Object... args) {
        String message = format(format, args);
        log.warn("{}: {}", message, describe(e));
        if (log.isDebugEnabled() && e != null) {
            log.debug(message, e);
        }
    }

    public static void error(Logger log, Throwable e, String format, Object... args) {
        log.error(format(format, args), e);
    }

    private static String describe(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : " - " + e.getMessage());
    }

    private static String format(String format, Object... args) {
        return MessageFormatter.arrayFormat(format, args).getMessage();
    }
}
