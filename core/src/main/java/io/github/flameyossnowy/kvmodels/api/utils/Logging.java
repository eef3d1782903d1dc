package io.github.flameyossnowy.kvmodels.api.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Library-wide logging entry point.
 * <p>
 * Warnings and errors always go to the {@code kvmodels} logger. {@link #deepInfo(Supplier)} is per-record
 * tracing and is only evaluated while {@link #ENABLED} is set.
 */
public final class Logging {
    public static volatile boolean ENABLED = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("kvmodels");

    private Logging() {
    }

    public static void info(String message) {
        LOGGER.info(message);
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }

    public static void deepInfo(Supplier<String> message) {
        if (ENABLED && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }
}
