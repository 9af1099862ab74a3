package io.uabridge.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log-level switch for the application's own loggers.
 */
public final class LogControl {
    public static final String APP_LOGGER = "io.uabridge";

    private LogControl() {
    }

    // Quiet keeps errors only; otherwise the level falls back to logback.xml.
    public static void setQuiet(boolean quiet) {
        org.slf4j.Logger logger = LoggerFactory.getLogger(APP_LOGGER);
        if (logger instanceof Logger logback) {
            logback.setLevel(quiet ? Level.ERROR : null);
        }
    }
}
