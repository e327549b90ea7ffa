package org.tinyasm.junit.extensions.logging;

import ch.qos.logback.classic.Level;

/**
 * Log levels the watch extension reacts to.
 */
public enum LogLevel {
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR);

    private final Level logback;

    LogLevel(Level logback) {
        this.logback = logback;
    }

    Level toLogback() {
        return logback;
    }
}
