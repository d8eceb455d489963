package org.bifgen.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can allow, expect or fail on.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
