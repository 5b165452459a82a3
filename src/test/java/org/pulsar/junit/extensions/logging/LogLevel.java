package org.pulsar.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can match on.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
