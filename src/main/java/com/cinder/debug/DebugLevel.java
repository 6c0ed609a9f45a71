package com.cinder.debug;

/** Severity of a debug message, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel threshold) {
        return compareTo(threshold) >= 0;
    }
}
