package com.quill.debug;

/** Severity of a debug message, ordered from most to least verbose. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public boolean allows(DebugLevel message) {
        return this != OFF && message != OFF && message.ordinal() >= ordinal();
    }
}
