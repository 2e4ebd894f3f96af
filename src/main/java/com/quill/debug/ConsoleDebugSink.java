package com.quill.debug;

import java.io.PrintStream;

/** Writes debug messages as single lines to a print stream (stderr by default). */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;

    public ConsoleDebugSink() {
        this(System.err);
    }

    public ConsoleDebugSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        out.println("[" + level + "] [" + tag + "] " + message);
        if (error != null) error.printStackTrace(out);
    }
}
