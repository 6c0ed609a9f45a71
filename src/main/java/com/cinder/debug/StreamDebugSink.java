package com.cinder.debug;

import java.io.PrintStream;

/** Writes debug lines at or above a threshold to a print stream, e.g. stderr for the CLI. */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public StreamDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.DEBUG : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        synchronized (out) {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
