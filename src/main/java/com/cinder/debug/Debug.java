package com.cinder.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide log hub for the Cinder pipeline.
 *
 * Components log through {@code Debug.get()} with a short tag. Output goes to
 * whatever {@link DebugSink} the host installs; until then everything is dropped.
 */
public final class Debug {

    // must be initialized before INSTANCE, whose constructor reads it
    private static final DebugSink DISCARD = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(DISCARD);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code next}; null restores the discarding default. */
    public void setSink(DebugSink next) {
        sink.set(next == null ? DISCARD : next);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    /** True when a real sink is installed; lets callers skip building expensive messages. */
    public boolean enabled() {
        return sink.get() != DISCARD;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sink.get().log(level, tag, message, error);
    }
}
